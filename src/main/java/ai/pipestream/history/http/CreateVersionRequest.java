package ai.pipestream.history.http;

public record CreateVersionRequest(
        String content,
        String message
) {}
