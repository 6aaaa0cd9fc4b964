package ai.pipestream.history.http;

public record ErrorResponse(
        String error,
        String operation,
        String message
) {}
