package ai.pipestream.history.http;

import java.util.List;

/**
 * @param base  version id to compare against, or "current"; defaults to "current"
 * @param lines uncommitted content, one entry per line
 */
public record DraftCompareRequest(
        String base,
        List<String> lines
) {}
