package ai.pipestream.history.exception;

/**
 * Thrown for oversized comparisons when degraded results are disabled.
 */
public class SizeLimitExceededException extends HistoryServiceException {

    public SizeLimitExceededException(String operation, String reason) {
        super("SIZE_LIMIT_EXCEEDED", operation, reason);
    }
}
