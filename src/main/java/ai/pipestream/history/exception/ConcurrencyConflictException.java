package ai.pipestream.history.exception;

/**
 * Thrown when a write could not be serialized after the configured number of attempts.
 */
public class ConcurrencyConflictException extends HistoryServiceException {

    public ConcurrencyConflictException(String operation, String documentId, String reason) {
        super("CONCURRENCY_CONFLICT", operation,
                String.format("Concurrent write on document %s: %s", documentId, reason));
    }

    public ConcurrencyConflictException(String operation, String documentId, String reason, Throwable cause) {
        super("CONCURRENCY_CONFLICT", operation,
                String.format("Concurrent write on document %s: %s", documentId, reason), cause);
    }
}
