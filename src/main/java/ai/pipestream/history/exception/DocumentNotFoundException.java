package ai.pipestream.history.exception;

/**
 * Thrown when a document has no version history.
 */
public class DocumentNotFoundException extends HistoryServiceException {

    public DocumentNotFoundException(String operation, String documentId) {
        super("DOCUMENT_NOT_FOUND", operation, "Document not found: " + documentId);
    }
}
