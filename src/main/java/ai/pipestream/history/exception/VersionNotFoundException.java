package ai.pipestream.history.exception;

/**
 * Thrown when a version id does not belong to the given document.
 */
public class VersionNotFoundException extends HistoryServiceException {

    public VersionNotFoundException(String operation, String documentId, String versionId) {
        super("VERSION_NOT_FOUND", operation,
                String.format("Version %s not found for document %s", versionId, documentId));
    }
}
