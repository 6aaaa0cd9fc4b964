package ai.pipestream.history.model;

import java.time.Instant;

/**
 * An immutable snapshot of a document's content.
 *
 * @param id            unique within the document's history, never reused
 * @param documentId    owning document
 * @param versionNumber 1-based position in the document's history
 * @param content       full text snapshot
 * @param contentHash   lowercase hex SHA-256 of the UTF-8 content
 * @param sizeBytes     UTF-8 size of the content
 * @param timestamp     creation time in epoch milliseconds, strictly increasing per document
 * @param author        opaque identity reference supplied by the caller
 * @param message       optional description, may be {@code null}
 */
public record FileVersion(
        String id,
        String documentId,
        int versionNumber,
        String content,
        String contentHash,
        long sizeBytes,
        long timestamp,
        String author,
        String message
) {

    public Instant createdAt() {
        return Instant.ofEpochMilli(timestamp);
    }
}
