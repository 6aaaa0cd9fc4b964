package ai.pipestream.history.events;

import java.time.Instant;

/**
 * Notification that a document's current content changed.
 *
 * @param eventId         deterministic id derived from document, operation and time
 * @param type            what caused the change
 * @param documentId      document whose head moved
 * @param versionId       the new head version
 * @param sourceVersionId for {@link ChangeType#RESTORED}, the version whose content was restored
 * @param author          who made the change
 * @param occurredAt      when the event was emitted
 */
public record DocumentChangeEvent(
        String eventId,
        ChangeType type,
        String documentId,
        String versionId,
        String sourceVersionId,
        String author,
        Instant occurredAt
) {

    public enum ChangeType {
        CREATED,
        RESTORED
    }
}
