package ai.pipestream.history.events;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Publishes document change notifications to interested collaborators.
 * <p>
 * Events are fired asynchronously as CDI events so that a slow or failing observer never
 * affects a version that has already been committed.
 */
@ApplicationScoped
public class DocumentChangeEmitter {

    private static final Logger LOG = Logger.getLogger(DocumentChangeEmitter.class);

    @Inject
    Event<DocumentChangeEvent> events;

    /**
     * Emit a Created event after a version is appended by an edit.
     *
     * @param documentId document ID
     * @param versionId  the new version
     * @param author     who saved the edit
     */
    public void emitCreated(String documentId, String versionId, String author) {
        send(DocumentChangeEvent.ChangeType.CREATED, documentId, versionId, null, author);
    }

    /**
     * Emit a Restored event after a rollback.
     *
     * @param documentId      document ID
     * @param versionId       the version created by the rollback
     * @param targetVersionId the historical version whose content was restored
     * @param author          who performed the rollback
     */
    public void emitRestored(String documentId, String versionId, String targetVersionId, String author) {
        send(DocumentChangeEvent.ChangeType.RESTORED, documentId, versionId, targetVersionId, author);
    }

    private void send(DocumentChangeEvent.ChangeType type, String documentId, String versionId,
                      String sourceVersionId, String author) {
        DocumentChangeEvent event = new DocumentChangeEvent(
                computeEventId(documentId, type.name(), versionId),
                type,
                documentId,
                versionId,
                sourceVersionId,
                author,
                Instant.now()
        );

        events.fireAsync(event).whenComplete((delivered, error) -> {
            if (error != null) {
                LOG.warnf(error, "Observer failed for %s event: documentId=%s, versionId=%s",
                        type, documentId, versionId);
            }
        });
        LOG.debugf("Emitted DocumentChangeEvent.%s: documentId=%s, versionId=%s", type, documentId, versionId);
    }

    /**
     * Compute deterministic event ID: first 32 chars of SHA-256(documentId + operation + versionId).
     * Version ids are never reused within a document, so neither are event ids.
     */
    static String computeEventId(String documentId, String operation, String versionId) {
        String input = documentId + ":" + operation + ":" + versionId;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available
            return UUID.randomUUID().toString().replace("-", "");
        }
    }
}
