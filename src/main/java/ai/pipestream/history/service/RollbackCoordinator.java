package ai.pipestream.history.service;

import ai.pipestream.history.config.HistoryConfiguration;
import ai.pipestream.history.events.DocumentChangeEmitter;
import ai.pipestream.history.exception.ConcurrencyConflictException;
import ai.pipestream.history.exception.InvalidInputException;
import ai.pipestream.history.metrics.HistoryMetrics;
import ai.pipestream.history.model.FileVersion;
import ai.pipestream.history.store.VersionStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Restores a historical version by appending a copy of its content as the new head.
 * <p>
 * History is never rewritten: a rollback adds exactly one version and removes none. The
 * restored content is always re-read from the store, never taken from the caller.
 */
@ApplicationScoped
public class RollbackCoordinator {

    private static final Logger LOG = Logger.getLogger(RollbackCoordinator.class);

    @Inject
    VersionStore store;

    @Inject
    HistoryQueryService historyQuery;

    @Inject
    DocumentChangeEmitter changeEmitter;

    @Inject
    HistoryMetrics metrics;

    @Inject
    HistoryConfiguration config;

    /**
     * Rolls a document back to one of its versions.
     *
     * @param documentId      document to roll back
     * @param targetVersionId version whose content becomes current again
     * @param author          who performs the rollback
     * @return the newly appended version
     * @throws ai.pipestream.history.exception.VersionNotFoundException if the target does not belong to the document
     * @throws ConcurrencyConflictException if the head kept moving for every attempt
     */
    public FileVersion rollback(String documentId, String targetVersionId, String author) {
        if (author == null || author.isBlank()) {
            throw InvalidInputException.missingField("rollback", "author");
        }
        FileVersion target = historyQuery.getVersion(documentId, targetVersionId);
        String message = String.format("Rolled back to version %d (%s) created at %s",
                target.versionNumber(), target.id(), target.createdAt());

        int attempts = Math.max(1, config.rollback().maxAttempts());
        ConcurrencyConflictException lastConflict = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String expectedHeadId = store.findHead(documentId).map(FileVersion::id).orElse(null);
            try {
                FileVersion restored = store.appendIfHead(documentId, expectedHeadId, target.content(), author, message);
                metrics.recordRollback();
                LOG.infof("rollback: documentId=%s, target=%s (v%d), newVersion=%s (v%d), author=%s",
                        documentId, target.id(), target.versionNumber(), restored.id(), restored.versionNumber(), author);
                changeEmitter.emitRestored(documentId, restored.id(), target.id(), author);
                return restored;
            } catch (ConcurrencyConflictException e) {
                lastConflict = e;
                LOG.warnf("rollback conflict: documentId=%s, attempt=%d/%d, reason=%s",
                        documentId, attempt, attempts, e.getMessage());
            }
        }
        metrics.recordConcurrencyConflict();
        throw new ConcurrencyConflictException("rollback", documentId,
                "head kept moving after " + attempts + " attempts", lastConflict);
    }
}
