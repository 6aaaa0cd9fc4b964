package ai.pipestream.history.service;

import ai.pipestream.history.compare.ComparisonResult;
import ai.pipestream.history.compare.SideBySideView;
import ai.pipestream.history.events.DocumentChangeEmitter;
import ai.pipestream.history.model.FileVersion;
import ai.pipestream.history.model.VersionStatistics;
import ai.pipestream.history.store.VersionPage;
import ai.pipestream.history.store.VersionStore;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Service for managing document versioning.
 *
 * Handles version control operations including:
 * - Version creation on document saves
 * - Version history retrieval
 * - Rollback to previous versions
 * - Version comparison and diffs
 */
@ApplicationScoped
public class VersionControlService {

    private static final Logger LOG = Logger.getLogger(VersionControlService.class);

    @Inject
    VersionStore store;

    @Inject
    HistoryQueryService historyQuery;

    @Inject
    RollbackCoordinator rollbackCoordinator;

    @Inject
    DocumentChangeEmitter changeEmitter;

    public VersionControlService() {
        LOG.info("VersionControlService initialized");
    }

    /**
     * Creates a new version of a document.
     *
     * @param documentId Document identifier
     * @param content Full text of the new snapshot
     * @param author User who saved the change
     * @param message Optional description of what changed
     * @return The newly created version
     */
    public Uni<FileVersion> createVersion(String documentId, String content, String author, String message) {
        LOG.debugf("createVersion called: documentId=%s, author=%s", documentId, author);
        return Uni.createFrom().item(() -> store.createVersion(documentId, content, author, message))
                .invoke(version -> changeEmitter.emitCreated(documentId, version.id(), author))
                .onFailure().invoke(throwable -> LOG.errorf(throwable, "Failed to create version: documentId=%s", documentId));
    }

    /**
     * Retrieves one page of a document's history.
     *
     * @param documentId Document identifier
     * @param cursor Id of the last version already seen, or null for the first page
     * @param limit Maximum number of versions to return, or null for the default
     * @return Versions ordered newest first
     */
    public Uni<VersionPage> listVersions(String documentId, String cursor, Integer limit) {
        LOG.debugf("listVersions called: documentId=%s, cursor=%s, limit=%s", documentId, cursor, limit);
        return Uni.createFrom().item(() -> historyQuery.listVersions(documentId, cursor, limit));
    }

    /**
     * Retrieves a specific version of a document.
     */
    public Uni<FileVersion> getVersion(String documentId, String versionId) {
        LOG.debugf("getVersion called: documentId=%s, versionId=%s", documentId, versionId);
        return Uni.createFrom().item(() -> historyQuery.getVersion(documentId, versionId));
    }

    /**
     * Retrieves the latest version of a document.
     */
    public Uni<FileVersion> getCurrentVersion(String documentId) {
        return Uni.createFrom().item(() -> historyQuery.getCurrentVersion(documentId));
    }

    /**
     * Checks if a document has version history.
     */
    public Uni<Boolean> hasVersionHistory(String documentId) {
        return Uni.createFrom().item(() -> historyQuery.hasVersionHistory(documentId));
    }

    /**
     * Compares two versions of a document.
     *
     * @param fromRef Older side, a version id or "current"
     * @param toRef Newer side, a version id or "current"
     */
    public Uni<ComparisonResult> compareVersions(String documentId, String fromRef, String toRef) {
        LOG.debugf("compareVersions called: documentId=%s, from=%s, to=%s", documentId, fromRef, toRef);
        return Uni.createFrom().item(() -> historyQuery.compare(documentId, fromRef, toRef))
                .onFailure().invoke(throwable -> LOG.errorf(throwable, "Failed to compare versions: documentId=%s", documentId));
    }

    /**
     * Compares a version with uncommitted lines supplied by the caller.
     */
    public Uni<ComparisonResult> compareWithDraft(String documentId, String baseRef, List<String> draftLines) {
        return Uni.createFrom().item(() -> historyQuery.compareWithDraft(documentId, baseRef, draftLines));
    }

    /**
     * Compares two versions and aligns them as side-by-side columns.
     */
    public Uni<SideBySideView> compareSideBySide(String documentId, String fromRef, String toRef) {
        return Uni.createFrom().item(() -> historyQuery.compareSideBySide(documentId, fromRef, toRef));
    }

    /**
     * Rolls a document back to a previous version.
     *
     * @param documentId Document identifier
     * @param targetVersionId Version to restore
     * @param author User performing the rollback
     * @return New version created from the rollback
     */
    public Uni<FileVersion> rollbackToVersion(String documentId, String targetVersionId, String author) {
        LOG.infof("rollbackToVersion called: documentId=%s, target=%s, author=%s", documentId, targetVersionId, author);
        return Uni.createFrom().item(() -> rollbackCoordinator.rollback(documentId, targetVersionId, author))
                .onFailure().invoke(throwable -> LOG.errorf(throwable, "Failed to roll back: documentId=%s, target=%s",
                        documentId, targetVersionId));
    }

    /**
     * Summarizes a document's history.
     */
    public Uni<VersionStatistics> getStatistics(String documentId) {
        return Uni.createFrom().item(() -> historyQuery.getStatistics(documentId));
    }
}
