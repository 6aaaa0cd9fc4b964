package ai.pipestream.history.store;

import ai.pipestream.history.model.FileVersion;

import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-document log of immutable version snapshots.
 * <p>
 * Appends to one document are totally ordered and each receives a timestamp greater than every
 * earlier version of that document. Appends to different documents do not contend. Reads never
 * block and only ever observe fully committed versions.
 */
public interface VersionStore {

    /**
     * Appends a new version.
     *
     * @param message optional, {@code null} or blank for none
     * @throws ai.pipestream.history.exception.InvalidInputException if an argument is malformed
     * @throws ai.pipestream.history.exception.ConcurrencyConflictException if the write could not be serialized
     */
    FileVersion createVersion(String documentId, String content, String author, String message);

    /**
     * Appends a new version only if the current head is still {@code expectedHeadId}.
     *
     * @param expectedHeadId head version id observed by the caller, {@code null} for an empty history
     * @throws ai.pipestream.history.exception.ConcurrencyConflictException if the head has moved
     */
    FileVersion appendIfHead(String documentId, String expectedHeadId, String content, String author, String message);

    /**
     * Lists versions most recent first.
     *
     * @param cursor id of the last version already seen, {@code null} for the first page
     * @param limit  page size, {@code null} for the default
     * @throws ai.pipestream.history.exception.DocumentNotFoundException if the document has no history
     */
    VersionPage listVersions(String documentId, String cursor, Integer limit);

    /**
     * @throws ai.pipestream.history.exception.VersionNotFoundException if the id does not belong to the document
     */
    FileVersion getVersion(String documentId, String versionId);

    /**
     * @return the most recently appended version, empty for an unknown document
     */
    Optional<FileVersion> findHead(String documentId);

    /**
     * @return every version of the document, oldest first; empty for an unknown document
     */
    List<FileVersion> getHistory(String documentId);

    /**
     * @return number of documents with at least one version
     */
    long documentCount();
}
