package ai.pipestream.history.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Generates deterministic version identifiers.
 * <p>
 * The id is a name-based UUID of {@code (documentId, versionNumber)}. Version numbers are never
 * reused within a document, so neither are ids.
 */
@ApplicationScoped
public class VersionIdGenerator {

    /** Separator used in composite key to prevent collisions. */
    private static final String SEPARATOR = "|";

    /**
     * @param documentId    owning document
     * @param versionNumber 1-based position in the document's history
     * @return the version id
     */
    public String generate(String documentId, int versionNumber) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId cannot be null or blank");
        }
        if (versionNumber < 1) {
            throw new IllegalArgumentException("versionNumber must be positive: " + versionNumber);
        }
        String composite = documentId + SEPARATOR + versionNumber;
        return UUID.nameUUIDFromBytes(composite.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
