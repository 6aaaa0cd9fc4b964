package ai.pipestream.history.model;

import java.time.Instant;
import java.util.List;

/**
 * Summary of a document's history.
 *
 * @param totalVersions     number of versions
 * @param totalChangedLines added, deleted and modified lines summed over consecutive versions
 * @param approximate       true when at least one consecutive pair was too large to diff
 * @param contributors      distinct authors in order of first contribution
 * @param averageSizeBytes  mean content size
 * @param createdAt         time of the first version
 * @param lastModifiedAt    time of the latest version
 */
public record VersionStatistics(
        String documentId,
        int totalVersions,
        long totalChangedLines,
        boolean approximate,
        List<String> contributors,
        double averageSizeBytes,
        Instant createdAt,
        Instant lastModifiedAt
) {

    public VersionStatistics {
        contributors = List.copyOf(contributors);
    }
}
