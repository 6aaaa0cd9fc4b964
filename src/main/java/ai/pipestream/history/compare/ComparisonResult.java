package ai.pipestream.history.compare;

import ai.pipestream.history.diff.DiffEntry;

import java.util.List;

/**
 * Aggregated outcome of comparing two line sequences.
 *
 * @param additions     number of {@code ADD} entries
 * @param deletions     number of {@code DELETE} entries
 * @param modifications number of {@code MODIFY} entries
 * @param diff          every entry, unchanged lines included
 * @param changed       whether the two sides differ at all
 * @param coarse        true when the size ceiling was hit; counts are zero and {@code diff} is empty
 */
public record ComparisonResult(
        int additions,
        int deletions,
        int modifications,
        List<DiffEntry> diff,
        boolean changed,
        boolean coarse
) {

    public ComparisonResult {
        diff = List.copyOf(diff);
    }

    public static ComparisonResult coarse(boolean changed) {
        return new ComparisonResult(0, 0, 0, List.of(), changed, true);
    }

    public int totalChanges() {
        return additions + deletions + modifications;
    }
}
