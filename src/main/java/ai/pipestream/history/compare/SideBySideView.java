package ai.pipestream.history.compare;

import java.util.List;

/**
 * Two parallel line streams, row i of the old side aligned with row i of the new side.
 */
public record SideBySideView(
        int additions,
        int deletions,
        int modifications,
        List<AlignedRow> rows,
        boolean coarse
) {

    public SideBySideView {
        rows = List.copyOf(rows);
    }
}
