package ai.pipestream.history.compare;

import ai.pipestream.history.diff.DiffType;

/**
 * One row of a side-by-side rendering. A {@code null} side is a blank placeholder.
 */
public record AlignedRow(DiffType type, Cell oldSide, Cell newSide) {

    /**
     * A rendered line: its 1-based number on that side and its text.
     */
    public record Cell(int lineNumber, String text) {
    }

    public boolean hasOldSide() {
        return oldSide != null;
    }

    public boolean hasNewSide() {
        return newSide != null;
    }
}
