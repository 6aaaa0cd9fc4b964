package ai.pipestream.history.diff;

/**
 * One entry of a line diff.
 * <p>
 * Each variant carries exactly the fields valid for its {@link DiffType}:
 * <ul>
 *   <li>{@link Added} - a line present only on the new side</li>
 *   <li>{@link Deleted} - a line present only on the old side</li>
 *   <li>{@link Modified} - an old line replaced by a new line</li>
 *   <li>{@link Unchanged} - a line common to both sides</li>
 * </ul>
 * Line numbers are 1-based. {@link Deleted} numbers lines on the old side, every other
 * variant on the new side.
 */
public interface DiffEntry {

    DiffType type();

    int lineNumber();

    /**
     * The new-side text, or the removed text for {@link Deleted}.
     */
    String content();

    /**
     * The replaced text; only {@link Modified} has one.
     */
    default String oldContent() {
        return null;
    }

    record Added(int lineNumber, String content) implements DiffEntry {
        @Override
        public DiffType type() {
            return DiffType.ADD;
        }
    }

    record Deleted(int lineNumber, String content) implements DiffEntry {
        @Override
        public DiffType type() {
            return DiffType.DELETE;
        }
    }

    record Modified(int lineNumber, String oldContent, String content) implements DiffEntry {
        @Override
        public DiffType type() {
            return DiffType.MODIFY;
        }
    }

    record Unchanged(int lineNumber, String content) implements DiffEntry {
        @Override
        public DiffType type() {
            return DiffType.UNCHANGED;
        }
    }
}
