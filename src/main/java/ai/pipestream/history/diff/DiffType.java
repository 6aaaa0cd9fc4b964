package ai.pipestream.history.diff;

/**
 * Kind of a single line-level change.
 */
public enum DiffType {
    ADD("add"),
    DELETE("delete"),
    MODIFY("modify"),
    UNCHANGED("unchanged");

    private final String wireName;

    DiffType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Lowercase name used in serialized comparison results.
     */
    public String wireName() {
        return wireName;
    }

    public boolean isChange() {
        return this != UNCHANGED;
    }
}
