package ai.pipestream.history.compare;

/**
 * Ceiling above which a comparison is reported coarsely instead of diffed line by line.
 *
 * @param maxLines    maximum line count of either side
 * @param maxBytes    maximum combined UTF-8 size of both sides
 * @param failOnLimit fail with {@code SizeLimitExceededException} instead of degrading
 */
public record ComparisonLimits(int maxLines, long maxBytes, boolean failOnLimit) {

    public ComparisonLimits {
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive: " + maxLines);
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
    }
}
