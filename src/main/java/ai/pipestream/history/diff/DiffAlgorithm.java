package ai.pipestream.history.diff;

/**
 * A line alignment algorithm.
 * <p>
 * Lines are interned to integer symbols before alignment, so implementations only compare ints.
 */
public interface DiffAlgorithm {

    /**
     * Aligns two symbol sequences along a longest common subsequence.
     *
     * @param source old-side symbols
     * @param target new-side symbols
     * @return for every source index, the matched target index or {@code -1}; matched target
     *         indexes are strictly increasing
     */
    int[] align(int[] source, int[] target);
}
