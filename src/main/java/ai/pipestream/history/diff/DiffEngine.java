package ai.pipestream.history.diff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes a line-level diff between two line sequences.
 * <p>
 * Stateless and safe to share between threads. Inputs must already be split into lines with
 * consistent terminators (see {@link TextLines}).
 * <p>
 * Within each run of changed lines the removed and added lines are paired up in order: each pair
 * becomes one {@link DiffEntry.Modified}, and the surplus on either side is reported as
 * {@link DiffEntry.Deleted} or {@link DiffEntry.Added} entries after the pairs. A changed line
 * therefore counts as one modification, not as one deletion plus one addition.
 * <p>
 * The alignment is always computed in one canonical orientation of the two inputs, so
 * {@code diff(b, a)} is the exact mirror of {@code diff(a, b)}.
 */
public class DiffEngine {

    private final DiffAlgorithm algorithm;

    public DiffEngine() {
        this(new MyersDiffAlgorithm());
    }

    public DiffEngine(DiffAlgorithm algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
    }

    /**
     * Diffs {@code oldLines} against {@code newLines}.
     *
     * @param oldLines lines of the older side
     * @param newLines lines of the newer side
     * @return entries in document order, covering every line of both inputs exactly once
     */
    public List<DiffEntry> diff(List<String> oldLines, List<String> newLines) {
        Objects.requireNonNull(oldLines, "oldLines must not be null");
        Objects.requireNonNull(newLines, "newLines must not be null");

        Map<String, Integer> symbolTable = new HashMap<>();
        int[] oldSymbols = intern(oldLines, symbolTable);
        int[] newSymbols = intern(newLines, symbolTable);

        int[] oldToNew;
        if (compareLines(oldLines, newLines) <= 0) {
            oldToNew = algorithm.align(oldSymbols, newSymbols);
        } else {
            oldToNew = invert(algorithm.align(newSymbols, oldSymbols), oldLines.size());
        }
        return toEntries(oldLines, newLines, oldToNew);
    }

    private List<DiffEntry> toEntries(List<String> oldLines, List<String> newLines, int[] oldToNew) {
        int n = oldLines.size();
        int m = newLines.size();
        int[] newToOld = invert(oldToNew, m);
        List<DiffEntry> entries = new ArrayList<>(Math.max(n, m));

        int i = 0;
        int j = 0;
        while (i < n || j < m) {
            if (i < n && j < m && oldToNew[i] == j) {
                entries.add(new DiffEntry.Unchanged(j + 1, newLines.get(j)));
                i++;
                j++;
                continue;
            }
            int deleteStart = i;
            while (i < n && oldToNew[i] < 0) {
                i++;
            }
            int insertStart = j;
            while (j < m && newToOld[j] < 0) {
                j++;
            }
            appendHunk(entries, oldLines, deleteStart, i, newLines, insertStart, j);
        }
        return entries;
    }

    private static void appendHunk(List<DiffEntry> entries,
                                   List<String> oldLines, int deleteStart, int deleteEnd,
                                   List<String> newLines, int insertStart, int insertEnd) {
        int deletes = deleteEnd - deleteStart;
        int inserts = insertEnd - insertStart;
        int pairs = Math.min(deletes, inserts);
        for (int k = 0; k < pairs; k++) {
            entries.add(new DiffEntry.Modified(insertStart + k + 1,
                    oldLines.get(deleteStart + k),
                    newLines.get(insertStart + k)));
        }
        for (int k = pairs; k < deletes; k++) {
            entries.add(new DiffEntry.Deleted(deleteStart + k + 1, oldLines.get(deleteStart + k)));
        }
        for (int k = pairs; k < inserts; k++) {
            entries.add(new DiffEntry.Added(insertStart + k + 1, newLines.get(insertStart + k)));
        }
    }

    private static int[] intern(List<String> lines, Map<String, Integer> symbolTable) {
        int[] symbols = new int[lines.size()];
        for (int i = 0; i < symbols.length; i++) {
            String line = Objects.requireNonNull(lines.get(i), "lines must not contain null");
            symbols[i] = symbolTable.computeIfAbsent(line, key -> symbolTable.size());
        }
        return symbols;
    }

    private static int[] invert(int[] mapping, int targetSize) {
        int[] inverse = new int[targetSize];
        Arrays.fill(inverse, -1);
        for (int i = 0; i < mapping.length; i++) {
            if (mapping[i] >= 0) {
                inverse[mapping[i]] = i;
            }
        }
        return inverse;
    }

    /**
     * Total order on line sequences: shorter first, then lexicographic.
     */
    private static int compareLines(List<String> left, List<String> right) {
        if (left.size() != right.size()) {
            return Integer.compare(left.size(), right.size());
        }
        for (int i = 0; i < left.size(); i++) {
            int cmp = left.get(i).compareTo(right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}
