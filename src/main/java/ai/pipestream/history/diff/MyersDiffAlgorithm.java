package ai.pipestream.history.diff;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Linear-space Myers alignment ("An O(ND) Difference Algorithm and Its Variations", section 4b).
 * <p>
 * Every sub-range is first trimmed of its common prefix and suffix, then split at the point where
 * the forward and reverse D-paths meet. The top-level trim makes the leading unchanged run as
 * long as possible, and the trailing run as long as possible after it. Runs in O((N + M) * D)
 * time and O(N + M) space.
 */
public class MyersDiffAlgorithm implements DiffAlgorithm {

    @Override
    public int[] align(int[] source, int[] target) {
        int[] matches = new int[source.length];
        Arrays.fill(matches, -1);
        align(source, 0, source.length, target, 0, target.length, matches);
        return matches;
    }

    private void align(int[] a, int aStart, int aEnd, int[] b, int bStart, int bEnd, int[] matches) {
        while (aStart < aEnd && bStart < bEnd && a[aStart] == b[bStart]) {
            matches[aStart++] = bStart++;
        }
        while (aStart < aEnd && bStart < bEnd && a[aEnd - 1] == b[bEnd - 1]) {
            matches[--aEnd] = --bEnd;
        }
        if (aStart == aEnd || bStart == bEnd || !sharesSymbol(a, aStart, aEnd, b, bStart, bEnd)) {
            return;
        }
        bisect(a, aStart, aEnd, b, bStart, bEnd, matches);
    }

    /**
     * Linear pre-check so fully replaced ranges skip the quadratic search for a middle snake.
     */
    private static boolean sharesSymbol(int[] a, int aStart, int aEnd, int[] b, int bStart, int bEnd) {
        Set<Integer> symbols = new HashSet<>(Math.max(16, (aEnd - aStart) * 2));
        for (int i = aStart; i < aEnd; i++) {
            symbols.add(a[i]);
        }
        for (int j = bStart; j < bEnd; j++) {
            if (symbols.contains(b[j])) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds the middle of the shortest edit path and recurses on both halves.
     * Leaves the range unmatched when the two sides share no line.
     */
    private void bisect(int[] a, int aStart, int aEnd, int[] b, int bStart, int bEnd, int[] matches) {
        int n = aEnd - aStart;
        int m = bEnd - bStart;
        int maxD = (n + m + 1) / 2;
        int offset = maxD;
        int length = 2 * maxD + 2;
        int[] forward = new int[length];
        int[] reverse = new int[length];
        Arrays.fill(forward, -1);
        Arrays.fill(reverse, -1);
        forward[offset + 1] = 0;
        reverse[offset + 1] = 0;

        int delta = n - m;
        // Odd delta: the paths can only meet while extending the forward path.
        boolean front = delta % 2 != 0;
        int k1Start = 0;
        int k1End = 0;
        int k2Start = 0;
        int k2End = 0;

        for (int d = 0; d < maxD; d++) {
            for (int k1 = -d + k1Start; k1 <= d - k1End; k1 += 2) {
                int k1Offset = offset + k1;
                int x1;
                if (k1 == -d || (k1 != d && forward[k1Offset - 1] < forward[k1Offset + 1])) {
                    x1 = forward[k1Offset + 1];
                } else {
                    x1 = forward[k1Offset - 1] + 1;
                }
                int y1 = x1 - k1;
                while (x1 < n && y1 < m && a[aStart + x1] == b[bStart + y1]) {
                    x1++;
                    y1++;
                }
                forward[k1Offset] = x1;
                if (x1 > n) {
                    k1End += 2;
                } else if (y1 > m) {
                    k1Start += 2;
                } else if (front) {
                    int k2Offset = offset + delta - k1;
                    if (k2Offset >= 0 && k2Offset < length && reverse[k2Offset] != -1) {
                        int x2 = n - reverse[k2Offset];
                        if (x1 >= x2) {
                            split(a, aStart, aEnd, b, bStart, bEnd, x1, y1, matches);
                            return;
                        }
                    }
                }
            }

            for (int k2 = -d + k2Start; k2 <= d - k2End; k2 += 2) {
                int k2Offset = offset + k2;
                int x2;
                if (k2 == -d || (k2 != d && reverse[k2Offset - 1] < reverse[k2Offset + 1])) {
                    x2 = reverse[k2Offset + 1];
                } else {
                    x2 = reverse[k2Offset - 1] + 1;
                }
                int y2 = x2 - k2;
                while (x2 < n && y2 < m && a[aEnd - x2 - 1] == b[bEnd - y2 - 1]) {
                    x2++;
                    y2++;
                }
                reverse[k2Offset] = x2;
                if (x2 > n) {
                    k2End += 2;
                } else if (y2 > m) {
                    k2Start += 2;
                } else if (!front) {
                    int k1Offset = offset + delta - k2;
                    if (k1Offset >= 0 && k1Offset < length && forward[k1Offset] != -1) {
                        int x1 = forward[k1Offset];
                        int y1 = offset + x1 - k1Offset;
                        if (x1 >= n - x2) {
                            split(a, aStart, aEnd, b, bStart, bEnd, x1, y1, matches);
                            return;
                        }
                    }
                }
            }
        }
        // No line in common.
    }

    private void split(int[] a, int aStart, int aEnd, int[] b, int bStart, int bEnd,
                       int x, int y, int[] matches) {
        align(a, aStart, aStart + x, b, bStart, bStart + y, matches);
        align(a, aStart + x, aEnd, b, bStart + y, bEnd, matches);
    }
}
