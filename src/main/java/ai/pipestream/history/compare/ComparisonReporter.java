package ai.pipestream.history.compare;

import ai.pipestream.history.diff.DiffEngine;
import ai.pipestream.history.diff.DiffEntry;
import ai.pipestream.history.exception.SizeLimitExceededException;
import com.google.common.base.Utf8;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a raw diff into counts and a side-aligned rendering.
 * <p>
 * Holds no mutable state; a single instance serves concurrent requests.
 */
public class ComparisonReporter {

    private static final Logger LOG = Logger.getLogger(ComparisonReporter.class);

    private final DiffEngine diffEngine;
    private final ComparisonLimits limits;

    public ComparisonReporter(DiffEngine diffEngine, ComparisonLimits limits) {
        this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    /**
     * Diffs two line sequences and aggregates the result.
     * Inputs beyond the configured ceiling produce a coarse result without running the diff.
     *
     * @throws SizeLimitExceededException if the ceiling is hit and degraded results are disabled
     */
    public ComparisonResult compare(List<String> oldLines, List<String> newLines) {
        String overLimit = checkLimits(oldLines, newLines);
        if (overLimit != null) {
            if (limits.failOnLimit()) {
                throw new SizeLimitExceededException("compare", overLimit);
            }
            LOG.warnf("Comparison degraded to coarse result: %s", overLimit);
            return ComparisonResult.coarse(!oldLines.equals(newLines));
        }
        return report(diffEngine.diff(oldLines, newLines));
    }

    /**
     * Counts the entries of a diff. Unchanged entries are kept for rendering but not counted.
     */
    public ComparisonResult report(List<DiffEntry> entries) {
        int additions = 0;
        int deletions = 0;
        int modifications = 0;
        for (DiffEntry entry : entries) {
            switch (entry.type()) {
                case ADD -> additions++;
                case DELETE -> deletions++;
                case MODIFY -> modifications++;
                case UNCHANGED -> {
                }
            }
        }
        boolean changed = additions + deletions + modifications > 0;
        return new ComparisonResult(additions, deletions, modifications, entries, changed, false);
    }

    /**
     * Lays a result out as two aligned columns. Additions leave a placeholder on the old side,
     * deletions on the new side; modified and unchanged lines fill both.
     */
    public SideBySideView align(ComparisonResult result) {
        List<AlignedRow> rows = new ArrayList<>(result.diff().size());
        int oldLine = 0;
        int newLine = 0;
        for (DiffEntry entry : result.diff()) {
            switch (entry.type()) {
                case ADD -> rows.add(new AlignedRow(entry.type(), null,
                        new AlignedRow.Cell(++newLine, entry.content())));
                case DELETE -> rows.add(new AlignedRow(entry.type(),
                        new AlignedRow.Cell(++oldLine, entry.content()), null));
                case MODIFY -> rows.add(new AlignedRow(entry.type(),
                        new AlignedRow.Cell(++oldLine, entry.oldContent()),
                        new AlignedRow.Cell(++newLine, entry.content())));
                case UNCHANGED -> rows.add(new AlignedRow(entry.type(),
                        new AlignedRow.Cell(++oldLine, entry.content()),
                        new AlignedRow.Cell(++newLine, entry.content())));
            }
        }
        return new SideBySideView(result.additions(), result.deletions(), result.modifications(),
                rows, result.coarse());
    }

    private String checkLimits(List<String> oldLines, List<String> newLines) {
        int lines = Math.max(oldLines.size(), newLines.size());
        if (lines > limits.maxLines()) {
            return String.format("%d lines exceeds limit of %d", lines, limits.maxLines());
        }
        long bytes = 0;
        for (List<String> side : List.of(oldLines, newLines)) {
            for (String line : side) {
                bytes += Utf8.encodedLength(line) + 1;
                if (bytes > limits.maxBytes()) {
                    return String.format("content size exceeds limit of %d bytes", limits.maxBytes());
                }
            }
        }
        return null;
    }
}
