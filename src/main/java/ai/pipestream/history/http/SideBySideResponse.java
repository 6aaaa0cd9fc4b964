package ai.pipestream.history.http;

import ai.pipestream.history.compare.AlignedRow;
import ai.pipestream.history.compare.SideBySideView;

import java.util.List;

/**
 * JSON shape of a side-by-side comparison. A {@code null} cell is a blank placeholder.
 */
public record SideBySideResponse(
        int additions,
        int deletions,
        int modifications,
        List<Row> rows,
        boolean coarse
) {

    public record Row(String type, AlignedRow.Cell oldSide, AlignedRow.Cell newSide) {
    }

    static SideBySideResponse of(SideBySideView view) {
        List<Row> rows = view.rows().stream()
                .map(row -> new Row(row.type().wireName(), row.oldSide(), row.newSide()))
                .toList();
        return new SideBySideResponse(view.additions(), view.deletions(), view.modifications(), rows, view.coarse());
    }
}
