package ai.pipestream.history.http;

import ai.pipestream.history.compare.ComparisonResult;

import java.util.List;

public record ComparisonView(
        int additions,
        int deletions,
        int modifications,
        List<DiffEntryView> diff,
        boolean changed,
        boolean coarse
) {

    static ComparisonView of(ComparisonResult result) {
        return new ComparisonView(
                result.additions(),
                result.deletions(),
                result.modifications(),
                result.diff().stream().map(DiffEntryView::of).toList(),
                result.changed(),
                result.coarse()
        );
    }
}
