package ai.pipestream.history.http;

import ai.pipestream.history.diff.DiffEntry;

/**
 * JSON shape of one diff entry. {@code oldContent} is only present for modifications.
 */
public record DiffEntryView(
        String type,
        int lineNumber,
        String content,
        String oldContent
) {

    static DiffEntryView of(DiffEntry entry) {
        return new DiffEntryView(entry.type().wireName(), entry.lineNumber(), entry.content(), entry.oldContent());
    }
}
