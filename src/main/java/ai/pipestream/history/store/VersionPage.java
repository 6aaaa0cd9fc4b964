package ai.pipestream.history.store;

import ai.pipestream.history.model.FileVersion;

import java.util.List;

/**
 * One page of a document's history, most recent first.
 *
 * @param versions   versions on this page
 * @param nextCursor id of the last version on this page when older versions remain, else {@code null}
 */
public record VersionPage(List<FileVersion> versions, String nextCursor) {

    public VersionPage {
        versions = List.copyOf(versions);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
