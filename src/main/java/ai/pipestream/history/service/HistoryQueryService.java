package ai.pipestream.history.service;

import ai.pipestream.history.compare.ComparisonCache;
import ai.pipestream.history.compare.ComparisonReporter;
import ai.pipestream.history.compare.ComparisonResult;
import ai.pipestream.history.compare.SideBySideView;
import ai.pipestream.history.diff.TextLines;
import ai.pipestream.history.exception.DocumentNotFoundException;
import ai.pipestream.history.exception.InvalidInputException;
import ai.pipestream.history.exception.SizeLimitExceededException;
import ai.pipestream.history.metrics.HistoryMetrics;
import ai.pipestream.history.model.FileVersion;
import ai.pipestream.history.model.VersionStatistics;
import ai.pipestream.history.store.VersionPage;
import ai.pipestream.history.store.VersionStore;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read access to version history and comparisons between versions.
 * <p>
 * Version references accept either a version id or {@link #CURRENT}, which resolves to the
 * latest persisted version at call time.
 */
@ApplicationScoped
public class HistoryQueryService {

    private static final Logger LOG = Logger.getLogger(HistoryQueryService.class);

    /** Version reference resolving to the document's latest version. */
    public static final String CURRENT = "current";

    @Inject
    VersionStore store;

    @Inject
    ComparisonReporter reporter;

    @Inject
    ComparisonCache comparisonCache;

    @Inject
    HistoryMetrics metrics;

    public VersionPage listVersions(String documentId, String cursor, Integer limit) {
        return store.listVersions(documentId, cursor, limit);
    }

    public FileVersion getVersion(String documentId, String versionId) {
        return store.getVersion(documentId, versionId);
    }

    /**
     * @throws DocumentNotFoundException if the document has no versions
     */
    public FileVersion getCurrentVersion(String documentId) {
        return store.findHead(documentId)
                .orElseThrow(() -> new DocumentNotFoundException("getCurrentVersion", documentId));
    }

    public boolean hasVersionHistory(String documentId) {
        return store.findHead(documentId).isPresent();
    }

    /**
     * Compares two versions of a document.
     *
     * @param fromRef older side: a version id or {@link #CURRENT}
     * @param toRef   newer side: a version id or {@link #CURRENT}
     */
    public ComparisonResult compare(String documentId, String fromRef, String toRef) {
        FileVersion from = resolve("compare", documentId, fromRef, "from");
        FileVersion to = resolve("compare", documentId, toRef, "to");
        LOG.debugf("compare: documentId=%s, from=%s (v%d), to=%s (v%d)",
                documentId, from.id(), from.versionNumber(), to.id(), to.versionNumber());

        return comparisonCache.get(documentId, from.id(), to.id(),
                () -> timedCompare(TextLines.split(from.content()), TextLines.split(to.content())));
    }

    /**
     * Compares a persisted version with lines the caller has not committed yet.
     *
     * @param baseRef    a version id or {@link #CURRENT}
     * @param draftLines the uncommitted content, already split into lines
     */
    public ComparisonResult compareWithDraft(String documentId, String baseRef, List<String> draftLines) {
        if (draftLines == null) {
            throw InvalidInputException.missingField("compareWithDraft", "lines");
        }
        for (String line : draftLines) {
            if (line == null) {
                throw new InvalidInputException("compareWithDraft", "lines", "must not contain null entries");
            }
        }
        FileVersion base = resolve("compareWithDraft", documentId, baseRef, "base");
        LOG.debugf("compareWithDraft: documentId=%s, base=%s, draftLines=%d",
                documentId, base.id(), draftLines.size());

        List<String> normalizedDraft = draftLines.stream().map(TextLines::stripTerminator).toList();
        return timedCompare(TextLines.split(base.content()), normalizedDraft);
    }

    /**
     * Compares two versions and lays the result out as aligned old/new columns.
     */
    public SideBySideView compareSideBySide(String documentId, String fromRef, String toRef) {
        return reporter.align(compare(documentId, fromRef, toRef));
    }

    /**
     * Summarizes a document's history. Changed lines are counted between consecutive versions;
     * pairs beyond the diff ceiling are skipped and mark the result approximate.
     *
     * @throws DocumentNotFoundException if the document has no versions
     */
    public VersionStatistics getStatistics(String documentId) {
        List<FileVersion> history = store.getHistory(documentId);
        if (history.isEmpty()) {
            throw new DocumentNotFoundException("getStatistics", documentId);
        }

        Set<String> contributors = new LinkedHashSet<>();
        long totalBytes = 0;
        long changedLines = 0;
        boolean approximate = false;
        FileVersion previous = null;
        for (FileVersion version : history) {
            contributors.add(version.author());
            totalBytes += version.sizeBytes();
            if (previous != null && !previous.contentHash().equals(version.contentHash())) {
                FileVersion older = previous;
                try {
                    ComparisonResult result = comparisonCache.get(documentId, older.id(), version.id(),
                            () -> reporter.compare(TextLines.split(older.content()), TextLines.split(version.content())));
                    if (result.coarse()) {
                        approximate = true;
                    } else {
                        changedLines += result.totalChanges();
                    }
                } catch (SizeLimitExceededException e) {
                    LOG.debugf("Skipping oversized pair in statistics: documentId=%s, v%d -> v%d",
                            documentId, older.versionNumber(), version.versionNumber());
                    approximate = true;
                }
            }
            previous = version;
        }

        return new VersionStatistics(
                documentId,
                history.size(),
                changedLines,
                approximate,
                List.copyOf(contributors),
                (double) totalBytes / history.size(),
                history.get(0).createdAt(),
                history.get(history.size() - 1).createdAt()
        );
    }

    private ComparisonResult timedCompare(List<String> oldLines, List<String> newLines) {
        Timer.Sample sample = metrics.startCompareTimer();
        try {
            ComparisonResult result = reporter.compare(oldLines, newLines);
            metrics.recordComparison(result.diff().size(), result.coarse());
            return result;
        } finally {
            metrics.stopCompareTimer(sample);
        }
    }

    private FileVersion resolve(String operation, String documentId, String ref, String field) {
        if (ref == null || ref.isBlank()) {
            throw InvalidInputException.missingField(operation, field);
        }
        if (CURRENT.equalsIgnoreCase(ref)) {
            return store.findHead(documentId)
                    .orElseThrow(() -> new DocumentNotFoundException(operation, documentId));
        }
        return store.getVersion(documentId, ref);
    }
}
