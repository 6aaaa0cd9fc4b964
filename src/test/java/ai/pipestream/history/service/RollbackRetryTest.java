package ai.pipestream.history.service;

import ai.pipestream.history.config.HistoryConfiguration;
import ai.pipestream.history.events.DocumentChangeEmitter;
import ai.pipestream.history.exception.ConcurrencyConflictException;
import ai.pipestream.history.metrics.HistoryMetrics;
import ai.pipestream.history.model.FileVersion;
import ai.pipestream.history.store.VersionPage;
import ai.pipestream.history.store.VersionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the rollback retry loop against a store whose head keeps moving.
 */
class RollbackRetryTest {

    private static final String DOCUMENT_ID = "doc-1";

    private final FileVersion target = version("v1", 1, "original");
    private final FileVersion head = version("v2", 2, "edited");

    private MovingHeadStore store;
    private CountingMetrics metrics;
    private List<String> restoredEvents;
    private RollbackCoordinator coordinator;

    @BeforeEach
    void setUp() {
        store = new MovingHeadStore();
        metrics = new CountingMetrics();
        restoredEvents = new ArrayList<>();

        HistoryQueryService historyQuery = new HistoryQueryService();
        historyQuery.store = store;

        coordinator = new RollbackCoordinator();
        coordinator.store = store;
        coordinator.historyQuery = historyQuery;
        coordinator.metrics = metrics;
        coordinator.config = configWithAttempts(3);
        coordinator.changeEmitter = new DocumentChangeEmitter() {
            @Override
            public void emitRestored(String documentId, String versionId, String targetVersionId, String author) {
                restoredEvents.add(versionId);
            }
        };
    }

    @Test
    void testRetriesUntilHeadSettles() {
        store.conflictsBeforeSuccess = 2;

        FileVersion restored = coordinator.rollback(DOCUMENT_ID, target.id(), "alice");

        assertEquals(3, store.appendAttempts);
        assertEquals(target.content(), restored.content());
        assertEquals(1, metrics.rollbacks);
        assertEquals(0, metrics.conflicts);
        assertEquals(List.of(restored.id()), restoredEvents);
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        store.conflictsBeforeSuccess = Integer.MAX_VALUE;

        ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
                () -> coordinator.rollback(DOCUMENT_ID, target.id(), "alice"));

        assertEquals("rollback", e.getOperation());
        assertEquals(3, store.appendAttempts);
        assertEquals(0, metrics.rollbacks);
        assertEquals(1, metrics.conflicts);
        assertTrue(restoredEvents.isEmpty());
    }

    private static FileVersion version(String id, int number, String content) {
        return new FileVersion(id, DOCUMENT_ID, number, content, "hash-" + id, content.length(),
                1_000L * number, "alice", null);
    }

    private static HistoryConfiguration configWithAttempts(int attempts) {
        return new HistoryConfiguration() {
            @Override
            public Diff diff() {
                return null;
            }

            @Override
            public Store store() {
                return null;
            }

            @Override
            public Paging paging() {
                return null;
            }

            @Override
            public Rollback rollback() {
                return () -> attempts;
            }

            @Override
            public Cache cache() {
                return null;
            }
        };
    }

    private final class CountingMetrics extends HistoryMetrics {
        int rollbacks;
        int conflicts;

        @Override
        public void recordRollback() {
            rollbacks++;
        }

        @Override
        public void recordConcurrencyConflict() {
            conflicts++;
        }
    }

    private final class MovingHeadStore implements VersionStore {
        int conflictsBeforeSuccess;
        int appendAttempts;

        @Override
        public FileVersion appendIfHead(String documentId, String expectedHeadId, String content,
                                        String author, String message) {
            appendAttempts++;
            assertEquals(head.id(), expectedHeadId);
            if (appendAttempts <= conflictsBeforeSuccess) {
                throw new ConcurrencyConflictException("appendIfHead", documentId, "head moved");
            }
            return new FileVersion("v3", documentId, 3, content, target.contentHash(), content.length(),
                    3_000L, author, message);
        }

        @Override
        public FileVersion getVersion(String documentId, String versionId) {
            assertEquals(target.id(), versionId);
            return target;
        }

        @Override
        public Optional<FileVersion> findHead(String documentId) {
            return Optional.of(head);
        }

        @Override
        public FileVersion createVersion(String documentId, String content, String author, String message) {
            throw new UnsupportedOperationException();
        }

        @Override
        public VersionPage listVersions(String documentId, String cursor, Integer limit) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<FileVersion> getHistory(String documentId) {
            return List.of(target, head);
        }

        @Override
        public long documentCount() {
            return 1;
        }
    }
}
