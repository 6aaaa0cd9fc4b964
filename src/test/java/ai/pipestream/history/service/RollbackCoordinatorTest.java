package ai.pipestream.history.service;

import ai.pipestream.history.compare.ComparisonResult;
import ai.pipestream.history.events.MockDocumentChangeEmitter;
import ai.pipestream.history.exception.InvalidInputException;
import ai.pipestream.history.exception.VersionNotFoundException;
import ai.pipestream.history.model.FileVersion;
import ai.pipestream.history.store.VersionStore;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RollbackCoordinator.
 * A rollback appends a copy of the target and never removes history.
 */
@QuarkusTest
class RollbackCoordinatorTest {

    @Inject
    RollbackCoordinator rollbackCoordinator;

    @Inject
    HistoryQueryService historyQuery;

    @Inject
    VersionStore store;

    @Inject
    MockDocumentChangeEmitter changeEmitter;

    @Test
    void testRollbackRestoresTargetContent() {
        String documentId = newDocumentId();
        FileVersion v1 = store.createVersion(documentId, "first\ndraft\n", "alice", null);
        store.createVersion(documentId, "second\n", "bob", null);
        store.createVersion(documentId, "third\n", "bob", null);

        FileVersion restored = rollbackCoordinator.rollback(documentId, v1.id(), "carol");

        assertEquals(4, restored.versionNumber());
        assertEquals(v1.content(), restored.content());
        assertEquals(v1.contentHash(), restored.contentHash());
        assertEquals("carol", restored.author());
        assertTrue(restored.message().startsWith("Rolled back to version 1 (" + v1.id() + ")"));
        assertEquals(restored, historyQuery.getCurrentVersion(documentId));
        assertEquals(4, store.getHistory(documentId).size());

        ComparisonResult roundTrip = historyQuery.compare(documentId, v1.id(), "current");
        assertFalse(roundTrip.changed());
        assertEquals(0, roundTrip.totalChanges());
    }

    @Test
    void testRollbackEmitsRestoredEvent() {
        String documentId = newDocumentId();
        FileVersion v1 = store.createVersion(documentId, "one", "alice", null);
        store.createVersion(documentId, "two", "alice", null);

        FileVersion restored = rollbackCoordinator.rollback(documentId, v1.id(), "alice");

        List<MockDocumentChangeEmitter.EmittedEvent> events = changeEmitter.eventsFor(documentId);
        assertEquals(1, events.size());
        assertEquals("RESTORED", events.get(0).type());
        assertEquals(restored.id(), events.get(0).versionId());
        assertEquals(v1.id(), events.get(0).targetVersionId());
    }

    @Test
    void testRollbackToHeadStillAppends() {
        String documentId = newDocumentId();
        FileVersion head = store.createVersion(documentId, "only", "alice", null);

        FileVersion restored = rollbackCoordinator.rollback(documentId, head.id(), "alice");

        assertEquals(2, restored.versionNumber());
        assertEquals(head.content(), restored.content());
    }

    @Test
    void testRollbackToUnknownVersionLeavesHistoryAlone() {
        String documentId = newDocumentId();
        store.createVersion(documentId, "one", "alice", null);

        assertThrows(VersionNotFoundException.class,
                () -> rollbackCoordinator.rollback(documentId, "missing", "alice"));
        assertEquals(1, store.getHistory(documentId).size());
        assertTrue(changeEmitter.eventsFor(documentId).isEmpty());
    }

    @Test
    void testRollbackRequiresAuthor() {
        String documentId = newDocumentId();
        FileVersion v1 = store.createVersion(documentId, "one", "alice", null);

        assertThrows(InvalidInputException.class, () -> rollbackCoordinator.rollback(documentId, v1.id(), ""));
        assertEquals(1, store.getHistory(documentId).size());
    }

    private static String newDocumentId() {
        return "doc-" + UUID.randomUUID();
    }
}
