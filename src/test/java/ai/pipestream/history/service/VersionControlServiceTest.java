package ai.pipestream.history.service;

import ai.pipestream.history.compare.ComparisonResult;
import ai.pipestream.history.events.MockDocumentChangeEmitter;
import ai.pipestream.history.exception.DocumentNotFoundException;
import ai.pipestream.history.exception.InvalidInputException;
import ai.pipestream.history.model.FileVersion;
import ai.pipestream.history.model.VersionStatistics;
import ai.pipestream.history.store.VersionPage;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VersionControlService.
 * Exercises the reactive facade end to end against the in-memory store.
 */
@QuarkusTest
class VersionControlServiceTest {

    @Inject
    VersionControlService versionControl;

    @Inject
    MockDocumentChangeEmitter changeEmitter;

    @Test
    void testCreateVersionEmitsCreatedEvent() {
        String documentId = newDocumentId();

        FileVersion version = versionControl.createVersion(documentId, "hello\n", "alice", "first")
                .await().indefinitely();

        assertEquals(1, version.versionNumber());
        List<MockDocumentChangeEmitter.EmittedEvent> events = changeEmitter.eventsFor(documentId);
        assertEquals(1, events.size());
        assertEquals("CREATED", events.get(0).type());
        assertEquals(version.id(), events.get(0).versionId());
        assertEquals("alice", events.get(0).author());
    }

    @Test
    void testFailedCreateEmitsNothing() {
        String documentId = newDocumentId();

        assertThrows(InvalidInputException.class,
                () -> versionControl.createVersion(documentId, null, "alice", null).await().indefinitely());
        assertTrue(changeEmitter.eventsFor(documentId).isEmpty());
        assertFalse(versionControl.hasVersionHistory(documentId).await().indefinitely());
    }

    @Test
    void testEditCompareAndRollback() {
        String documentId = newDocumentId();
        FileVersion v1 = versionControl.createVersion(documentId, "a\nb\nc\n", "alice", null).await().indefinitely();
        FileVersion v2 = versionControl.createVersion(documentId, "a\nx\nc\n", "bob", null).await().indefinitely();

        ComparisonResult diff = versionControl.compareVersions(documentId, v1.id(), v2.id()).await().indefinitely();
        assertEquals(1, diff.modifications());

        FileVersion restored = versionControl.rollbackToVersion(documentId, v1.id(), "carol").await().indefinitely();
        assertEquals(3, restored.versionNumber());
        assertEquals(restored, versionControl.getCurrentVersion(documentId).await().indefinitely());
        assertEquals(v2, versionControl.getVersion(documentId, v2.id()).await().indefinitely());

        VersionPage page = versionControl.listVersions(documentId, null, null).await().indefinitely();
        assertEquals(List.of(restored, v2, v1), page.versions());

        ComparisonResult draft = versionControl.compareWithDraft(documentId, "current", List.of("a", "b"))
                .await().indefinitely();
        assertEquals(1, draft.deletions());

        assertEquals(1, versionControl.compareSideBySide(documentId, v2.id(), "current")
                .await().indefinitely().modifications());

        VersionStatistics stats = versionControl.getStatistics(documentId).await().indefinitely();
        assertEquals(3, stats.totalVersions());
        assertEquals(2, stats.totalChangedLines());
        assertEquals(List.of("alice", "bob", "carol"), stats.contributors());
    }

    @Test
    void testReadsOfUnknownDocumentFail() {
        String documentId = newDocumentId();

        assertThrows(DocumentNotFoundException.class,
                () -> versionControl.getCurrentVersion(documentId).await().indefinitely());
        assertThrows(DocumentNotFoundException.class,
                () -> versionControl.listVersions(documentId, null, null).await().indefinitely());
    }

    private static String newDocumentId() {
        return "doc-" + UUID.randomUUID();
    }
}
