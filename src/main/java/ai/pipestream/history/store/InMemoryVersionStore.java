package ai.pipestream.history.store;

import ai.pipestream.history.config.HistoryConfiguration;
import ai.pipestream.history.exception.ConcurrencyConflictException;
import ai.pipestream.history.exception.DocumentNotFoundException;
import ai.pipestream.history.exception.InvalidInputException;
import ai.pipestream.history.exception.VersionNotFoundException;
import ai.pipestream.history.metrics.HistoryMetrics;
import ai.pipestream.history.model.FileVersion;
import ai.pipestream.history.util.ContentDigest;
import ai.pipestream.history.util.VersionIdGenerator;
import com.google.common.base.Utf8;
import com.google.common.collect.ImmutableList;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link VersionStore}.
 * <p>
 * Each document owns its own lock, so writers to one document queue behind each other while
 * writers to other documents are unaffected. A document's versions are published as an
 * immutable list swapped in on every append, which keeps reads lock-free.
 */
@ApplicationScoped
public class InMemoryVersionStore implements VersionStore {

    private static final Logger LOG = Logger.getLogger(InMemoryVersionStore.class);
    private static final int MAX_DOCUMENT_ID_LENGTH = 255;

    @Inject
    HistoryConfiguration config;

    @Inject
    HistoryMetrics metrics;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    VersionIdGenerator idGenerator;

    @Inject
    Clock clock;

    private final ConcurrentHashMap<String, DocumentHistory> documents = new ConcurrentHashMap<>();
    private final AtomicLong versionsStored = new AtomicLong(0);

    @PostConstruct
    void init() {
        meterRegistry.gauge("history_documents_tracked", this, InMemoryVersionStore::documentCount);
        meterRegistry.gauge("history_versions_stored", versionsStored, AtomicLong::get);

        LOG.infof("InMemoryVersionStore initialized: lockTimeout=%s, maxLockAttempts=%d",
                config.store().lockTimeout(), config.store().maxLockAttempts());
    }

    @Override
    public FileVersion createVersion(String documentId, String content, String author, String message) {
        return append("createVersion", documentId, content, author, message, false, null);
    }

    @Override
    public FileVersion appendIfHead(String documentId, String expectedHeadId, String content, String author, String message) {
        return append("appendIfHead", documentId, content, author, message, true, expectedHeadId);
    }

    @Override
    public VersionPage listVersions(String documentId, String cursor, Integer limit) {
        DocumentHistory history = requireHistory("listVersions", documentId);
        int pageSize = resolveLimit(limit);

        int end;
        List<FileVersion> versions;
        if (cursor == null || cursor.isBlank()) {
            versions = history.versions;
            end = versions.size();
        } else {
            // Index before list: an id visible in the index is always in the list read after it.
            FileVersion seen = history.byId.get(cursor);
            if (seen == null) {
                throw InvalidInputException.invalidField("listVersions", "cursor", cursor,
                        "not a version of document " + documentId);
            }
            versions = history.versions;
            end = seen.versionNumber() - 1;
        }

        int start = Math.max(0, end - pageSize);
        List<FileVersion> page = new ArrayList<>(end - start);
        for (int i = end - 1; i >= start; i--) {
            page.add(versions.get(i));
        }
        String nextCursor = start > 0 ? page.get(page.size() - 1).id() : null;

        LOG.debugf("listVersions: documentId=%s, cursor=%s, returned=%d, more=%s",
                documentId, cursor, page.size(), nextCursor != null);
        return new VersionPage(page, nextCursor);
    }

    @Override
    public FileVersion getVersion(String documentId, String versionId) {
        DocumentHistory history = documentId == null ? null : documents.get(documentId);
        FileVersion version = (history == null || versionId == null) ? null : history.byId.get(versionId);
        if (version == null) {
            throw new VersionNotFoundException("getVersion", documentId, versionId);
        }
        return version;
    }

    @Override
    public Optional<FileVersion> findHead(String documentId) {
        DocumentHistory history = documentId == null ? null : documents.get(documentId);
        return history == null ? Optional.empty() : Optional.ofNullable(history.head());
    }

    @Override
    public List<FileVersion> getHistory(String documentId) {
        DocumentHistory history = documentId == null ? null : documents.get(documentId);
        return history == null ? List.of() : history.versions;
    }

    @Override
    public long documentCount() {
        return documents.values().stream().filter(h -> !h.versions.isEmpty()).count();
    }

    private FileVersion append(String operation, String documentId, String content, String author,
                               String message, boolean checkHead, String expectedHeadId) {
        validateDocumentId(operation, documentId);
        long sizeBytes = validateContent(operation, content);
        if (author == null || author.isBlank()) {
            throw InvalidInputException.missingField(operation, "author");
        }
        String resolvedMessage = (message == null || message.isBlank()) ? null : message;

        DocumentHistory history = documents.computeIfAbsent(documentId, id -> new DocumentHistory());
        Timer.Sample sample = metrics.startCreateVersionTimer();
        boolean locked = false;
        try {
            acquire(history, operation, documentId);
            locked = true;
            FileVersion head = history.head();
            if (checkHead) {
                String headId = head == null ? null : head.id();
                if (!Objects.equals(headId, expectedHeadId)) {
                    throw new ConcurrencyConflictException(operation, documentId,
                            String.format("expected head %s but found %s", expectedHeadId, headId));
                }
            }

            int versionNumber = head == null ? 1 : head.versionNumber() + 1;
            long now = clock.millis();
            long timestamp = head == null ? now : Math.max(now, head.timestamp() + 1);

            FileVersion version = new FileVersion(
                    idGenerator.generate(documentId, versionNumber),
                    documentId,
                    versionNumber,
                    content,
                    ContentDigest.sha256(content),
                    sizeBytes,
                    timestamp,
                    author,
                    resolvedMessage
            );
            history.publish(version);
            versionsStored.incrementAndGet();
            metrics.recordVersionCreated();

            LOG.infof("%s: documentId=%s, versionId=%s, versionNumber=%d, author=%s, bytes=%d",
                    operation, documentId, version.id(), versionNumber, author, sizeBytes);
            return version;
        } finally {
            if (locked) {
                history.lock.unlock();
            }
            metrics.stopCreateVersionTimer(sample);
        }
    }

    private void acquire(DocumentHistory history, String operation, String documentId) {
        int attempts = Math.max(1, config.store().maxLockAttempts());
        long timeoutMs = config.store().lockTimeout().toMillis();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (history.lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                metrics.recordConcurrencyConflict();
                throw new ConcurrencyConflictException(operation, documentId,
                        "interrupted while waiting for write lock", e);
            }
            LOG.warnf("Write lock wait timed out: documentId=%s, attempt=%d/%d", documentId, attempt, attempts);
        }
        metrics.recordConcurrencyConflict();
        throw new ConcurrencyConflictException(operation, documentId,
                "write lock not acquired after " + attempts + " attempts");
    }

    private DocumentHistory requireHistory(String operation, String documentId) {
        DocumentHistory history = documentId == null ? null : documents.get(documentId);
        if (history == null || history.versions.isEmpty()) {
            throw new DocumentNotFoundException(operation, documentId);
        }
        return history;
    }

    private int resolveLimit(Integer limit) {
        if (limit == null) {
            return config.paging().defaultLimit();
        }
        if (limit < 1) {
            throw InvalidInputException.invalidField("listVersions", "limit", String.valueOf(limit),
                    "must be at least 1");
        }
        return Math.min(limit, config.paging().maxLimit());
    }

    private static void validateDocumentId(String operation, String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw InvalidInputException.missingField(operation, "documentId");
        }
        if (documentId.length() > MAX_DOCUMENT_ID_LENGTH) {
            throw InvalidInputException.invalidField(operation, "documentId", documentId.substring(0, 32) + "...",
                    "longer than " + MAX_DOCUMENT_ID_LENGTH + " characters");
        }
        if (documentId.chars().anyMatch(Character::isISOControl)) {
            throw InvalidInputException.invalidField(operation, "documentId", documentId.strip(),
                    "contains control characters");
        }
    }

    /**
     * @return the UTF-8 size of the content
     */
    private static long validateContent(String operation, String content) {
        if (content == null) {
            throw InvalidInputException.missingField(operation, "content");
        }
        if (content.indexOf('\u0000') >= 0) {
            throw new InvalidInputException(operation, "content", "contains NUL characters, not text");
        }
        try {
            return Utf8.encodedLength(content);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(operation, "content", "not well-formed text: " + e.getMessage());
        }
    }

    /**
     * One document's history. Written only while holding {@link #lock}.
     */
    private static final class DocumentHistory {
        final ReentrantLock lock = new ReentrantLock();
        final ConcurrentHashMap<String, FileVersion> byId = new ConcurrentHashMap<>();
        volatile ImmutableList<FileVersion> versions = ImmutableList.of();

        FileVersion head() {
            List<FileVersion> current = versions;
            return current.isEmpty() ? null : current.get(current.size() - 1);
        }

        void publish(FileVersion version) {
            versions = ImmutableList.<FileVersion>builderWithExpectedSize(versions.size() + 1)
                    .addAll(versions)
                    .add(version)
                    .build();
            byId.put(version.id(), version);
        }
    }
}
