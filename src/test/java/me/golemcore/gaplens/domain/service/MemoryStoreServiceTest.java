package me.golemcore.gaplens.domain.service;

import me.golemcore.gaplens.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gaplens.domain.exception.SessionPersistenceException;
import me.golemcore.gaplens.domain.model.LongTermEntry;
import me.golemcore.gaplens.domain.model.SessionState;
import me.golemcore.gaplens.domain.model.SessionStatus;
import me.golemcore.gaplens.domain.model.StageRecord;
import me.golemcore.gaplens.domain.model.TraceEntry;
import me.golemcore.gaplens.domain.model.TraceOutcome;
import me.golemcore.gaplens.infrastructure.config.AutoConfiguration;
import me.golemcore.gaplens.infrastructure.config.GapLensProperties;
import me.golemcore.gaplens.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MemoryStoreServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private MemoryStoreService memoryStore;

    @BeforeEach
    void setUp() {
        GapLensProperties properties = new GapLensProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        memoryStore = new MemoryStoreService(storage, objectMapper, CLOCK);
    }

    // ===== Session tier =====

    @Test
    void shouldRoundTripSessionWithHistory() {
        SessionState session = session("s-1", NOW);
        session.getContext().put("raw_input", "Who knows React?");
        session.getContext().put("entities", List.of("React"));
        session.appendStageRecord(StageRecord.builder()
                .stageName("perception")
                .inputSnapshot(Map.of("raw_input", "Who knows React?"))
                .outputSnapshot(Map.of("entities", List.of("React")))
                .reasoningPatternTag("REACT")
                .reasoningSteps(List.of("Thought: parse"))
                .confidence(0.8)
                .backendId("stub")
                .fallbackUsed(true)
                .timestamp(NOW)
                .build());

        memoryStore.saveSession(session);
        SessionState loaded = memoryStore.loadSession("s-1").orElseThrow();

        assertEquals("s-1", loaded.getId());
        assertEquals(SessionStatus.RUNNING, loaded.getStatus());
        assertEquals(List.of("React"), loaded.getContext().get("entities"));
        assertEquals(1, loaded.getStageHistory().size());
        StageRecord record = loaded.getStageHistory().get(0);
        assertEquals("perception", record.getStageName());
        assertTrue(record.isFallbackUsed());
        assertEquals(0.8, record.getConfidence());
        assertEquals(NOW, record.getTimestamp());
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertTrue(memoryStore.loadSession("missing").isEmpty());
    }

    @Test
    void shouldRejectUnsafeSessionIds() {
        assertThrows(IllegalArgumentException.class, () -> memoryStore.loadSession("../etc/passwd"));
        assertThrows(IllegalArgumentException.class, () -> memoryStore.loadSession("a..b"));
        assertThrows(IllegalArgumentException.class, () -> memoryStore.loadSession(""));
        assertThrows(IllegalArgumentException.class, () -> memoryStore.putLongTerm("skills", "a/b", "x"));
    }

    @Test
    void shouldFailOnCorruptedSessionRecord() throws Exception {
        Files.writeString(tempDir.resolve("sessions/broken.json"), "{not json");

        assertThrows(SessionPersistenceException.class, () -> memoryStore.loadSession("broken"));
    }

    @Test
    void shouldListSessionIds() {
        memoryStore.saveSession(session("b", NOW));
        memoryStore.saveSession(session("a", NOW));

        assertEquals(List.of("a", "b"), memoryStore.listSessionIds());
    }

    @Test
    void shouldDeleteOnlySessionsOlderThanCutoff() {
        memoryStore.saveSession(finished("old", NOW.minus(Duration.ofDays(40)), SessionStatus.COMPLETED));
        memoryStore.saveSession(finished("fresh", NOW.minus(Duration.ofDays(1)), SessionStatus.COMPLETED));

        int deleted = memoryStore.deleteSessionsOlderThan(NOW.minus(Duration.ofDays(30)));

        assertEquals(1, deleted);
        assertEquals(List.of("fresh"), memoryStore.listSessionIds());
    }

    @Test
    void retentionShouldKeepUnfinishedSessions() {
        memoryStore.saveSession(session("stalled", NOW.minus(Duration.ofDays(40))));
        memoryStore.saveSession(finished("failed", NOW.minus(Duration.ofDays(40)), SessionStatus.FAILED));

        int deleted = memoryStore.deleteSessionsOlderThan(NOW.minus(Duration.ofDays(30)));

        assertEquals(1, deleted);
        assertEquals(List.of("stalled"), memoryStore.listSessionIds());
    }

    @Test
    void retentionShouldSkipFilesWithInvalidSessionNames() throws Exception {
        Files.writeString(tempDir.resolve("sessions/-old.json"), "{}");
        Files.writeString(tempDir.resolve("sessions/my session.json"), "{}");
        memoryStore.saveSession(finished("old", NOW.minus(Duration.ofDays(40)), SessionStatus.COMPLETED));

        int deleted = memoryStore.deleteSessionsOlderThan(NOW.minus(Duration.ofDays(30)));

        assertEquals(1, deleted);
        assertTrue(Files.exists(tempDir.resolve("sessions/-old.json")));
        assertTrue(Files.exists(tempDir.resolve("sessions/my session.json")));
    }

    // ===== Long-term tier =====

    @Test
    void laterLongTermWriteWins() {
        memoryStore.putLongTerm("skills", "react", Map.of("supply", 1));
        memoryStore.putLongTerm("skills", "react", Map.of("supply", 2));

        LongTermEntry entry = memoryStore.getLongTerm("skills", "react").orElseThrow();

        assertEquals(Map.of("supply", 2), entry.value());
        assertEquals(NOW, entry.updatedAt());
    }

    @Test
    void shouldListLongTermEntriesOfCategory() {
        memoryStore.putLongTerm("skills", "react", "a");
        memoryStore.putLongTerm("skills", "kubernetes", "b");
        memoryStore.putLongTerm("teams", "platform", "c");

        List<LongTermEntry> skills = memoryStore.listLongTerm("skills");

        assertEquals(List.of("kubernetes", "react"), skills.stream().map(LongTermEntry::key).toList());
    }

    @Test
    void shouldReturnEmptyForMissingLongTermKey() {
        assertEquals(Optional.empty(), memoryStore.getLongTerm("skills", "cobol"));
    }

    // ===== Trace tier =====

    @Test
    void shouldAppendAndReadTraceInOrder() {
        memoryStore.appendTrace(trace("perception", TraceOutcome.OK));
        memoryStore.appendTrace(trace("backend-selector", TraceOutcome.FALLBACK));

        List<TraceEntry> entries = memoryStore.readTrace();

        assertEquals(2, entries.size());
        assertEquals("perception", entries.get(0).getActor());
        assertEquals(TraceOutcome.FALLBACK, entries.get(1).getOutcome());
    }

    @Test
    void shouldSkipMalformedTraceLines() throws Exception {
        memoryStore.appendTrace(trace("perception", TraceOutcome.OK));
        Files.writeString(tempDir.resolve("traces/trace.jsonl"), "garbage\n", StandardOpenOption.APPEND);
        memoryStore.appendTrace(trace("analysis", TraceOutcome.OK));

        List<TraceEntry> entries = memoryStore.readTrace();

        assertEquals(List.of("perception", "analysis"), entries.stream().map(TraceEntry::getActor).toList());
    }

    // ===== Retry =====

    @Test
    void shouldRetryFailedWriteOnce() {
        StoragePort storage = mock(StoragePort.class);
        when(storage.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk busy")))
                .thenReturn(CompletableFuture.completedFuture(null));
        MemoryStoreService store = new MemoryStoreService(storage, objectMapper, CLOCK);

        store.saveSession(session("s-1", NOW));

        verify(storage, times(2)).putTextAtomic(anyString(), anyString(), anyString());
    }

    @Test
    void shouldThrowPersistenceExceptionAfterSecondFailure() {
        StoragePort storage = mock(StoragePort.class);
        when(storage.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        MemoryStoreService store = new MemoryStoreService(storage, objectMapper, CLOCK);
        TraceEntry entry = trace("perception", TraceOutcome.OK);

        SessionPersistenceException e = assertThrows(SessionPersistenceException.class,
                () -> store.appendTrace(entry));

        assertEquals(1, e.getCause().getSuppressed().length);
        verify(storage, times(2)).appendText(anyString(), anyString(), anyString());
    }

    @Test
    void shouldWrapReadFailure() {
        StoragePort storage = mock(StoragePort.class);
        when(storage.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("io")));
        MemoryStoreService store = new MemoryStoreService(storage, objectMapper, CLOCK);

        assertThrows(SessionPersistenceException.class, () -> store.loadSession("s-1"));
    }

    private static SessionState session(String id, Instant at) {
        return SessionState.builder()
                .id(id)
                .userInput("Who knows React?")
                .status(SessionStatus.RUNNING)
                .createdAt(at)
                .updatedAt(at)
                .build();
    }

    private static SessionState finished(String id, Instant at, SessionStatus status) {
        return SessionState.builder()
                .id(id)
                .userInput("Who knows React?")
                .status(status)
                .createdAt(at)
                .updatedAt(at)
                .build();
    }

    private static TraceEntry trace(String actor, TraceOutcome outcome) {
        return TraceEntry.builder()
                .sessionId("s-1")
                .actor(actor)
                .inputs(Map.of())
                .outputs(Map.of())
                .durationMs(5)
                .outcome(outcome)
                .timestamp(NOW)
                .build();
    }
}
