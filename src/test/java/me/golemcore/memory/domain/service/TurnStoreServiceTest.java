package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.HealthStatus;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.domain.model.TurnAppendedEvent;
import me.golemcore.memory.domain.model.TurnIntegrityReport;
import me.golemcore.memory.domain.model.TurnMatch;
import me.golemcore.memory.domain.model.TurnQuery;
import me.golemcore.memory.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TurnStoreServiceTest {

    private static final String TERMINAL = "terminal";

    @TempDir
    Path tempDir;

    private TestWorkspace workspace;
    private TurnStoreService turnStore;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(tempDir);
        workspace.properties().getLock().setMaxAttempts(1000);
        workspace.properties().getLock().setBackoffMultiplier(1.0);
        turnStore = workspace.newTurnStore();
    }

    @Test
    void shouldAssignIncreasingIdsAndPublishEvents() {
        Turn first = turnStore.append(TERMINAL, "Jeff", "hello");
        Turn second = turnStore.append(TERMINAL, "entity", "hi Jeff");

        assertEquals(1, first.getId());
        assertEquals(2, second.getId());
        assertEquals(TestWorkspace.NOW, first.getCreatedAt());
        assertEquals(2, turnStore.count());
        assertEquals(2, turnStore.lastId());
        verify(workspace.eventBus()).publish(new TurnAppendedEvent(2, TERMINAL));
    }

    @Test
    void shouldKeepCallerTimestamp() {
        Instant past = Instant.parse("2025-12-31T08:00:00Z");

        Turn stored = turnStore.append(Turn.builder().channel(TERMINAL).author("Jeff").content("old")
                .createdAt(past).build());

        assertEquals(past, turnStore.get(stored.getId()).orElseThrow().getCreatedAt());
    }

    @Test
    void shouldRejectTurnWithoutContent() {
        SubstrateException thrown = assertThrows(SubstrateException.class,
                () -> turnStore.append(TERMINAL, "Jeff", null));
        assertEquals(ErrorKind.INVALID_REQUEST, thrown.getKind());
    }

    @Test
    void shouldNeverReuseIdsAcrossInstances() {
        turnStore.append(TERMINAL, "Jeff", "one");
        turnStore.append(TERMINAL, "Jeff", "two");

        TurnStoreService reopened = workspace.newTurnStore();
        Turn third = reopened.append(TERMINAL, "Jeff", "three");

        assertEquals(3, third.getId());
    }

    @Test
    void shouldAllocateUniqueIdsUnderConcurrentWriters() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Turn>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                int n = i;
                futures.add(pool.submit(() -> turnStore.append(TERMINAL, "Jeff", "message " + n)));
            }
            Set<Long> ids = new HashSet<>();
            for (Future<Turn> future : futures) {
                ids.add(future.get().getId());
            }
            assertEquals(20, ids.size());
            assertEquals(20, turnStore.lastId());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldNotDropAppendsWhenManyWritersQueueOnLargeLog() throws Exception {
        workspace.properties().getLock().setMaxAttempts(1);
        StringBuilder seeded = new StringBuilder();
        for (int i = 1; i <= 5000; i++) {
            seeded.append(workspace.objectMapper().writeValueAsString(Turn.builder().id(i).channel(TERMINAL)
                    .author("Jeff").content("seeded " + i).createdAt(TestWorkspace.NOW).build())).append('\n');
        }
        workspace.storage().appendText("turns", "turns.jsonl", seeded.toString()).join();
        workspace.storage().putText("turns", "turns.seq", "5000").join();

        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Future<Turn>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                int n = i;
                futures.add(pool.submit(() -> turnStore.append(TERMINAL, "Jeff", "burst " + n)));
            }
            Set<Long> ids = new HashSet<>();
            for (Future<Turn> future : futures) {
                ids.add(future.get().getId());
            }
            assertEquals(64, ids.size());
            assertEquals(5001, ids.stream().mapToLong(Long::longValue).min().orElseThrow());
            assertEquals(5064, ids.stream().mapToLong(Long::longValue).max().orElseThrow());
            assertEquals(5064, turnStore.count());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldRecoverSequenceFromLogWhenSequenceFileIsUnreadable() {
        turnStore.append(TERMINAL, "Jeff", "one");
        turnStore.append(TERMINAL, "Jeff", "two");
        workspace.storage().putText("turns", "turns.seq", "garbage").join();

        Turn third = workspace.newTurnStore().append(TERMINAL, "Jeff", "three");

        assertEquals(3, third.getId());
        assertEquals("3", workspace.storage().getText("turns", "turns.seq").join());
    }

    @Test
    void shouldContinueFromSequenceWhenItRunsAheadOfLog() {
        turnStore.append(TERMINAL, "Jeff", "one");
        // a writer that crashed after reserving ids 2..4
        workspace.storage().putText("turns", "turns.seq", "4").join();

        assertEquals(5, workspace.newTurnStore().append(TERMINAL, "Jeff", "after crash").getId());
    }

    @Test
    void shouldFilterQueriesAndKeepNewestWhenLimited() {
        turnStore.append(TERMINAL, "Jeff", "fix the parser");
        turnStore.append("discord", "Jeff", "good morning");
        turnStore.append(TERMINAL, "entity", "parser fixed");
        turnStore.append(TERMINAL, "Jeff", "parser looks good");

        List<Turn> terminal = turnStore.query(TurnQuery.builder().channel(TERMINAL).build());
        assertEquals(List.of(1L, 3L, 4L), terminal.stream().map(Turn::getId).toList());

        List<Turn> limited = turnStore.query(TurnQuery.builder().text("PARSER").limit(2).build());
        assertEquals(List.of(3L, 4L), limited.stream().map(Turn::getId).toList());

        List<Turn> byAuthor = turnStore.query(TurnQuery.builder().author("entity").build());
        assertEquals(1, byAuthor.size());
        assertEquals(3, byAuthor.get(0).getId());
    }

    @Test
    void shouldDeriveSummaryAndIngestionStateFromMarks() {
        for (int i = 0; i < 5; i++) {
            turnStore.append(TERMINAL, "Jeff", "turn " + i);
        }

        turnStore.markSummarized(1, 3, "summary_1_3");
        turnStore.markGraphIngested(2, 2, "batch-a");

        assertEquals(2, turnStore.countUnsummarized());
        assertEquals(4, turnStore.countUningested());
        assertEquals("summary_1_3", turnStore.get(2).orElseThrow().getSummaryId());
        assertTrue(turnStore.get(2).orElseThrow().isIngestedToGraph());
        assertEquals(List.of(4L, 5L), turnStore.oldestUnsummarizedRun(10).stream().map(Turn::getId).toList());
        assertEquals(List.of(1L), turnStore.oldestUningestedRun(10).stream().map(Turn::getId).toList());
        assertEquals(List.of(4L, 5L), turnStore.turnsSince(3).stream().map(Turn::getId).toList());
    }

    @Test
    void shouldRejectInvertedMarkRange() {
        SubstrateException thrown = assertThrows(SubstrateException.class,
                () -> turnStore.markSummarized(5, 2, "bad"));
        assertEquals(ErrorKind.INVALID_REQUEST, thrown.getKind());
    }

    @Test
    void shouldRankSearchByTermFrequency() {
        turnStore.append(TERMINAL, "Jeff", "the lock file");
        turnStore.append(TERMINAL, "Jeff", "lock lock lock contention");
        turnStore.append(TERMINAL, "Jeff", "unrelated");

        List<TurnMatch> matches = turnStore.search("lock", 5);

        assertEquals(2, matches.size());
        assertEquals(2, matches.get(0).turn().getId());
        assertTrue(matches.get(0).score() > matches.get(1).score());
        assertTrue(turnStore.search("  ", 5).isEmpty());
    }

    @Test
    void shouldReportMalformedLinesAndSkipThemOnRead() {
        turnStore.append(TERMINAL, "Jeff", "valid");
        CompletableFuture<Void> corrupt = workspace.storage().appendText("turns", "turns.jsonl", "{not json\n");
        corrupt.join();
        turnStore.append(TERMINAL, "Jeff", "still valid");

        TurnIntegrityReport report = turnStore.integrityCheck();

        assertFalse(report.isHealthy());
        assertEquals(List.of(2), report.getMalformedLines());
        assertEquals(2, report.getValidTurns());
        assertEquals(2, turnStore.count());

        ComponentHealth health = turnStore.health();
        assertEquals(HealthStatus.CRITICAL, health.getStatus());
    }

    @Test
    void shouldBackupAndRestoreSnapshot() {
        turnStore.append(TERMINAL, "Jeff", "before backup");
        String snapshot = turnStore.backup();
        turnStore.append(TERMINAL, "Jeff", "after backup");
        assertEquals(2, turnStore.count());

        turnStore.restore(snapshot);

        assertEquals(1, turnStore.count());
        assertEquals("before backup", turnStore.get(1).orElseThrow().getContent());
        assertEquals(2, turnStore.listBackups().size());
        assertEquals(HealthStatus.HEALTHY, turnStore.health().getStatus());
        assertEquals(3, turnStore.append(TERMINAL, "Jeff", "after restore").getId());
    }

    @Test
    void shouldPruneOldestBackups() {
        workspace.properties().getTurns().setMaxBackups(2);
        turnStore.append(TERMINAL, "Jeff", "content");

        String first = turnStore.backup();
        turnStore.backup();
        turnStore.backup();

        List<String> backups = turnStore.listBackups();
        assertEquals(2, backups.size());
        assertFalse(backups.contains(first));
    }

    @Test
    void shouldRejectUnknownSnapshot() {
        SubstrateException thrown = assertThrows(SubstrateException.class, () -> turnStore.restore("nope"));
        assertEquals(ErrorKind.INVALID_REQUEST, thrown.getKind());
    }
}
