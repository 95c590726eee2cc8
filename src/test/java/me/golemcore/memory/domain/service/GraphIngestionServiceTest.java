package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.EpisodeResult;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.HealthStatus;
import me.golemcore.memory.domain.model.IngestionBatch;
import me.golemcore.memory.domain.model.IngestionStats;
import me.golemcore.memory.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GraphIngestionServiceTest {

    private static final EpisodeResult ACCEPTED = new EpisodeResult(true, "queued");

    @TempDir
    Path tempDir;

    private TestWorkspace workspace;
    private TurnStoreService turnStore;
    private GraphTextureService textureService;
    private GraphIngestionService service;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(tempDir);
        turnStore = workspace.newTurnStore();
        textureService = mock(GraphTextureService.class);
        when(textureService.isAvailable()).thenReturn(true);
        when(textureService.addEpisode(anyString(), anyString(), anyString(), any(Instant.class), isNull()))
                .thenReturn(ACCEPTED);
        service = new GraphIngestionService(turnStore, textureService, workspace.storage(),
                workspace.lockService(), workspace.objectMapper(), workspace.properties(), workspace.clock());
    }

    private void appendTurns(int count) {
        for (int i = 1; i <= count; i++) {
            turnStore.append("terminal", i % 2 == 0 ? "entity" : "Jeff", "turn " + i);
        }
    }

    @Test
    void shouldRefuseWhenGraphDisabled() {
        when(textureService.isAvailable()).thenReturn(false);

        SubstrateException thrown = assertThrows(SubstrateException.class, () -> service.ingestBatch(10));
        assertEquals(ErrorKind.STORAGE_UNAVAILABLE, thrown.getKind());
    }

    @Test
    void shouldReturnEmptyBatchWhenNothingPending() {
        IngestionBatch batch = service.ingestBatch(10);

        assertTrue(batch.isEmpty());
        verify(textureService, never()).addEpisode(any(), any(), any(), any(), any());
    }

    @Test
    void shouldIngestOldestRunAndMarkRange() {
        appendTurns(25);

        IngestionBatch batch = service.ingestBatch(20);

        assertTrue(batch.isCompleted());
        assertEquals(1, batch.getStartTurnId());
        assertEquals(20, batch.getEndTurnId());
        assertEquals(20, batch.getIngestedCount());
        assertEquals(GraphIngestionService.batchIdFor(1, 20), batch.getBatchId());
        assertEquals(5, turnStore.countUningested());
        verify(textureService).addEpisode("turn 1", "terminal", "user", TestWorkspace.NOW, null);
        verify(textureService).addEpisode("turn 2", "terminal", "assistant", TestWorkspace.NOW, null);

        List<IngestionBatch> ledger = service.batches();
        assertEquals(1, ledger.size());
        assertTrue(ledger.get(0).isCompleted());
    }

    @Test
    void shouldNotReingestCompletedRange() {
        appendTurns(119);
        turnStore.markGraphIngested(1, 99, "earlier");

        IngestionBatch first = service.ingestBatch(20);
        assertEquals(100, first.getStartTurnId());
        assertEquals(119, first.getEndTurnId());

        IngestionBatch second = service.ingestBatch(20);

        assertTrue(second.isEmpty());
        verify(textureService, times(20)).addEpisode(any(), any(), any(), any(), any());
        assertEquals(0, turnStore.countUningested());
    }

    @Test
    void shouldRestoreMarkFromLedgerWithoutCallingGraph() throws Exception {
        appendTurns(119);
        turnStore.markGraphIngested(1, 99, "earlier");
        IngestionBatch recorded = IngestionBatch.builder()
                .batchId(GraphIngestionService.batchIdFor(100, 119))
                .startTurnId(100)
                .endTurnId(119)
                .ingestedCount(20)
                .completed(true)
                .completedAt(TestWorkspace.NOW)
                .build();
        workspace.storage().appendText("graph", "batches.jsonl",
                workspace.objectMapper().writeValueAsString(recorded) + "\n").join();

        IngestionBatch batch = service.ingestBatch(20);

        assertTrue(batch.isEmpty());
        verify(textureService, never()).addEpisode(any(), any(), any(), any(), any());
        assertEquals(0, turnStore.countUningested());
    }

    @Test
    void shouldLeaveRangeUnmarkedOnPartialFailure() {
        appendTurns(5);
        when(textureService.addEpisode(eq("turn 3"), anyString(), anyString(), any(Instant.class), isNull()))
                .thenThrow(new StorageUnavailableException("graph down"));

        IngestionBatch failed = service.ingestBatch(10);

        assertFalse(failed.isCompleted());
        assertEquals(4, failed.getIngestedCount());
        assertEquals(1, failed.getFailedCount());
        assertEquals(5, turnStore.countUningested());

        reset(textureService);
        when(textureService.isAvailable()).thenReturn(true);
        when(textureService.addEpisode(any(), any(), any(), any(), any())).thenReturn(ACCEPTED);

        IngestionBatch retried = service.ingestBatch(10);

        assertTrue(retried.isCompleted());
        assertEquals(failed.getBatchId(), retried.getBatchId());
        verify(textureService, times(5)).addEpisode(any(), any(), any(), any(), any());
        assertEquals(0, turnStore.countUningested());
        assertEquals(2, service.batches().size());
    }

    @Test
    void shouldRecommendIngestionAtThreshold() {
        appendTurns(19);
        assertFalse(service.stats().recommended());

        appendTurns(1);
        IngestionStats stats = service.stats();

        assertTrue(stats.recommended());
        assertEquals(20, stats.uningestedCount());
        assertEquals(HealthStatus.HEALTHY, service.health().getStatus());
    }

    @Test
    void shouldDegradeOnHighBacklog() {
        workspace.properties().getIngestion().setHighBacklog(3);
        appendTurns(4);

        assertEquals(HealthStatus.DEGRADED, service.health().getStatus());
    }
}
