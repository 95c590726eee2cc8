package me.golemcore.memory.tools;

import me.golemcore.memory.domain.exception.LockContendedException;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.IngestionBatch;
import me.golemcore.memory.domain.model.IngestionStats;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.GraphIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GraphIngestionToolTest {

    private GraphIngestionService ingestionService;
    private GraphIngestionTool tool;

    @BeforeEach
    void setUp() {
        ingestionService = mock(GraphIngestionService.class);
        tool = new GraphIngestionTool(ingestionService);
    }

    @Test
    void shouldReportStats() {
        when(ingestionService.stats()).thenReturn(new IngestionStats(25, true));

        ToolResult result = tool.execute(Map.of("operation", "graphiti_ingestion_stats")).join();

        assertEquals("25 turns not yet in the graph (batch ingestion recommended)", result.getOutput());
    }

    @Test
    void shouldReportCompletedBatch() {
        when(ingestionService.ingestBatch(10)).thenReturn(IngestionBatch.builder()
                .batchId("b1").startTurnId(1).endTurnId(10).ingestedCount(10).completed(true).build());
        when(ingestionService.stats()).thenReturn(new IngestionStats(5, false));

        ToolResult result = tool.execute(Map.of("operation", "ingest_batch_to_graphiti", "batch_size", 10)).join();

        assertEquals("Ingested turns 1..10 (10 episodes, 5 remaining)", result.getOutput());
    }

    @Test
    void shouldReportIncompleteBatch() {
        when(ingestionService.ingestBatch(0)).thenReturn(IngestionBatch.builder()
                .batchId("b1").startTurnId(1).endTurnId(20).ingestedCount(18).failedCount(2).build());

        ToolResult result = tool.execute(Map.of("operation", "ingest_batch_to_graphiti")).join();

        assertTrue(result.isSuccess());
        assertEquals("Batch 1..20 incomplete: 2 failed, the whole range will be retried", result.getOutput());
    }

    @Test
    void shouldReportNothingToIngest() {
        when(ingestionService.ingestBatch(0)).thenReturn(IngestionBatch.empty());

        ToolResult result = tool.execute(Map.of("operation", "ingest_batch_to_graphiti")).join();

        assertEquals("Nothing to ingest.", result.getOutput());
    }

    @Test
    void shouldSurfaceLockContention() {
        when(ingestionService.ingestBatch(0)).thenThrow(new LockContendedException("ingestion-entity"));

        ToolResult result = tool.execute(Map.of("operation", "ingest_batch_to_graphiti")).join();

        assertEquals(ErrorKind.LOCK_CONTENDED, result.getErrorKind());
    }
}
