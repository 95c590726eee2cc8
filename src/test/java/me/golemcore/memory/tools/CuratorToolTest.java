package me.golemcore.memory.tools;

import me.golemcore.memory.domain.model.CurationCandidate;
import me.golemcore.memory.domain.model.CurationReport;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.GraphFact;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.GraphCuratorService;
import me.golemcore.memory.domain.service.GraphTextureService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CuratorToolTest {

    private GraphCuratorService curatorService;
    private GraphTextureService textureService;
    private CuratorTool tool;

    @BeforeEach
    void setUp() {
        curatorService = mock(GraphCuratorService.class);
        textureService = mock(GraphTextureService.class);
        when(textureService.isAvailable()).thenReturn(true);
        tool = new CuratorTool(curatorService, textureService, new MemoryProperties());
    }

    @Test
    void shouldReportWithoutDeletingByDefault() {
        GraphFact fact = GraphFact.builder().uuid("e2").sourceEntity("The").predicate("IS").targetEntity("tea")
                .build();
        when(curatorService.curate(false, false)).thenReturn(CurationReport.builder()
                .namespace("nova")
                .queriesRun(4)
                .uniqueFacts(12)
                .vagueEntities(1)
                .candidates(List.of(new CurationCandidate(fact, CurationCandidate.Reason.VAGUE_ENTITY, "The")))
                .build());

        ToolResult result = tool.execute(Map.of()).join();

        assertEquals("Standard curation of 'nova': 4 queries, 12 unique facts, 0 duplicates, 1 vague entities, "
                + "0 ambiguous (left alone)\n"
                + "- VAGUE_ENTITY: The → IS → tea [e2]", result.getOutput());
    }

    @Test
    void shouldPassFlagsAndReportDeletions() {
        when(curatorService.curate(true, true)).thenReturn(CurationReport.builder()
                .namespace("nova")
                .deep(true)
                .autoDelete(true)
                .deleted(3)
                .failed(1)
                .interrupted(true)
                .build());

        ToolResult result = tool.execute(Map.of("deep", true, "auto_delete", "true")).join();

        assertTrue(result.getOutput().startsWith("Deep curation of 'nova'"));
        assertTrue(result.getOutput().endsWith(", 3 deleted, 1 skipped (interrupted)"));
    }

    @Test
    void shouldRefuseWhenGraphDisabled() {
        when(textureService.isAvailable()).thenReturn(false);

        ToolResult result = tool.execute(Map.of()).join();

        assertEquals(ErrorKind.STORAGE_UNAVAILABLE, result.getErrorKind());
        verifyNoInteractions(curatorService);
    }
}
