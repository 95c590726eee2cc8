package me.golemcore.memory.domain.service.recall;

import me.golemcore.memory.domain.model.Anchor;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.RecallResult;
import me.golemcore.memory.domain.service.AnchorService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AnchorRecallLayerTest {

    private AnchorService anchorService;
    private AnchorRecallLayer layer;

    @BeforeEach
    void setUp() {
        anchorService = mock(AnchorService.class);
        layer = new AnchorRecallLayer(anchorService, new MemoryProperties());
    }

    @Test
    void shouldLoadNewestAnchorsOnStartup() {
        Anchor anchor = Anchor.builder()
                .filename("2026-01-01_morning_tea.md")
                .title("Morning tea")
                .content("We sat by the window.")
                .createdAt(Instant.parse("2026-01-01T09:00:00Z"))
                .build();
        when(anchorService.newest(2)).thenReturn(List.of(anchor));

        List<RecallResult> results = layer.startup();

        assertEquals(1, results.size());
        assertEquals(RecallLayer.ANCHORS, results.get(0).getLayer());
        assertEquals("2026-01-01_morning_tea.md", results.get(0).getSource());
        assertEquals("We sat by the window.", results.get(0).getContent());
    }

    @Test
    void shouldDelegateSearchAndDegradation() {
        RecallResult hit = RecallResult.builder()
                .layer(RecallLayer.ANCHORS)
                .source("2026-01-01_morning_tea.md")
                .content("tea")
                .score(0.8)
                .build();
        when(anchorService.search("tea", 4)).thenReturn(List.of(hit));
        when(anchorService.isIndexDegraded()).thenReturn(true);

        assertEquals(List.of(hit), layer.search("tea", 4));
        assertTrue(layer.isDegraded());
        assertEquals(RecallLayer.ANCHORS, layer.layer());
    }
}
