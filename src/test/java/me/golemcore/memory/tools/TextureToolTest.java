package me.golemcore.memory.tools;

import me.golemcore.memory.domain.model.EntityType;
import me.golemcore.memory.domain.model.EpisodeResult;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.GraphDeleteResult;
import me.golemcore.memory.domain.model.GraphFact;
import me.golemcore.memory.domain.model.Subgraph;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.model.TripletRequest;
import me.golemcore.memory.domain.service.GraphTextureService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TextureToolTest {

    private GraphTextureService textureService;
    private TextureTool tool;

    @BeforeEach
    void setUp() {
        textureService = mock(GraphTextureService.class);
        when(textureService.isAvailable()).thenReturn(true);
        when(textureService.namespace()).thenReturn("nova");
        tool = new TextureTool(textureService);
    }

    @Test
    void shouldFailFastWhenGraphDisabled() {
        when(textureService.isAvailable()).thenReturn(false);

        ToolResult result = tool.execute(Map.of("operation", "texture_search", "query", "tea")).join();

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.STORAGE_UNAVAILABLE, result.getErrorKind());
        assertFalse(tool.isEnabled());
    }

    @Test
    void shouldAddEpisodeWithReferenceTime() {
        when(textureService.addEpisode("Jeff made tea", "discord", "user",
                Instant.parse("2026-01-01T08:00:00Z"), null)).thenReturn(new EpisodeResult(true, "queued"));

        ToolResult result = tool.execute(Map.of("operation", "texture_add", "content", "Jeff made tea",
                "channel", "discord", "role_type", "user", "reference_time", "2026-01-01T08:00:00Z")).join();

        assertEquals("Episode queued for extraction in 'nova': queued", result.getOutput());
    }

    @Test
    void shouldFormatSearchResults() {
        when(textureService.search("tea", 10)).thenReturn(List.of(GraphFact.builder()
                .uuid("e1").sourceEntity("Jeff").predicate("MADE").targetEntity("tea").build()));

        ToolResult result = tool.execute(Map.of("operation", "texture_search", "query", "tea")).join();

        assertEquals("- Jeff → MADE → tea [e1]", result.getOutput());
    }

    @Test
    void shouldReportUnknownEntity() {
        when(textureService.explore("Ghost", 2)).thenReturn(new Subgraph("Ghost", 2, "nova", List.of()));

        ToolResult result = tool.execute(Map.of("operation", "texture_explore", "entity", "Ghost")).join();

        assertEquals("Nothing known about Ghost.", result.getOutput());
    }

    @Test
    void shouldRejectInvertedTimeline() {
        ToolResult result = tool.execute(Map.of("operation", "texture_timeline",
                "since", "2026-01-02T00:00:00Z", "until", "2026-01-01T00:00:00Z")).join();

        assertEquals(ErrorKind.INVALID_REQUEST, result.getErrorKind());
        verify(textureService, never()).timeline(any(), any(), anyInt());
    }

    @Test
    void shouldFailDeleteOfMissingFact() {
        when(textureService.delete("gone")).thenReturn(new GraphDeleteResult("gone", false, true, "404"));

        ToolResult result = tool.execute(Map.of("operation", "texture_delete", "uuid", "gone")).join();

        assertFalse(result.isSuccess());
        assertEquals("Fact not found: gone", result.getError());
    }

    @Test
    void shouldBuildTypedTriplet() {
        when(textureService.addTriplet(any())).thenReturn(new EpisodeResult(true, "ok"));

        ToolResult result = tool.execute(Map.of("operation", "texture_add_triplet", "source", "Jeff",
                "predicate", "LOVES", "target", "Nova", "source_type", "Person", "target_type", "person")).join();

        assertEquals("Added Jeff -[LOVES]-> Nova", result.getOutput());
        ArgumentCaptor<TripletRequest> captor = ArgumentCaptor.forClass(TripletRequest.class);
        verify(textureService).addTriplet(captor.capture());
        assertEquals(EntityType.PERSON, captor.getValue().getSourceType());
        assertEquals(EntityType.PERSON, captor.getValue().getTargetType());
    }

    @Test
    void shouldRejectUnknownEntityType() {
        ToolResult result = tool.execute(Map.of("operation", "texture_add_triplet", "source", "Jeff",
                "predicate", "LOVES", "target", "Nova", "source_type", "Alien")).join();

        assertEquals(ErrorKind.INVALID_REQUEST, result.getErrorKind());
        verify(textureService, never()).addTriplet(any());
    }
}
