package me.golemcore.memory.adapter.outbound.embedding;

import me.golemcore.memory.infrastructure.config.MemoryProperties;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class Langchain4jEmbeddingAdapterTest {

    private MemoryProperties properties;
    private EmbeddingModel model;
    private Langchain4jEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        properties.getEmbedding().setApiKey("test-key");
        properties.getEmbedding().setBatchSize(2);
        model = mock(EmbeddingModel.class);
        adapter = new Langchain4jEmbeddingAdapter(properties) {
            @Override
            protected EmbeddingModel createModel(MemoryProperties.EmbeddingProperties config) {
                return model;
            }
        };
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        properties.getEmbedding().setApiKey("");

        assertFalse(adapter.isAvailable());
        CompletionException thrown = assertThrows(CompletionException.class, () -> adapter.embed("x").join());
        assertTrue(thrown.getCause() instanceof IllegalStateException);
    }

    @Test
    void shouldEmbedSingleText() {
        when(model.embed("tea")).thenReturn(Response.from(Embedding.from(new float[] { 1f, 0f })));

        assertArrayEquals(new float[] { 1f, 0f }, adapter.embed("tea").join());
    }

    @Test
    void shouldSplitBatchIntoChunksKeepingOrder() {
        when(model.embedAll(anyList())).thenAnswer(inv -> {
            List<TextSegment> segments = inv.getArgument(0);
            return Response.from(segments.stream()
                    .map(s -> Embedding.from(new float[] { s.text().length() }))
                    .toList());
        });

        List<float[]> vectors = adapter.embedBatch(List.of("a", "bb", "ccc", "dddd", "eeeee")).join();

        assertEquals(5, vectors.size());
        assertEquals(3f, vectors.get(2)[0]);
        assertEquals(5f, vectors.get(4)[0]);
        verify(model, times(3)).embedAll(anyList());
    }

    @Test
    void shouldFallBackToDefaultModelName() {
        properties.getEmbedding().setModel(" ");

        assertEquals("text-embedding-3-small", adapter.getModel());
    }
}
