package me.golemcore.memory.adapter.outbound.index;

import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.model.SemanticHit;
import me.golemcore.memory.testsupport.HashingEmbeddingPort;
import me.golemcore.memory.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LocalSemanticIndexAdapterTest {

    @TempDir
    Path tempDir;

    private TestWorkspace workspace;
    private HashingEmbeddingPort embeddingPort;
    private LocalSemanticIndexAdapter index;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(tempDir);
        embeddingPort = new HashingEmbeddingPort();
        index = newIndex();
    }

    private LocalSemanticIndexAdapter newIndex() {
        return new LocalSemanticIndexAdapter(embeddingPort, workspace.storage(), workspace.objectMapper(),
                workspace.properties());
    }

    @Test
    void shouldRankBySimilarity() {
        index.upsert("cat", "the orange cat sleeps on the porch", Map.of("title", "Cat"));
        index.upsert("parser", "rewriting the parser with better errors", Map.of("title", "Parser"));

        List<SemanticHit> hits = index.search("parser errors", 2);

        assertEquals("parser", hits.get(0).id());
        assertEquals("Parser", hits.get(0).metadata().get("title"));
        assertTrue(hits.get(0).score() > hits.get(1).score());
    }

    @Test
    void shouldPersistAcrossInstances() {
        index.upsert("cat", "the orange cat", Map.of());

        LocalSemanticIndexAdapter reopened = newIndex();

        assertEquals(Set.of("cat"), reopened.ids());
        assertEquals(1, reopened.count());
    }

    @Test
    void shouldKeepEntriesWrittenByAnotherInstance() {
        index.upsert("cat", "the orange cat", Map.of());
        LocalSemanticIndexAdapter other = newIndex();
        assertEquals(1, other.count());

        index.upsert("parser", "rewriting the parser", Map.of());
        other.upsert("tea", "morning tea by the window", Map.of());

        assertEquals(Set.of("cat", "parser", "tea"), newIndex().ids());
        assertEquals(Set.of("cat", "parser", "tea"), index.ids());
    }

    @Test
    void shouldRemoveAndClear() {
        index.upsert("a", "alpha text", Map.of());
        index.upsert("b", "beta text", Map.of());

        assertTrue(index.remove("a"));
        assertFalse(index.remove("a"));
        assertEquals(1, index.count());

        index.clear();
        assertEquals(0, newIndex().count());
    }

    @Test
    void shouldUpsertBatchInOneCall() {
        Map<String, String> content = new LinkedHashMap<>();
        content.put("one", "first anchor text");
        content.put("two", "second anchor text");

        index.upsertAll(content, Map.of("one", Map.of("title", "One")));

        assertEquals(2, index.count());
        assertEquals(1, embeddingPort.getCalls());
    }

    @Test
    void shouldFailWhenBackendUnavailable() {
        embeddingPort.setAvailable(false);

        assertThrows(StorageUnavailableException.class, () -> index.upsert("x", "text", Map.of()));
        assertFalse(index.isAvailable());
    }

    @Test
    void shouldWrapBackendFailure() {
        index.upsert("x", "some text here", Map.of());
        embeddingPort.setFailing(true);

        assertThrows(StorageUnavailableException.class, () -> index.search("text", 3));
    }
}
