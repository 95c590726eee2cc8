package me.golemcore.memory.adapter.outbound.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.EntityType;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodeRequest;
import me.golemcore.memory.domain.model.EpisodeResult;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.GraphDeleteResult;
import me.golemcore.memory.domain.model.GraphFact;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class GraphitiAdapterTest {

    private static final String NAMESPACE = "nova";
    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private MockWebServer mockServer;
    private MemoryProperties properties;
    private GraphitiAdapter adapter;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        properties = new MemoryProperties();
        properties.getGraph().setUrl(mockServer.url("/").toString());
        properties.getGraph().setTimeoutSeconds(5);
        properties.getGraph().setApiKey("secret");
        adapter = new GraphitiAdapter(properties, new OkHttpClient(), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private void enqueueJson(String body) {
        mockServer.enqueue(new MockResponse().setBody(body).setHeader(CONTENT_TYPE, APPLICATION_JSON));
    }

    @Test
    void searchFiltersByNamespaceOnServerAndClient() throws Exception {
        enqueueJson("""
                {"facts": [
                  {"uuid": "1", "name": "BUILT", "fact": "Jeff built the parser",
                   "source_node_name": "Jeff", "target_node_name": "Parser", "group_id": "nova"},
                  {"uuid": "2", "name": "IS_DUPLICATE_OF", "fact": "dup", "group_id": "nova"},
                  {"uuid": "3", "name": "KNOWS", "fact": "Other knows someone", "group_id": "other"},
                  {"uuid": "4", "name": "KNOWS", "fact": "Legacy fact", "group_id": null},
                  {"uuid": "5", "name": "OWNS", "fact": "Jeff owns a cat.", "valid_at": "2026-01-01T10:00:00Z"}
                ]}
                """);

        List<GraphFact> facts = adapter.search("parser", NAMESPACE, 10).get();

        assertEquals(List.of("1", "5"), facts.stream().map(GraphFact::getUuid).toList());
        assertEquals("Jeff", facts.get(0).getSourceEntity());
        assertEquals("Parser", facts.get(0).getTargetEntity());
        assertEquals("a cat", facts.get(1).getTargetEntity());
        assertEquals(Instant.parse("2026-01-01T10:00:00Z"), facts.get(1).getValidAt());
        assertTrue(facts.get(0).getScore() > facts.get(1).getScore());
        assertTrue(facts.stream().allMatch(f -> NAMESPACE.equals(f.getNamespace())));

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/search", request.getPath());
        assertEquals("Bearer secret", request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals(NAMESPACE, body.get("group_ids").get(0).asText());
        assertEquals(1, body.get("group_ids").size());
        assertEquals(10, body.get("max_facts").asInt());
    }

    @Test
    void searchLeavesUnsplittableEndpointsUnresolved() throws Exception {
        enqueueJson("""
                {"facts": [
                  {"uuid": "e1", "name": "FEELS", "fact": "Contentment", "group_id": "nova"},
                  {"uuid": "e2", "name": "BUILT", "fact": "Jeff built it",
                   "source_node_name": "Jeff", "target_node_name": "Parser", "group_id": "nova"}
                ]}
                """);

        List<GraphFact> facts = adapter.search("feelings", NAMESPACE, 10).get();

        assertEquals("Contentment", facts.get(0).getSourceEntity());
        assertNull(facts.get(0).getTargetEntity());
        assertTrue(facts.get(0).isEndpointsInferred());
        assertFalse(facts.get(1).isEndpointsInferred());
    }

    @Test
    void blankNamespaceIsRejected() {
        SubstrateException thrown = assertThrows(SubstrateException.class,
                () -> adapter.search("parser", " ", 5));

        assertEquals(ErrorKind.INVALID_REQUEST, thrown.getKind());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void addEpisodePostsMessageWithGroupAndGuidance() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(202));

        EpisodeResult result = adapter.addEpisode(EpisodeRequest.builder()
                .content("Jeff: the parser works")
                .speaker("Jeff")
                .roleType("user")
                .channel("terminal")
                .namespace(NAMESPACE)
                .referenceTime(Instant.parse("2026-01-01T10:00:00Z"))
                .entityTypes(List.of(EntityType.PERSON, EntityType.TECHNICAL_ARTIFACT))
                .extractionInstructions("guidance")
                .build()).get();

        assertTrue(result.accepted());
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("/messages", request.getPath());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals(NAMESPACE, body.get("group_id").asText());
        assertEquals("guidance", body.get("custom_extraction_instructions").asText());
        JsonNode message = body.get("messages").get(0);
        assertEquals("Jeff", message.get("name").asText());
        assertEquals("user", message.get("role_type").asText());
        assertEquals("2026-01-01T10:00:00Z", message.get("timestamp").asText());
        assertEquals("terminal", message.get("source_description").asText());
        assertEquals("TechnicalArtifact", body.get("entity_types").get(1).asText());
    }

    @Test
    void serverErrorBecomesStorageUnavailable() {
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> adapter.search("parser", NAMESPACE, 5).get());

        assertInstanceOf(StorageUnavailableException.class, thrown.getCause());
    }

    @Test
    void disabledGraphFailsWithoutNetwork() {
        properties.getGraph().setEnabled(false);

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> adapter.search("parser", NAMESPACE, 5).get());

        assertInstanceOf(StorageUnavailableException.class, thrown.getCause());
        assertFalse(adapter.isAvailable());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void deleteReportsNotFound() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(404));

        GraphDeleteResult result = adapter.delete("edge-1").get();

        assertFalse(result.deleted());
        assertTrue(result.notFound());
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("/entity-edge/edge-1", request.getPath());
    }

    @Test
    void deleteReportsSuccess() throws Exception {
        enqueueJson("{\"message\": \"Entity Edge deleted\"}");

        GraphDeleteResult result = adapter.delete("edge-1").get();

        assertTrue(result.deleted());
        assertEquals("Entity Edge deleted", result.message());
    }

    @Test
    void timelineKeepsNamespaceAndWindow() throws Exception {
        enqueueJson("""
                [
                  {"uuid": "e1", "name": "ep1", "content": "early", "group_id": "nova",
                   "valid_at": "2026-01-01T08:00:00Z"},
                  {"uuid": "e2", "name": "ep2", "content": "inside", "group_id": "nova",
                   "valid_at": "2026-01-01T10:00:00Z"},
                  {"uuid": "e3", "name": "ep3", "content": "foreign", "group_id": "other",
                   "valid_at": "2026-01-01T10:30:00Z"}
                ]
                """);

        List<Episode> episodes = adapter.timeline(Instant.parse("2026-01-01T09:00:00Z"),
                Instant.parse("2026-01-01T11:00:00Z"), NAMESPACE, 10).get();

        assertEquals(1, episodes.size());
        assertEquals("inside", episodes.get(0).getContent());
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("/episodes/nova?last_n=100", request.getPath());
    }

    @Test
    void healthCheckHitsHealthEndpoint() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(200));

        assertTrue(adapter.isHealthy());
        assertEquals("/healthcheck", mockServer.takeRequest().getPath());
    }
}
