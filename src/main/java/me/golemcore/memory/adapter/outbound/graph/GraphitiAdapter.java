package me.golemcore.memory.adapter.outbound.graph;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
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
import me.golemcore.memory.domain.model.Subgraph;
import me.golemcore.memory.domain.model.TripletRequest;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.GraphPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Graphiti adapter - communicates with a Graphiti REST service over HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /messages - submit an episode for extraction
 * <li>POST /triplets - assert a structured fact
 * <li>POST /search - fact search scoped by {@code group_ids}
 * <li>GET /episodes/{group_id} - recent episodes of a namespace
 * <li>DELETE /entity-edge/{uuid} - delete a fact
 * <li>GET /healthcheck - health check
 * </ul>
 *
 * <p>
 * Namespace isolation: every query sends exactly one group id and the server
 * filters on it. Returned facts that carry a different or empty group are
 * dropped as well, so data written before namespaces existed is never
 * visible to scoped queries.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code memory.graph.enabled} - Enable/disable the graph layer
 * <li>{@code memory.graph.url} - Graphiti API base URL
 * <li>{@code memory.graph.api-key} - Optional API key
 * <li>{@code memory.graph.timeout-seconds} - HTTP timeout
 * </ul>
 *
 * @see me.golemcore.memory.port.outbound.GraphPort
 */
@Component
@Slf4j
public class GraphitiAdapter implements GraphPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String DUPLICATE_EDGE = "IS_DUPLICATE_OF";
    private static final int EPISODE_FETCH_FLOOR = 100;

    private final MemoryProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GraphitiAdapter(MemoryProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getGraph().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<EpisodeResult> addEpisode(EpisodeRequest request) {
        String namespace = requireNamespace(request.getNamespace());
        return CompletableFuture.supplyAsync(() -> {
            Instant timestamp = request.getReferenceTime() != null ? request.getReferenceTime() : Instant.now();
            MessagePayload message = new MessagePayload(
                    request.getContent(),
                    request.getSpeaker(),
                    request.getRoleType(),
                    request.getSpeaker(),
                    timestamp.toString(),
                    request.getChannel() != null ? request.getChannel() : "conversation");
            List<String> entityTypes = request.getEntityTypes().stream().map(EntityType::getTypeName).toList();
            MessagesRequest body = new MessagesRequest(namespace, List.of(message), entityTypes,
                    request.getExtractionInstructions());

            try (Response response = execute(post("/messages", body))) {
                if (!response.isSuccessful()) {
                    throw httpFailure("add episode", response);
                }
                log.debug("[Graph] Episode accepted for {} ({} chars)", namespace, length(request.getContent()));
                return new EpisodeResult(true, "Episode queued for extraction");
            }
        });
    }

    @Override
    public CompletableFuture<EpisodeResult> addTriplet(TripletRequest request) {
        String namespace = requireNamespace(request.getNamespace());
        if (isBlank(request.getSource()) || isBlank(request.getPredicate()) || isBlank(request.getTarget())) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "source, predicate and target are required");
        }
        return CompletableFuture.supplyAsync(() -> {
            String fact = !isBlank(request.getFact())
                    ? request.getFact()
                    : request.getSource() + " " + request.getPredicate() + " " + request.getTarget();
            TripletPayload body = new TripletPayload(namespace,
                    new NodePayload(request.getSource(), typeName(request.getSourceType())),
                    request.getPredicate(),
                    new NodePayload(request.getTarget(), typeName(request.getTargetType())),
                    fact);

            try (Response response = execute(post("/triplets", body))) {
                if (!response.isSuccessful()) {
                    throw httpFailure("add triplet", response);
                }
                log.debug("[Graph] Triplet stored: {} -[{}]-> {}", request.getSource(), request.getPredicate(),
                        request.getTarget());
                return new EpisodeResult(true, "Triplet stored");
            }
        });
    }

    @Override
    public CompletableFuture<List<GraphFact>> search(String query, String namespace, int limit) {
        String ns = requireNamespace(namespace);
        return CompletableFuture.supplyAsync(() -> searchFacts(query, ns, limit));
    }

    @Override
    public CompletableFuture<Subgraph> explore(String entityName, int depth, String namespace) {
        String ns = requireNamespace(namespace);
        int effectiveDepth = Math.max(1, depth);
        return CompletableFuture.supplyAsync(() -> {
            List<GraphFact> facts = searchFacts(entityName, ns, effectiveDepth * 10);
            String needle = entityName.toLowerCase(Locale.ROOT);
            List<GraphFact> connected = facts.stream()
                    .filter(f -> mentions(f, needle))
                    .toList();
            return new Subgraph(entityName, effectiveDepth, ns, connected.isEmpty() ? facts : connected);
        });
    }

    @Override
    public CompletableFuture<List<Episode>> timeline(Instant since, Instant until, String namespace, int limit) {
        String ns = requireNamespace(namespace);
        return CompletableFuture.supplyAsync(() -> {
            HttpUrl url = HttpUrl.get(baseUrl() + "/episodes/" + ns).newBuilder()
                    .addQueryParameter("last_n", String.valueOf(Math.max(limit, EPISODE_FETCH_FLOOR)))
                    .build();
            Request.Builder builder = new Request.Builder().url(url).get();
            addApiKeyHeader(builder);

            try (Response response = execute(builder.build())) {
                if (!response.isSuccessful()) {
                    throw httpFailure("timeline", response);
                }
                JsonNode root = readBody(response);
                JsonNode array = root.isArray() ? root : root.path("episodes");
                List<Episode> episodes = new ArrayList<>();
                for (JsonNode node : array) {
                    if (!sameNamespace(node, ns)) {
                        continue;
                    }
                    Episode episode = Episode.builder()
                            .uuid(node.path("uuid").asText(null))
                            .name(node.path("name").asText(null))
                            .content(node.path("content").asText(node.path("name").asText("")))
                            .namespace(ns)
                            .createdAt(parseInstant(node.path("created_at").asText(null)))
                            .validAt(parseInstant(node.path("valid_at").asText(null)))
                            .build();
                    Instant at = episode.getValidAt() != null ? episode.getValidAt() : episode.getCreatedAt();
                    if (since != null && (at == null || at.isBefore(since))) {
                        continue;
                    }
                    if (until != null && at != null && at.isAfter(until)) {
                        continue;
                    }
                    episodes.add(episode);
                }
                return episodes.stream()
                        .sorted(Comparator.comparing(GraphitiAdapter::episodeTime,
                                Comparator.nullsFirst(Comparator.naturalOrder())))
                        .limit(limit)
                        .toList();
            }
        });
    }

    @Override
    public CompletableFuture<GraphDeleteResult> delete(String uuid) {
        if (isBlank(uuid)) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "uuid is required");
        }
        return CompletableFuture.supplyAsync(() -> {
            Request.Builder builder = new Request.Builder().url(baseUrl() + "/entity-edge/" + uuid).delete();
            addApiKeyHeader(builder);

            try (Response response = execute(builder.build())) {
                if (response.code() == 404) {
                    return new GraphDeleteResult(uuid, false, true, "Edge not found (may already be deleted)");
                }
                if (!response.isSuccessful()) {
                    throw httpFailure("delete", response);
                }
                String message = "Edge deleted";
                JsonNode root = readBody(response);
                if (root.hasNonNull("message")) {
                    message = root.get("message").asText();
                }
                log.debug("[Graph] Deleted edge {}", uuid);
                return new GraphDeleteResult(uuid, true, false, message);
            }
        });
    }

    @Override
    public boolean isHealthy() {
        if (!isAvailable()) {
            return false;
        }
        Request request = new Request.Builder().url(baseUrl() + "/healthcheck").get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            return response.isSuccessful();
        } catch (IOException e) {
            log.debug("[Graph] Health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isAvailable() {
        return properties.getGraph().isEnabled();
    }

    private List<GraphFact> searchFacts(String query, String namespace, int limit) {
        SearchRequest body = new SearchRequest(query, List.of(namespace), limit);
        try (Response response = execute(post("/search", body))) {
            if (!response.isSuccessful()) {
                throw httpFailure("search", response);
            }
            JsonNode facts = readBody(response).path("facts");

            List<JsonNode> kept = new ArrayList<>();
            for (JsonNode fact : facts) {
                if (DUPLICATE_EDGE.equals(fact.path("name").asText())) {
                    continue;
                }
                if (!sameNamespace(fact, namespace)) {
                    log.warn("[Graph] Dropped fact {} outside namespace {}", fact.path("uuid").asText(), namespace);
                    continue;
                }
                kept.add(fact);
            }

            List<GraphFact> results = new ArrayList<>();
            int total = Math.max(kept.size(), 1);
            for (int i = 0; i < kept.size(); i++) {
                results.add(toFact(kept.get(i), namespace, 1.0 - ((double) i / total) * 0.5));
            }
            return results.size() > limit ? results.subList(0, limit) : results;
        }
    }

    private GraphFact toFact(JsonNode node, String namespace, double score) {
        String factText = node.path("fact").asText("");
        String predicate = node.path("name").asText("RELATES_TO");
        String source = node.path("source_node_name").asText(null);
        String target = node.path("target_node_name").asText(null);
        boolean inferred = false;
        if (isBlank(source) || isBlank(target)) {
            String[] extracted = FactEntityExtractor.extract(factText);
            source = isBlank(source) ? extracted[0] : source;
            target = isBlank(target) ? extracted[1] : target;
            inferred = true;
        }
        return GraphFact.builder()
                .uuid(node.path("uuid").asText(null))
                .sourceEntity(source)
                .predicate(predicate)
                .targetEntity(target)
                .endpointsInferred(inferred)
                .fact(factText)
                .namespace(namespace)
                .validAt(parseInstant(node.path("valid_at").asText(null)))
                .invalidAt(parseInstant(node.path("invalid_at").asText(null)))
                .score(score)
                .build();
    }

    /**
     * A node without a group field was already filtered by the server; a node
     * with a null, blank or foreign group is outside the namespace.
     */
    private static boolean sameNamespace(JsonNode node, String namespace) {
        if (!node.has("group_id")) {
            return true;
        }
        JsonNode group = node.get("group_id");
        return !group.isNull() && namespace.equals(group.asText());
    }

    private static boolean mentions(GraphFact fact, String needle) {
        return contains(fact.getSourceEntity(), needle)
                || contains(fact.getTargetEntity(), needle)
                || contains(fact.getFact(), needle);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private Request post(String path, Object body) {
        try {
            Request.Builder builder = new Request.Builder()
                    .url(baseUrl() + path)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON));
            addApiKeyHeader(builder);
            return builder.build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph request", e);
        }
    }

    private Response execute(Request request) {
        if (!isAvailable()) {
            throw new StorageUnavailableException("Graph layer disabled");
        }
        try {
            return httpClient.newCall(request).execute();
        } catch (IOException e) {
            log.warn("[Graph] {} {} failed: {}", request.method(), request.url().encodedPath(), e.getMessage());
            throw new StorageUnavailableException("Graph service unreachable: " + e.getMessage(), e);
        }
    }

    private JsonNode readBody(Response response) {
        ResponseBody body = response.body();
        if (body == null) {
            return objectMapper.createObjectNode();
        }
        try {
            String text = body.string();
            return text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (IOException e) {
            throw new StorageUnavailableException("Unreadable graph response: " + e.getMessage(), e);
        }
    }

    private StorageUnavailableException httpFailure(String operation, Response response) {
        log.warn("[Graph] {} failed: HTTP {}", operation, response.code());
        return new StorageUnavailableException("Graph " + operation + " failed: HTTP " + response.code());
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getGraph().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    private String baseUrl() {
        String url = properties.getGraph().getUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String requireNamespace(String namespace) {
        if (isBlank(namespace)) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Graph namespace is required");
        }
        return namespace;
    }

    private static Instant episodeTime(Episode episode) {
        return episode.getValidAt() != null ? episode.getValidAt() : episode.getCreatedAt();
    }

    private static Instant parseInstant(String value) {
        if (isBlank(value) || "null".equals(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException nested) {
                log.debug("[Graph] Unparseable timestamp: {}", value);
                return null;
            }
        }
    }

    private static String typeName(EntityType type) {
        return type != null ? type.getTypeName() : null;
    }

    private static int length(String value) {
        return value != null ? value.length() : 0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // Request DTOs
    record MessagePayload(String content, String name, String role_type, String role, String timestamp,
            String source_description) {
    }

    record MessagesRequest(String group_id, List<MessagePayload> messages, List<String> entity_types,
            String custom_extraction_instructions) {
    }

    record NodePayload(String name, String entity_type) {
    }

    record TripletPayload(String group_id, NodePayload source, String predicate, NodePayload target, String fact) {
    }

    record SearchRequest(String query, List<String> group_ids, int max_facts) {
    }
}
