package me.golemcore.memory.tools;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.memory.domain.component.ToolComponent;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.EntityType;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodeResult;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.GraphDeleteResult;
import me.golemcore.memory.domain.model.GraphFact;
import me.golemcore.memory.domain.model.Subgraph;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.model.TripletRequest;
import me.golemcore.memory.domain.service.GraphTextureService;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Knowledge-graph texture: episodes, triplets, search, explore, timeline,
 * delete. Every call is scoped to the configured namespace.
 */
@Component
@RequiredArgsConstructor
public class TextureTool implements ToolComponent {

    public static final String TOOL_NAME = "texture";

    private static final String OP_ADD = "texture_add";
    private static final String OP_SEARCH = "texture_search";
    private static final String OP_EXPLORE = "texture_explore";
    private static final String OP_TIMELINE = "texture_timeline";
    private static final String OP_DELETE = "texture_delete";
    private static final String OP_ADD_TRIPLET = "texture_add_triplet";

    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_CHANNEL = "channel";
    private static final String PARAM_ROLE_TYPE = "role_type";
    private static final String PARAM_REFERENCE_TIME = "reference_time";
    private static final String PARAM_HINTS = "hints";
    private static final String PARAM_QUERY = "query";
    private static final String PARAM_LIMIT = "limit";
    private static final String PARAM_ENTITY = "entity";
    private static final String PARAM_DEPTH = "depth";
    private static final String PARAM_SINCE = "since";
    private static final String PARAM_UNTIL = "until";
    private static final String PARAM_UUID = "uuid";
    private static final String PARAM_SOURCE = "source";
    private static final String PARAM_PREDICATE = "predicate";
    private static final String PARAM_TARGET = "target";
    private static final String PARAM_FACT = "fact";
    private static final String PARAM_SOURCE_TYPE = "source_type";
    private static final String PARAM_TARGET_TYPE = "target_type";

    private final GraphTextureService textureService;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(ToolSupport.PARAM_OPERATION, Map.of(
                "type", "string",
                "enum", List.of(OP_ADD, OP_SEARCH, OP_EXPLORE, OP_TIMELINE, OP_DELETE, OP_ADD_TRIPLET),
                "description", "Graph operation to perform"));
        properties.put(PARAM_CONTENT, ToolSupport.param("string", "Episode text (add)"));
        properties.put(PARAM_CHANNEL, ToolSupport.param("string", "Source channel, selects extraction overlay (add)"));
        properties.put(PARAM_ROLE_TYPE, ToolSupport.param("string", "user or assistant (add)"));
        properties.put(PARAM_REFERENCE_TIME, ToolSupport.param("string", "ISO-8601 time of the episode (add)"));
        properties.put(PARAM_HINTS, ToolSupport.param("string", "Extra extraction hints (add)"));
        properties.put(PARAM_QUERY, ToolSupport.param("string", "Search text (search)"));
        properties.put(PARAM_LIMIT, ToolSupport.param("integer", "Result limit (search, timeline)"));
        properties.put(PARAM_ENTITY, ToolSupport.param("string", "Entity name (explore)"));
        properties.put(PARAM_DEPTH, ToolSupport.param("integer", "Hops to follow (explore), default 2"));
        properties.put(PARAM_SINCE, ToolSupport.param("string", "ISO-8601 lower bound (timeline)"));
        properties.put(PARAM_UNTIL, ToolSupport.param("string", "ISO-8601 upper bound (timeline)"));
        properties.put(PARAM_UUID, ToolSupport.param("string", "Fact uuid (delete)"));
        properties.put(PARAM_SOURCE, ToolSupport.param("string", "Source entity (add_triplet)"));
        properties.put(PARAM_PREDICATE, ToolSupport.param("string", "Relationship name (add_triplet)"));
        properties.put(PARAM_TARGET, ToolSupport.param("string", "Target entity (add_triplet)"));
        properties.put(PARAM_FACT, ToolSupport.param("string", "Fact sentence (add_triplet)"));
        properties.put(PARAM_SOURCE_TYPE, Map.of("type", "string", "enum", entityTypeNames(),
                "description", "Source entity type (add_triplet)"));
        properties.put(PARAM_TARGET_TYPE, Map.of("type", "string", "enum", entityTypeNames(),
                "description", "Target entity type (add_triplet)"));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Knowledge-graph memory: add episodes or triplets, search facts, explore entities,"
                        + " read the episode timeline, delete facts.")
                .inputSchema(ToolSupport.schema(properties, List.of(ToolSupport.PARAM_OPERATION)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return textureService.isAvailable();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        if (!isEnabled()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ErrorKind.STORAGE_UNAVAILABLE, "Graph layer disabled"));
        }
        if (parameters == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Parameters are required"));
        }
        String operation = ToolSupport.string(parameters, ToolSupport.PARAM_OPERATION);
        if (operation == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Missing required parameter: operation"));
        }
        try {
            ToolResult result = switch (operation) {
            case OP_ADD -> add(parameters);
            case OP_SEARCH -> search(parameters);
            case OP_EXPLORE -> explore(parameters);
            case OP_TIMELINE -> timeline(parameters);
            case OP_DELETE -> delete(parameters);
            case OP_ADD_TRIPLET -> addTriplet(parameters);
            default -> ToolResult.failure("Unknown operation: " + operation);
            };
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolSupport.failure("Graph", operation, e));
        }
    }

    private ToolResult add(Map<String, Object> params) {
        EpisodeResult result = textureService.addEpisode(
                ToolSupport.requireString(params, PARAM_CONTENT),
                ToolSupport.string(params, PARAM_CHANNEL),
                ToolSupport.string(params, PARAM_ROLE_TYPE),
                ToolSupport.instant(params, PARAM_REFERENCE_TIME),
                ToolSupport.string(params, PARAM_HINTS));
        return ToolResult.success("Episode queued for extraction in '" + textureService.namespace() + "': "
                + result.message(), result);
    }

    private ToolResult search(Map<String, Object> params) {
        List<GraphFact> facts = textureService.search(ToolSupport.requireString(params, PARAM_QUERY),
                ToolSupport.integer(params, PARAM_LIMIT, 10));
        if (facts.isEmpty()) {
            return ToolResult.success("No facts found.");
        }
        return ToolResult.success(formatFacts(facts), Map.of("facts", facts));
    }

    private ToolResult explore(Map<String, Object> params) {
        Subgraph subgraph = textureService.explore(ToolSupport.requireString(params, PARAM_ENTITY),
                ToolSupport.integer(params, PARAM_DEPTH, 2));
        if (subgraph.facts().isEmpty()) {
            return ToolResult.success("Nothing known about " + subgraph.entity() + ".", subgraph);
        }
        return ToolResult.success(subgraph.entity() + " (depth " + subgraph.depth() + "):\n"
                + formatFacts(subgraph.facts()), subgraph);
    }

    private ToolResult timeline(Map<String, Object> params) {
        Instant since = ToolSupport.instant(params, PARAM_SINCE);
        Instant until = ToolSupport.instant(params, PARAM_UNTIL);
        if (since != null && until != null && until.isBefore(since)) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "until must not be before since");
        }
        List<Episode> episodes = textureService.timeline(since, until, ToolSupport.integer(params, PARAM_LIMIT, 20));
        if (episodes.isEmpty()) {
            return ToolResult.success("No episodes in range.");
        }
        StringBuilder sb = new StringBuilder();
        for (Episode episode : episodes) {
            sb.append("- ").append(episode.getValidAt() != null ? episode.getValidAt() : episode.getCreatedAt())
                    .append(' ').append(episode.getName()).append('\n');
        }
        return ToolResult.success(sb.toString().trim(), Map.of("episodes", episodes));
    }

    private ToolResult delete(Map<String, Object> params) {
        GraphDeleteResult result = textureService.delete(ToolSupport.requireString(params, PARAM_UUID));
        if (result.notFound()) {
            return ToolResult.failure("Fact not found: " + result.uuid());
        }
        return ToolResult.success("Deleted fact " + result.uuid(), result);
    }

    private ToolResult addTriplet(Map<String, Object> params) {
        TripletRequest request = TripletRequest.builder()
                .source(ToolSupport.requireString(params, PARAM_SOURCE))
                .predicate(ToolSupport.requireString(params, PARAM_PREDICATE))
                .target(ToolSupport.requireString(params, PARAM_TARGET))
                .fact(ToolSupport.string(params, PARAM_FACT))
                .sourceType(entityType(params, PARAM_SOURCE_TYPE))
                .targetType(entityType(params, PARAM_TARGET_TYPE))
                .build();
        EpisodeResult result = textureService.addTriplet(request);
        return ToolResult.success("Added " + request.getSource() + " -[" + request.getPredicate() + "]-> "
                + request.getTarget(), result);
    }

    private static EntityType entityType(Map<String, Object> params, String key) {
        String name = ToolSupport.string(params, key);
        if (name == null) {
            return null;
        }
        EntityType type = EntityType.fromTypeName(name);
        if (type == null) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Unknown entity type: " + name);
        }
        return type;
    }

    private static List<String> entityTypeNames() {
        return Arrays.stream(EntityType.values()).map(EntityType::getTypeName).toList();
    }

    private static String formatFacts(List<GraphFact> facts) {
        StringBuilder sb = new StringBuilder();
        for (GraphFact fact : facts) {
            sb.append("- ").append(fact.describe()).append(" [").append(fact.getUuid()).append("]\n");
        }
        return sb.toString().trim();
    }
}
