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
import me.golemcore.memory.domain.model.IngestionBatch;
import me.golemcore.memory.domain.model.IngestionStats;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.GraphIngestionService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Graph ingestion backlog: stats and batch ingestion.
 */
@Component
@RequiredArgsConstructor
public class GraphIngestionTool implements ToolComponent {

    public static final String TOOL_NAME = "graph_ingestion";

    private static final String OP_STATS = "graphiti_ingestion_stats";
    private static final String OP_INGEST = "ingest_batch_to_graphiti";

    private static final String PARAM_BATCH_SIZE = "batch_size";

    private final GraphIngestionService ingestionService;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(ToolSupport.PARAM_OPERATION, Map.of(
                "type", "string",
                "enum", List.of(OP_STATS, OP_INGEST),
                "description", "Ingestion operation to perform"));
        properties.put(PARAM_BATCH_SIZE, ToolSupport.param("integer", "Turns per batch (ingest), default 20"));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Send raw turns to the knowledge graph in idempotent batches.")
                .inputSchema(ToolSupport.schema(properties, List.of(ToolSupport.PARAM_OPERATION)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        if (parameters == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Parameters are required"));
        }
        String operation = ToolSupport.string(parameters, ToolSupport.PARAM_OPERATION);
        if (operation == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Missing required parameter: operation"));
        }
        try {
            ToolResult result = switch (operation) {
            case OP_STATS -> stats();
            case OP_INGEST -> ingest(parameters);
            default -> ToolResult.failure("Unknown operation: " + operation);
            };
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolSupport.failure("Ingestion", operation, e));
        }
    }

    private ToolResult stats() {
        IngestionStats stats = ingestionService.stats();
        return ToolResult.success(stats.uningestedCount() + " turns not yet in the graph"
                + (stats.recommended() ? " (batch ingestion recommended)" : ""), stats);
    }

    private ToolResult ingest(Map<String, Object> params) {
        IngestionBatch batch = ingestionService.ingestBatch(ToolSupport.integer(params, PARAM_BATCH_SIZE, 0));
        if (batch.isEmpty()) {
            return ToolResult.success("Nothing to ingest.", batch);
        }
        String range = batch.getStartTurnId() + ".." + batch.getEndTurnId();
        if (!batch.isCompleted()) {
            return ToolResult.success("Batch " + range + " incomplete: " + batch.getFailedCount()
                    + " failed, the whole range will be retried", batch);
        }
        return ToolResult.success("Ingested turns " + range + " (" + batch.getIngestedCount() + " episodes, "
                + ingestionService.stats().uningestedCount() + " remaining)", batch);
    }
}
