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
import me.golemcore.memory.domain.model.RecallReport;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.AmbientRecallService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Unified recall across crystals, anchors, graph, summaries and raw turns.
 */
@Component
@RequiredArgsConstructor
public class AmbientRecallTool implements ToolComponent {

    public static final String TOOL_NAME = "ambient_recall";

    private static final String PARAM_CONTEXT = "context";
    private static final String PARAM_LIMIT = "limit_per_layer";

    private final AmbientRecallService recallService;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_CONTEXT, ToolSupport.param("string",
                "What to recall. Use 'startup' for the session-start package"));
        properties.put(PARAM_LIMIT, ToolSupport.param("integer", "Maximum results per layer"));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Recall memories from every layer with a clock line, memory health and manifest.")
                .inputSchema(ToolSupport.schema(properties, List.of(PARAM_CONTEXT)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        try {
            RecallReport report = recallService.recall(ToolSupport.string(params, PARAM_CONTEXT),
                    ToolSupport.integer(params, PARAM_LIMIT, 0));
            return CompletableFuture.completedFuture(ToolResult.success(report.getFormatted(), report));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolSupport.failure("Recall", TOOL_NAME, e));
        }
    }
}
