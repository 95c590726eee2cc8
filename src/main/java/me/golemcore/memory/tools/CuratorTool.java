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
import me.golemcore.memory.domain.model.CurationCandidate;
import me.golemcore.memory.domain.model.CurationReport;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.GraphCuratorService;
import me.golemcore.memory.domain.service.GraphTextureService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Manual graph curation pass. Report-only unless auto_delete is set.
 */
@Component
@RequiredArgsConstructor
public class CuratorTool implements ToolComponent {

    public static final String TOOL_NAME = "graph_curate";

    private static final String PARAM_DEEP = "deep";
    private static final String PARAM_AUTO_DELETE = "auto_delete";
    private static final int MAX_LISTED = 20;

    private final GraphCuratorService curatorService;
    private final GraphTextureService textureService;
    private final MemoryProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> schemaProperties = new LinkedHashMap<>();
        schemaProperties.put(PARAM_DEEP, ToolSupport.param("boolean", "Use the extended query set"));
        schemaProperties.put(PARAM_AUTO_DELETE, ToolSupport.param("boolean",
                "Delete duplicate and vague-entity facts instead of only reporting them"));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Sample the graph and find duplicate or vague-entity facts.")
                .inputSchema(ToolSupport.schema(schemaProperties, List.of()))
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
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        try {
            CurationReport report = curatorService.curate(
                    ToolSupport.bool(params, PARAM_DEEP, properties.getCurator().isDeep()),
                    ToolSupport.bool(params, PARAM_AUTO_DELETE, properties.getCurator().isAutoDelete()));
            return CompletableFuture.completedFuture(ToolResult.success(format(report), report));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolSupport.failure("Curator", TOOL_NAME, e));
        }
    }

    private static String format(CurationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(report.isDeep() ? "Deep" : "Standard").append(" curation of '").append(report.getNamespace())
                .append("': ").append(report.getQueriesRun()).append(" queries, ").append(report.getUniqueFacts())
                .append(" unique facts, ").append(report.getDuplicates()).append(" duplicates, ")
                .append(report.getVagueEntities()).append(" vague entities, ").append(report.getAmbiguous())
                .append(" ambiguous (left alone)");
        if (report.isAutoDelete()) {
            sb.append(", ").append(report.getDeleted()).append(" deleted, ").append(report.getFailed())
                    .append(" skipped");
        }
        if (report.isInterrupted()) {
            sb.append(" (interrupted)");
        }
        List<CurationCandidate> candidates = report.getCandidates();
        for (int i = 0; i < Math.min(MAX_LISTED, candidates.size()); i++) {
            CurationCandidate candidate = candidates.get(i);
            sb.append("\n- ").append(candidate.reason()).append(": ").append(candidate.fact().describe())
                    .append(" [").append(candidate.fact().getUuid()).append(']');
        }
        if (candidates.size() > MAX_LISTED) {
            sb.append("\n... ").append(candidates.size() - MAX_LISTED).append(" more");
        }
        return sb.toString();
    }
}
