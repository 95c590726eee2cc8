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
import me.golemcore.memory.domain.model.Crystal;
import me.golemcore.memory.domain.model.CrystalListing;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.CrystallizationService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Crystal chain: create, list, read, delete the newest.
 */
@Component
@RequiredArgsConstructor
public class CrystalTool implements ToolComponent {

    public static final String TOOL_NAME = "crystal";

    private static final String OP_CRYSTALLIZE = "crystallize";
    private static final String OP_LIST = "crystal_list";
    private static final String OP_GET = "get_crystals";
    private static final String OP_DELETE = "crystal_delete";

    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_COUNT = "count";
    private static final String PARAM_FILENAME = "filename";

    private static final int PREVIEW_CHARS = 160;

    private final CrystallizationService crystallizationService;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(ToolSupport.PARAM_OPERATION, Map.of(
                "type", "string",
                "enum", List.of(OP_CRYSTALLIZE, OP_LIST, OP_GET, OP_DELETE),
                "description", "Crystal operation to perform"));
        properties.put(PARAM_CONTENT, ToolSupport.param("string",
                "Crystal text for manual creation; must contain the sections Field State, Key Events,"
                        + " Decisions, Internal Arc, Continuity Seeds. Omit to generate"));
        properties.put(PARAM_COUNT, ToolSupport.param("integer", "Number of crystals to return (get), default 4"));
        properties.put(PARAM_FILENAME, ToolSupport.param("string",
                "Crystal to delete; only the latest is allowed (delete)"));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Rolling chain of compressed continuity crystals.")
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
            case OP_CRYSTALLIZE -> crystallize(parameters);
            case OP_LIST -> list();
            case OP_GET -> get(parameters);
            case OP_DELETE -> delete(parameters);
            default -> ToolResult.failure("Unknown operation: " + operation);
            };
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolSupport.failure("Crystals", operation, e));
        }
    }

    private ToolResult crystallize(Map<String, Object> params) {
        Crystal crystal = crystallizationService.crystallize(ToolSupport.string(params, PARAM_CONTENT));
        return ToolResult.success("Created " + crystal.getFilename() + " (~" + crystal.getTokenEstimate()
                + " tokens, through turn " + crystal.getThroughTurnId() + ")", crystal);
    }

    private ToolResult list() {
        CrystalListing listing = crystallizationService.listCrystals();
        if (listing.current().isEmpty() && listing.archived().isEmpty()) {
            return ToolResult.success("No crystals found. Create the first with crystallize.");
        }
        StringBuilder sb = new StringBuilder("Current (").append(listing.current().size()).append("):\n");
        for (Crystal crystal : listing.current()) {
            sb.append("- ").append(crystal.getFilename()).append(": ").append(crystal.preview(PREVIEW_CHARS))
                    .append('\n');
        }
        sb.append("Archived (").append(listing.archived().size()).append(")");
        return ToolResult.success(sb.toString(), listing);
    }

    private ToolResult get(Map<String, Object> params) {
        List<Crystal> crystals = crystallizationService.getCrystals(ToolSupport.integer(params, PARAM_COUNT, 4));
        if (crystals.isEmpty()) {
            return ToolResult.success("No crystals found.");
        }
        StringBuilder sb = new StringBuilder();
        for (Crystal crystal : crystals) {
            sb.append("=== ").append(crystal.getFilename()).append(" ===\n").append(crystal.getContent())
                    .append("\n\n");
        }
        return ToolResult.success(sb.toString().trim(), Map.of("crystals", crystals));
    }

    private ToolResult delete(Map<String, Object> params) {
        Crystal deleted = crystallizationService.deleteLatest(ToolSupport.string(params, PARAM_FILENAME));
        return ToolResult.success("Deleted " + deleted.getFilename() + "; archived crystals were not restored",
                Map.of(PARAM_FILENAME, deleted.getFilename()));
    }
}
