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
import me.golemcore.memory.domain.model.AnchorDeleteResult;
import me.golemcore.memory.domain.model.AnchorListing;
import me.golemcore.memory.domain.model.AnchorSaveResult;
import me.golemcore.memory.domain.model.AnchorStatus;
import me.golemcore.memory.domain.model.RecallResult;
import me.golemcore.memory.domain.model.ResyncResult;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.AnchorService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Curated anchors ("word-photos"): save, search, delete, list, resync.
 */
@Component
@RequiredArgsConstructor
public class AnchorTool implements ToolComponent {

    public static final String TOOL_NAME = "anchor";

    private static final String OP_SAVE = "anchor_save";
    private static final String OP_SEARCH = "anchor_search";
    private static final String OP_DELETE = "anchor_delete";
    private static final String OP_LIST = "anchor_list";
    private static final String OP_RESYNC = "anchor_resync";

    private static final String PARAM_TITLE = "title";
    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_LOCATION = "location";
    private static final String PARAM_QUERY = "query";
    private static final String PARAM_LIMIT = "limit";
    private static final String PARAM_FILENAME = "filename";

    private final AnchorService anchorService;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(ToolSupport.PARAM_OPERATION, Map.of(
                "type", "string",
                "enum", List.of(OP_SAVE, OP_SEARCH, OP_DELETE, OP_LIST, OP_RESYNC),
                "description", "Anchor operation to perform"));
        properties.put(PARAM_TITLE, ToolSupport.param("string", "Anchor title (save)"));
        properties.put(PARAM_CONTENT, ToolSupport.param("string", "Markdown body (save)"));
        properties.put(PARAM_LOCATION, ToolSupport.param("string", "Optional location tag (save)"));
        properties.put(PARAM_QUERY, ToolSupport.param("string", "Search text (search)"));
        properties.put(PARAM_LIMIT, ToolSupport.param("integer", "Result limit (search), default 5"));
        properties.put(PARAM_FILENAME, ToolSupport.param("string", "Anchor file name (delete)"));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Curated memory anchors stored as markdown files and mirrored in a semantic index.")
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
            case OP_SAVE -> save(parameters);
            case OP_SEARCH -> search(parameters);
            case OP_DELETE -> delete(parameters);
            case OP_LIST -> list();
            case OP_RESYNC -> resync();
            default -> ToolResult.failure("Unknown operation: " + operation);
            };
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolSupport.failure("Anchors", operation, e));
        }
    }

    private ToolResult save(Map<String, Object> params) {
        AnchorSaveResult result = anchorService.save(
                ToolSupport.requireString(params, PARAM_TITLE),
                ToolSupport.requireString(params, PARAM_CONTENT),
                ToolSupport.string(params, PARAM_LOCATION));
        String filename = result.anchor().getFilename();
        String output = result.indexed()
                ? "Saved anchor " + filename
                : "Saved anchor " + filename + " to disk; index unavailable, run anchor_resync later";
        return ToolResult.success(output, Map.of(PARAM_FILENAME, filename, "indexed", result.indexed()));
    }

    private ToolResult search(Map<String, Object> params) {
        List<RecallResult> results = anchorService.search(ToolSupport.requireString(params, PARAM_QUERY),
                ToolSupport.integer(params, PARAM_LIMIT, 5));
        if (results.isEmpty()) {
            String note = anchorService.isIndexDegraded() ? " (index unavailable)" : "";
            return ToolResult.success("No anchors found" + note + ".");
        }
        StringBuilder sb = new StringBuilder("Found ").append(results.size()).append(" anchor(s):\n");
        for (RecallResult result : results) {
            sb.append("- ").append(result.getSource())
                    .append(String.format(Locale.ROOT, " (%.2f)", result.getScore())).append('\n');
        }
        return ToolResult.success(sb.toString().trim(), Map.of("results", results));
    }

    private ToolResult delete(Map<String, Object> params) {
        AnchorDeleteResult result = anchorService.delete(ToolSupport.requireString(params, PARAM_FILENAME));
        if (!result.isDeleted()) {
            return ToolResult.failure("Anchor not found: " + result.filename());
        }
        return ToolResult.success("Deleted " + result.filename() + " (disk: " + result.deletedFromDisk()
                + ", index: " + result.deletedFromIndex() + ")", result);
    }

    private ToolResult list() {
        AnchorListing listing = anchorService.list();
        StringBuilder sb = new StringBuilder();
        sb.append(listing.getDiskCount()).append(" on disk, ").append(listing.getIndexCount()).append(" indexed, ")
                .append(listing.isSynced() ? "in sync" : "OUT OF SYNC (run anchor_resync)").append('\n');
        for (AnchorStatus status : listing.getEntries()) {
            sb.append("- ").append(status.filename());
            if (!status.isSynced()) {
                sb.append(status.onDisk() ? " [not indexed]" : " [orphaned index entry]");
            }
            sb.append('\n');
        }
        return ToolResult.success(sb.toString().trim(), listing);
    }

    private ToolResult resync() {
        ResyncResult result = anchorService.resync();
        return ToolResult.success("Resynced: " + result.indexed() + " of " + result.filesOnDisk()
                + " files indexed (index previously had " + result.previousIndexCount() + ")", result);
    }
}
