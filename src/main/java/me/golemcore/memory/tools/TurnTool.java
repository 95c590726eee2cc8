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
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.domain.model.TurnIntegrityReport;
import me.golemcore.memory.domain.model.TurnQuery;
import me.golemcore.memory.domain.service.TurnStoreService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Raw turn capture for front-ends, plus integrity and backup maintenance.
 */
@Component
@RequiredArgsConstructor
public class TurnTool implements ToolComponent {

    public static final String TOOL_NAME = "turns";

    private static final String OP_APPEND = "turn_append";
    private static final String OP_QUERY = "turn_query";
    private static final String OP_INTEGRITY = "turn_integrity_check";
    private static final String OP_BACKUP = "turn_backup";
    private static final String OP_LIST_BACKUPS = "turn_list_backups";
    private static final String OP_RESTORE = "turn_restore";

    private static final String PARAM_CHANNEL = "channel";
    private static final String PARAM_AUTHOR = "author";
    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_CREATED_AT = "created_at";
    private static final String PARAM_FROM = "from";
    private static final String PARAM_UNTIL = "until";
    private static final String PARAM_TEXT = "text";
    private static final String PARAM_LIMIT = "limit";
    private static final String PARAM_SNAPSHOT = "snapshot";

    private final TurnStoreService turnStore;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(ToolSupport.PARAM_OPERATION, Map.of(
                "type", "string",
                "enum", List.of(OP_APPEND, OP_QUERY, OP_INTEGRITY, OP_BACKUP, OP_LIST_BACKUPS, OP_RESTORE),
                "description", "Turn store operation to perform"));
        properties.put(PARAM_CHANNEL, ToolSupport.param("string", "Channel or session tag (append, query)"));
        properties.put(PARAM_AUTHOR, ToolSupport.param("string", "Speaker (append, query)"));
        properties.put(PARAM_CONTENT, ToolSupport.param("string", "Message text (append)"));
        properties.put(PARAM_CREATED_AT, ToolSupport.param("string", "ISO-8601 capture time, default now (append)"));
        properties.put(PARAM_FROM, ToolSupport.param("string", "ISO-8601 lower bound (query)"));
        properties.put(PARAM_UNTIL, ToolSupport.param("string", "ISO-8601 upper bound (query)"));
        properties.put(PARAM_TEXT, ToolSupport.param("string", "Substring filter (query)"));
        properties.put(PARAM_LIMIT, ToolSupport.param("integer", "Newest N matches (query), default 50"));
        properties.put(PARAM_SNAPSHOT, ToolSupport.param("string", "Backup snapshot name (restore)"));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Append-only conversation log: capture turns, query them, check and back up the log.")
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
            case OP_APPEND -> append(parameters);
            case OP_QUERY -> query(parameters);
            case OP_INTEGRITY -> integrity();
            case OP_BACKUP -> ToolResult.success("Backup created: " + turnStore.backup());
            case OP_LIST_BACKUPS -> listBackups();
            case OP_RESTORE -> restore(parameters);
            default -> ToolResult.failure("Unknown operation: " + operation);
            };
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolSupport.failure("TurnStore", operation, e));
        }
    }

    private ToolResult append(Map<String, Object> params) {
        Turn turn = turnStore.append(Turn.builder()
                .channel(ToolSupport.string(params, PARAM_CHANNEL))
                .author(ToolSupport.string(params, PARAM_AUTHOR))
                .content(ToolSupport.requireString(params, PARAM_CONTENT))
                .createdAt(ToolSupport.instant(params, PARAM_CREATED_AT))
                .build());
        return ToolResult.success("Stored turn " + turn.getId(), Map.of("id", turn.getId()));
    }

    private ToolResult query(Map<String, Object> params) {
        List<Turn> turns = turnStore.query(TurnQuery.builder()
                .channel(ToolSupport.string(params, PARAM_CHANNEL))
                .author(ToolSupport.string(params, PARAM_AUTHOR))
                .from(ToolSupport.instant(params, PARAM_FROM))
                .until(ToolSupport.instant(params, PARAM_UNTIL))
                .text(ToolSupport.string(params, PARAM_TEXT))
                .limit(ToolSupport.integer(params, PARAM_LIMIT, 50))
                .build());
        if (turns.isEmpty()) {
            return ToolResult.success("No turns match.");
        }
        StringBuilder sb = new StringBuilder();
        for (Turn turn : turns) {
            sb.append('#').append(turn.getId()).append(" [").append(turn.getChannel()).append("] ")
                    .append(turn.getAuthor()).append(": ").append(turn.getContent()).append('\n');
        }
        return ToolResult.success(sb.toString().trim(), Map.of("turns", turns));
    }

    private ToolResult integrity() {
        TurnIntegrityReport report = turnStore.integrityCheck();
        if (report.isHealthy()) {
            return ToolResult.success("Turn log intact: " + report.getValidTurns() + " turns, last id "
                    + report.getLastId(), report);
        }
        return ToolResult.success("Turn log has problems: malformed lines " + report.getMalformedLines()
                + ", duplicate ids " + report.getDuplicateIds() + ", out-of-order ids "
                + report.getNonMonotonicIds(), report);
    }

    private ToolResult listBackups() {
        List<String> backups = turnStore.listBackups();
        if (backups.isEmpty()) {
            return ToolResult.success("No backups.");
        }
        return ToolResult.success(String.join("\n", backups), Map.of("backups", backups));
    }

    private ToolResult restore(Map<String, Object> params) {
        String snapshot = ToolSupport.requireString(params, PARAM_SNAPSHOT);
        turnStore.restore(snapshot);
        return ToolResult.success("Restored " + snapshot + "; the previous state was backed up first");
    }
}
