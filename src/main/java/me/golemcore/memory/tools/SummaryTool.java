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
import me.golemcore.memory.domain.model.Summary;
import me.golemcore.memory.domain.model.SummaryKind;
import me.golemcore.memory.domain.model.SummarySearchHit;
import me.golemcore.memory.domain.model.SummaryStats;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.SummarizerService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Mid-tier summaries of turn ranges.
 */
@Component
@RequiredArgsConstructor
public class SummaryTool implements ToolComponent {

    public static final String TOOL_NAME = "summary";

    private static final String OP_SUMMARIZE = "summarize_messages";
    private static final String OP_STORE = "store_summary";
    private static final String OP_RECENT = "get_recent_summaries";
    private static final String OP_SEARCH = "search_summaries";
    private static final String OP_STATS = "summary_stats";

    private static final String PARAM_LIMIT = "limit";
    private static final String PARAM_KIND = "kind";
    private static final String PARAM_TEXT = "text";
    private static final String PARAM_START = "start_turn_id";
    private static final String PARAM_END = "end_turn_id";
    private static final String PARAM_CHANNELS = "channels";
    private static final String PARAM_QUERY = "query";

    private final SummarizerService summarizer;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(ToolSupport.PARAM_OPERATION, Map.of(
                "type", "string",
                "enum", List.of(OP_SUMMARIZE, OP_STORE, OP_RECENT, OP_SEARCH, OP_STATS),
                "description", "Summary operation to perform"));
        properties.put(PARAM_LIMIT, ToolSupport.param("integer",
                "Turns to summarize (summarize, default 50) or results to return (recent, search)"));
        properties.put(PARAM_KIND, Map.of("type", "string", "enum", List.of("work", "social", "technical"),
                "description", "Summary kind (summarize, store)"));
        properties.put(PARAM_TEXT, ToolSupport.param("string", "Summary text (store)"));
        properties.put(PARAM_START, ToolSupport.param("integer", "First covered turn id (store)"));
        properties.put(PARAM_END, ToolSupport.param("integer", "Last covered turn id (store)"));
        properties.put(PARAM_CHANNELS, Map.of("type", "array", "items", Map.of("type", "string"),
                "description", "Channels covered (store)"));
        properties.put(PARAM_QUERY, ToolSupport.param("string", "Search text (search)"));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Summarize unsummarized turns, store summaries, read and search them.")
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
            case OP_SUMMARIZE -> summarize(parameters);
            case OP_STORE -> store(parameters);
            case OP_RECENT -> recent(parameters);
            case OP_SEARCH -> search(parameters);
            case OP_STATS -> stats();
            default -> ToolResult.failure("Unknown operation: " + operation);
            };
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolSupport.failure("Summaries", operation, e));
        }
    }

    private ToolResult summarize(Map<String, Object> params) {
        Optional<Summary> draft = summarizer.summarize(ToolSupport.integer(params, PARAM_LIMIT, 0),
                SummaryKind.fromString(ToolSupport.string(params, PARAM_KIND)));
        if (draft.isEmpty()) {
            return ToolResult.success("Not enough unsummarized turns yet (" + summarizer.backlogCount()
                    + " pending).");
        }
        Summary summary = draft.get();
        return ToolResult.success("Summary of turns " + summary.getStartTurnId() + ".." + summary.getEndTurnId()
                + " (not stored yet, call store_summary):\n\n" + summary.getText(), summary);
    }

    private ToolResult store(Map<String, Object> params) {
        Summary summary = Summary.builder()
                .startTurnId(ToolSupport.requireLong(params, PARAM_START))
                .endTurnId(ToolSupport.requireLong(params, PARAM_END))
                .text(ToolSupport.requireString(params, PARAM_TEXT))
                .kind(SummaryKind.fromString(ToolSupport.string(params, PARAM_KIND)))
                .channels(new LinkedHashSet<>(ToolSupport.strings(params, PARAM_CHANNELS)))
                .build();
        Summary stored = summarizer.store(summary);
        boolean sameRange = stored.getStartTurnId() == summary.getStartTurnId()
                && stored.getEndTurnId() == summary.getEndTurnId();
        String output = sameRange
                ? "Stored " + stored.getId()
                : "Range overlaps " + stored.getId() + " (" + stored.getStartTurnId() + ".."
                        + stored.getEndTurnId() + "); nothing stored";
        return ToolResult.success(output, stored);
    }

    private ToolResult recent(Map<String, Object> params) {
        List<Summary> summaries = summarizer.recent(ToolSupport.integer(params, PARAM_LIMIT, 5));
        if (summaries.isEmpty()) {
            return ToolResult.success("No summaries yet.");
        }
        StringBuilder sb = new StringBuilder();
        for (Summary summary : summaries) {
            appendSummary(sb, summary, null);
        }
        return ToolResult.success(sb.toString().trim(), Map.of("summaries", summaries));
    }

    private ToolResult search(Map<String, Object> params) {
        List<SummarySearchHit> hits = summarizer.search(ToolSupport.requireString(params, PARAM_QUERY),
                ToolSupport.integer(params, PARAM_LIMIT, 10));
        if (hits.isEmpty()) {
            return ToolResult.success("No matching summaries.");
        }
        StringBuilder sb = new StringBuilder();
        for (SummarySearchHit hit : hits) {
            appendSummary(sb, hit.summary(), hit.relevance());
        }
        return ToolResult.success(sb.toString().trim(), Map.of("hits", hits));
    }

    private ToolResult stats() {
        SummaryStats stats = summarizer.stats();
        String output = stats.getUnsummarizedCount() + " unsummarized turns, " + stats.getTotalSummaries()
                + " summaries" + (stats.getLastSummaryAt() != null ? ", last at " + stats.getLastSummaryAt() : "")
                + (stats.isNeedsSummarization() ? " (summarization recommended)" : "");
        return ToolResult.success(output, stats);
    }

    private static void appendSummary(StringBuilder sb, Summary summary, Double relevance) {
        sb.append("[").append(summary.getId()).append(", ")
                .append(summary.getKind() != null ? summary.getKind().label() : "work").append(", turns ")
                .append(summary.getStartTurnId()).append("..").append(summary.getEndTurnId()).append(']');
        if (relevance != null) {
            sb.append(String.format(Locale.ROOT, " (%.2f)", relevance));
        }
        sb.append('\n').append(summary.getText()).append("\n\n");
    }
}
