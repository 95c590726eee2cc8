package me.golemcore.memory.domain.service.recall;

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

import me.golemcore.memory.domain.component.RecallLayerComponent;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.RecallResult;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.domain.service.TurnStoreService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw turns: text search for queries, the unsummarized tail at startup.
 */
@Component
@RequiredArgsConstructor
public class RawTurnRecallLayer implements RecallLayerComponent {

    private final TurnStoreService turnStore;
    private final MemoryProperties properties;

    @Override
    public RecallLayer layer() {
        return RecallLayer.RAW_TURNS;
    }

    @Override
    public List<RecallResult> search(String query, int limit) {
        return turnStore.search(query, limit).stream()
                .map(match -> toResult(match.turn(), match.score(), Integer.MAX_VALUE))
                .toList();
    }

    @Override
    public List<RecallResult> startup() {
        int maxChars = properties.getRecall().getMaxTurnChars();
        return turnStore.unsummarized(properties.getRecall().getMaxStartupTurns()).stream()
                .map(turn -> toResult(turn, 1.0, maxChars))
                .toList();
    }

    @Override
    public ComponentHealth health() {
        return turnStore.health();
    }

    private RecallResult toResult(Turn turn, double score, int maxChars) {
        String content = turn.getContent();
        if (content.length() > maxChars) {
            content = content.substring(0, maxChars) + "...";
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("turn_id", turn.getId());
        metadata.put("channel", turn.getChannel());
        metadata.put("author", turn.getAuthor());
        return RecallResult.builder()
                .layer(RecallLayer.RAW_TURNS)
                .source(turn.getChannel() + "#" + turn.getId())
                .content(turn.getAuthor() + ": " + content)
                .score(score)
                .timestamp(turn.getCreatedAt())
                .metadata(metadata)
                .build();
    }
}
