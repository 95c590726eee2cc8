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
import me.golemcore.memory.domain.model.Summary;
import me.golemcore.memory.domain.service.SummarizerService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SummaryRecallLayer implements RecallLayerComponent {

    private final SummarizerService summarizer;
    private final MemoryProperties properties;

    @Override
    public RecallLayer layer() {
        return RecallLayer.SUMMARIES;
    }

    @Override
    public List<RecallResult> search(String query, int limit) {
        return summarizer.search(query, limit).stream()
                .map(hit -> toResult(hit.summary(), hit.relevance(), Integer.MAX_VALUE))
                .toList();
    }

    /**
     * Most recent summaries, oldest first, truncated.
     */
    @Override
    public List<RecallResult> startup() {
        List<Summary> recent = new ArrayList<>(summarizer.recent(properties.getRecall().getStartupSummaries()));
        Collections.reverse(recent);
        int maxChars = properties.getRecall().getMaxSummaryChars();
        return recent.stream().map(s -> toResult(s, 1.0, maxChars)).toList();
    }

    @Override
    public ComponentHealth health() {
        return summarizer.health();
    }

    private RecallResult toResult(Summary summary, double score, int maxChars) {
        String text = summary.getText();
        if (text.length() > maxChars) {
            text = text.substring(0, maxChars) + "...";
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("start_turn_id", summary.getStartTurnId());
        metadata.put("end_turn_id", summary.getEndTurnId());
        metadata.put("kind", summary.getKind() != null ? summary.getKind().label() : null);
        metadata.put("channels", summary.getChannels());
        return RecallResult.builder()
                .layer(RecallLayer.SUMMARIES)
                .source(summary.getId())
                .content(text)
                .score(score)
                .timestamp(summary.getTimeSpanEnd())
                .metadata(metadata)
                .build();
    }
}
