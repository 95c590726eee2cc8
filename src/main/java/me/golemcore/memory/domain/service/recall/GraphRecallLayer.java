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
import me.golemcore.memory.domain.model.GraphFact;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.RecallResult;
import me.golemcore.memory.domain.service.GraphTextureService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Facts from the knowledge graph, scoped to the configured namespace.
 */
@Component
@RequiredArgsConstructor
public class GraphRecallLayer implements RecallLayerComponent {

    private final GraphTextureService textureService;

    @Override
    public RecallLayer layer() {
        return RecallLayer.GRAPH;
    }

    @Override
    public boolean isEnabled() {
        return textureService.isAvailable();
    }

    @Override
    public List<RecallResult> search(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return textureService.search(query, limit).stream()
                .map(this::toResult)
                .toList();
    }

    @Override
    public ComponentHealth health() {
        return textureService.health();
    }

    private RecallResult toResult(GraphFact fact) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("subject", fact.getSourceEntity());
        metadata.put("predicate", fact.getPredicate());
        metadata.put("object", fact.getTargetEntity());
        metadata.put("valid_at", fact.getValidAt());
        return RecallResult.builder()
                .layer(RecallLayer.GRAPH)
                .source(fact.getUuid())
                .content(fact.describe())
                .score(fact.getScore())
                .timestamp(fact.getValidAt())
                .metadata(metadata)
                .build();
    }
}
