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
import me.golemcore.memory.domain.model.Crystal;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.RecallResult;
import me.golemcore.memory.domain.service.CrystallizationService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Crystals are recalled by recency, not by query: the newest ones always
 * carry the most relevant continuity.
 */
@Component
@RequiredArgsConstructor
public class CrystalRecallLayer implements RecallLayerComponent {

    private final CrystallizationService crystallizationService;
    private final MemoryProperties properties;

    @Override
    public RecallLayer layer() {
        return RecallLayer.CRYSTALS;
    }

    @Override
    public List<RecallResult> search(String query, int limit) {
        return toResults(crystallizationService.getCrystals(limit));
    }

    @Override
    public List<RecallResult> startup() {
        return toResults(crystallizationService.getCrystals(properties.getRecall().getStartupCrystals()));
    }

    @Override
    public ComponentHealth health() {
        return crystallizationService.health();
    }

    private List<RecallResult> toResults(List<Crystal> crystals) {
        List<RecallResult> results = new ArrayList<>();
        int n = crystals.size();
        for (int i = 0; i < n; i++) {
            Crystal crystal = crystals.get(i);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("sequence", crystal.getSequence());
            metadata.put("through_turn_id", crystal.getThroughTurnId());
            results.add(RecallResult.builder()
                    .layer(RecallLayer.CRYSTALS)
                    .source(crystal.getFilename())
                    .content(crystal.getContent())
                    .score(0.5 + 0.4 * (i + 1) / n)
                    .timestamp(crystal.getCreatedAt())
                    .metadata(metadata)
                    .build());
        }
        return results;
    }
}
