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
import me.golemcore.memory.domain.model.Anchor;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.RecallResult;
import me.golemcore.memory.domain.service.AnchorService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class AnchorRecallLayer implements RecallLayerComponent {

    private final AnchorService anchorService;
    private final MemoryProperties properties;

    @Override
    public RecallLayer layer() {
        return RecallLayer.ANCHORS;
    }

    @Override
    public List<RecallResult> search(String query, int limit) {
        return anchorService.search(query, limit);
    }

    @Override
    public List<RecallResult> startup() {
        return anchorService.newest(properties.getRecall().getStartupAnchors()).stream()
                .map(this::toResult)
                .toList();
    }

    @Override
    public boolean isDegraded() {
        return anchorService.isIndexDegraded();
    }

    @Override
    public ComponentHealth health() {
        return anchorService.health();
    }

    private RecallResult toResult(Anchor anchor) {
        return RecallResult.builder()
                .layer(RecallLayer.ANCHORS)
                .source(anchor.getFilename())
                .content(anchor.getContent())
                .score(1.0)
                .timestamp(anchor.getCreatedAt())
                .build();
    }
}
