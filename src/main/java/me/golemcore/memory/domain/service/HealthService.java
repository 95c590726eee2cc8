package me.golemcore.memory.domain.service;

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
import me.golemcore.memory.domain.model.HealthStatus;
import me.golemcore.memory.domain.model.SubstrateHealth;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Per-component health. Each component is checked on its own, so one failing
 * check shows up as that component being critical instead of failing the
 * whole report.
 */
@Service
@Slf4j
public class HealthService {

    private final List<RecallLayerComponent> layers;
    private final GraphIngestionService ingestionService;
    private final LlmPort llmPort;
    private final EmbeddingPort embeddingPort;
    private final Clock clock;

    public HealthService(List<RecallLayerComponent> layers, GraphIngestionService ingestionService,
            LlmPort llmPort, EmbeddingPort embeddingPort, Clock clock) {
        this.layers = layers.stream().sorted(Comparator.comparing(RecallLayerComponent::layer)).toList();
        this.ingestionService = ingestionService;
        this.llmPort = llmPort;
        this.embeddingPort = embeddingPort;
        this.clock = clock;
    }

    public SubstrateHealth check() {
        List<ComponentHealth> components = new ArrayList<>();
        for (RecallLayerComponent layer : layers) {
            components.add(safely(layer.layer().getKey(), layer::health));
        }
        components.add(safely("graph_ingestion", ingestionService::health));
        components.add(llmHealth());
        components.add(embeddingHealth());

        HealthStatus overall = HealthStatus.HEALTHY;
        for (ComponentHealth component : components) {
            overall = HealthStatus.worst(overall, component.getStatus());
        }
        if (overall != HealthStatus.HEALTHY) {
            log.info("[Health] Overall {}", overall);
        }
        return new SubstrateHealth(overall, components, clock.instant());
    }

    private ComponentHealth llmHealth() {
        if (!llmPort.isAvailable()) {
            return ComponentHealth.degraded("llm", "No chat model configured; summarization and crystallization"
                    + " need manual input");
        }
        return ComponentHealth.healthy("llm", "Model " + llmPort.getCurrentModel());
    }

    private ComponentHealth embeddingHealth() {
        if (!embeddingPort.isAvailable()) {
            return ComponentHealth.degraded("embedding", "No embedding model configured");
        }
        return ComponentHealth.healthy("embedding", "Model " + embeddingPort.getModel());
    }

    private static ComponentHealth safely(String component, Supplier<ComponentHealth> check) {
        try {
            return check.get();
        } catch (RuntimeException e) {
            log.warn("[Health] Check for {} failed: {}", component, e.getMessage());
            return ComponentHealth.critical(component, "Health check failed: " + e.getMessage());
        }
    }
}
