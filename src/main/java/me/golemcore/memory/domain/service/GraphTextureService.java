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

import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.EdgeTypes;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodeRequest;
import me.golemcore.memory.domain.model.EpisodeResult;
import me.golemcore.memory.domain.model.GraphDeleteResult;
import me.golemcore.memory.domain.model.GraphFact;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.Subgraph;
import me.golemcore.memory.domain.model.TripletRequest;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.GraphPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Graph ("rich texture") operations scoped to the configured namespace.
 *
 * <p>
 * Write paths attach extraction guidance from
 * {@link ExtractionContextService} and fail loudly. Read paths used by recall
 * degrade to empty results and record the failure for health reporting.
 */
@Service
@Slf4j
public class GraphTextureService {

    private final GraphPort graphPort;
    private final ExtractionContextService extractionContextService;
    private final MemoryProperties properties;
    private final AtomicReference<String> lastError = new AtomicReference<>();

    public GraphTextureService(GraphPort graphPort, ExtractionContextService extractionContextService,
            MemoryProperties properties) {
        this.graphPort = graphPort;
        this.extractionContextService = extractionContextService;
        this.properties = properties;
    }

    public String namespace() {
        return properties.getGraph().getNamespace();
    }

    /**
     * Submit free text for extraction, with guidance composed for its channel.
     */
    public EpisodeResult addEpisode(String content, String channel, String roleType, Instant referenceTime,
            String hints) {
        EpisodeRequest request = EpisodeRequest.builder()
                .content(content)
                .channel(channel)
                .speaker(extractionContextService.speakerOf(content, channel))
                .roleType(roleType != null ? roleType : "user")
                .referenceTime(referenceTime)
                .namespace(namespace())
                .extractionInstructions(extractionContextService.forChannel(channel, hints))
                .build();
        return call(() -> graphPort.addEpisode(request), episodeTimeoutMs(), "Add episode");
    }

    public EpisodeResult addTriplet(TripletRequest request) {
        if (request.getNamespace() == null) {
            request.setNamespace(namespace());
        }
        if (request.getSourceType() != null && request.getTargetType() != null
                && !EdgeTypes.allowed(request.getSourceType(), request.getTargetType()).isEmpty()
                && !EdgeTypes.isAllowed(request.getSourceType(), request.getTargetType(), request.getPredicate())) {
            log.info("[Graph] Predicate {} is not a typed edge for {} -> {}; storing as custom relation",
                    request.getPredicate(), request.getSourceType().getTypeName(),
                    request.getTargetType().getTypeName());
        }
        return call(() -> graphPort.addTriplet(request), timeoutMs(), "Add triplet");
    }

    public List<GraphFact> search(String query, int limit) {
        return call(() -> graphPort.search(query, namespace(), limit), timeoutMs(), "Graph search");
    }

    /**
     * Search for recall: never throws, empty on failure.
     */
    public List<GraphFact> searchOrEmpty(String query, int limit) {
        if (!graphPort.isAvailable()) {
            return List.of();
        }
        try {
            return search(query, limit);
        } catch (StorageUnavailableException e) {
            log.warn("[Graph] Search degraded: {}", e.getMessage());
            return List.of();
        }
    }

    public Subgraph explore(String entityName, int depth) {
        return call(() -> graphPort.explore(entityName, depth, namespace()), timeoutMs(), "Graph explore");
    }

    public List<Episode> timeline(Instant since, Instant until, int limit) {
        return call(() -> graphPort.timeline(since, until, namespace(), limit), timeoutMs(), "Graph timeline");
    }

    public GraphDeleteResult delete(String uuid) {
        return call(() -> graphPort.delete(uuid), timeoutMs(), "Graph delete");
    }

    public boolean isAvailable() {
        return graphPort.isAvailable();
    }

    public ComponentHealth health() {
        String key = RecallLayer.GRAPH.getKey();
        if (!graphPort.isAvailable()) {
            return ComponentHealth.degraded(key, "Graph layer disabled").withCount("namespace", namespace());
        }
        if (!graphPort.isHealthy()) {
            return ComponentHealth.degraded(key, "Graph service unreachable at " + properties.getGraph().getUrl())
                    .withCount("namespace", namespace());
        }
        String error = lastError.get();
        if (error != null) {
            return ComponentHealth.degraded(key, "Reachable, last call failed: " + error)
                    .withCount("namespace", namespace());
        }
        return ComponentHealth.healthy(key, "Graph service reachable").withCount("namespace", namespace());
    }

    private <T> T call(Supplier<CompletableFuture<T>> operation,
            long timeoutMs, String name) {
        try {
            T result = AsyncResults.await(operation.get(), timeoutMs, name);
            lastError.set(null);
            return result;
        } catch (StorageUnavailableException e) {
            lastError.set(e.getMessage());
            throw e;
        }
    }

    private long timeoutMs() {
        return properties.getGraph().getTimeoutSeconds() * 1000L;
    }

    private long episodeTimeoutMs() {
        return properties.getGraph().getEpisodeTimeoutSeconds() * 1000L;
    }
}
