package me.golemcore.memory.port.outbound;

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

import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodeRequest;
import me.golemcore.memory.domain.model.EpisodeResult;
import me.golemcore.memory.domain.model.GraphDeleteResult;
import me.golemcore.memory.domain.model.GraphFact;
import me.golemcore.memory.domain.model.Subgraph;
import me.golemcore.memory.domain.model.TripletRequest;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the knowledge-graph service. Every query is scoped to a namespace;
 * implementations filter on the server and never return facts from another
 * namespace or from none. Futures fail with
 * {@link me.golemcore.memory.domain.exception.StorageUnavailableException}
 * when the service cannot be reached.
 */
public interface GraphPort {

    /**
     * Submit free text for entity extraction.
     */
    CompletableFuture<EpisodeResult> addEpisode(EpisodeRequest request);

    /**
     * Assert a structured fact directly, bypassing extraction.
     */
    CompletableFuture<EpisodeResult> addTriplet(TripletRequest request);

    /**
     * Ranked fact search.
     */
    CompletableFuture<List<GraphFact>> search(String query, String namespace, int limit);

    /**
     * Facts around an entity.
     */
    CompletableFuture<Subgraph> explore(String entityName, int depth, String namespace);

    /**
     * Episodes created within {@code [since, until]}, oldest first.
     */
    CompletableFuture<List<Episode>> timeline(Instant since, Instant until, String namespace, int limit);

    /**
     * Delete a fact (edge) by uuid.
     */
    CompletableFuture<GraphDeleteResult> delete(String uuid);

    /**
     * Check that the service is reachable.
     */
    boolean isHealthy();

    /**
     * Whether the graph integration is enabled.
     */
    boolean isAvailable();
}
