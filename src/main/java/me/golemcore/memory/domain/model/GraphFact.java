package me.golemcore.memory.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Edge of the knowledge graph as returned by a search.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class GraphFact {

    private String uuid;
    private String sourceEntity;
    private String predicate;
    private String targetEntity;
    private String fact;
    private String namespace;
    private Instant validAt;
    private Instant invalidAt;
    private double score;

    /**
     * Source or target was guessed from the fact text rather than reported
     * by the graph service.
     */
    private boolean endpointsInferred;

    public String describe() {
        String base = orUnresolved(sourceEntity) + " → " + predicate + " → " + orUnresolved(targetEntity);
        return fact == null || fact.isBlank() ? base : base + ": " + fact;
    }

    private static String orUnresolved(String entity) {
        return entity != null ? entity : "?";
    }
}
