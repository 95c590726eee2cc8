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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which relationship names are valid between which entity type pairs.
 */
public final class EdgeTypes {

    private static final Map<String, List<String>> EDGE_TYPE_MAP = new LinkedHashMap<>();

    static {
        register(EntityType.PERSON, EntityType.PERSON, List.of(
                "Loves", "CaresFor", "Trusts", "Admires", "ProtectsInstinctively",
                "SpouseOf", "ParentOf", "SiblingOf", "CollaboratesWith"));
        register(EntityType.PERSON, EntityType.SYMBOL, List.of("Wears", "Receives", "Cherishes", "Creates"));
        register(EntityType.PERSON, EntityType.PLACE, List.of(
                "LivesIn", "EntersSpace", "IntimateIn", "BasksIn", "BuiltSpace"));
        register(EntityType.PERSON, EntityType.CONCEPT, List.of("Embodies", "BelievesIn", "Articulates", "Discovers"));
        register(EntityType.PERSON, EntityType.TECHNICAL_ARTIFACT, List.of(
                "WorksOn", "BuiltArchitectureFor", "Maintains", "Creates"));
        register(EntityType.SYMBOL, EntityType.CONCEPT, List.of("Symbolizes", "Represents"));
        register(EntityType.PLACE, EntityType.CONCEPT, List.of("Embodies", "Symbolizes"));
    }

    private EdgeTypes() {
    }

    private static void register(EntityType source, EntityType target, List<String> edges) {
        EDGE_TYPE_MAP.put(key(source, target), edges);
    }

    private static String key(EntityType source, EntityType target) {
        return source.getTypeName() + "->" + target.getTypeName();
    }

    /**
     * Relationship names allowed from {@code source} to {@code target}; empty when
     * the pair has no typed edges.
     */
    public static List<String> allowed(EntityType source, EntityType target) {
        if (source == null || target == null) {
            return List.of();
        }
        return EDGE_TYPE_MAP.getOrDefault(key(source, target), List.of());
    }

    public static boolean isAllowed(EntityType source, EntityType target, String predicate) {
        return allowed(source, target).stream().anyMatch(p -> p.equalsIgnoreCase(predicate));
    }

    public static Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(EDGE_TYPE_MAP);
    }
}
