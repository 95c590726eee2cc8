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

/**
 * Entity ontology used to guide graph extraction.
 */
public enum EntityType {

    PERSON("Person", "Human or AI entity with identity and relationships"),
    SYMBOL("Symbol", "Object with emotional or relational significance that recurs in conversations"),
    PLACE("Place", "Physical or virtual space where conversations and experiences occur"),
    CONCEPT("Concept", "Idea, framework, philosophical principle or technical pattern"),
    TECHNICAL_ARTIFACT("TechnicalArtifact", "Code file, infrastructure component or memory artifact");

    private final String typeName;
    private final String description;

    EntityType(String typeName, String description) {
        this.typeName = typeName;
        this.description = description;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolves a type by its graph label, case-insensitively.
     *
     * @return the matching type or {@code null}
     */
    public static EntityType fromTypeName(String name) {
        if (name == null) {
            return null;
        }
        for (EntityType type : values()) {
            if (type.typeName.equalsIgnoreCase(name.trim()) || type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        return null;
    }
}
