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

import me.golemcore.memory.domain.model.SemanticHit;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derived, rebuildable semantic index over anchor content. Operations that
 * need the embedding backend throw
 * {@link me.golemcore.memory.domain.exception.StorageUnavailableException}
 * when it cannot be reached.
 */
public interface SemanticIndexPort {

    /**
     * Insert or replace an entry.
     */
    void upsert(String id, String content, Map<String, String> metadata);

    /**
     * Insert or replace several entries with one embedding call.
     */
    void upsertAll(Map<String, String> contentById, Map<String, Map<String, String>> metadataById);

    /**
     * Remove an entry.
     *
     * @return true if the entry existed
     */
    boolean remove(String id);

    /**
     * Rank entries by cosine similarity to the query.
     */
    List<SemanticHit> search(String query, int limit);

    Set<String> ids();

    int count();

    /**
     * Drop every entry.
     */
    void clear();

    /**
     * Whether the embedding backend is configured.
     */
    boolean isAvailable();
}
