package me.golemcore.memory.adapter.outbound.index;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.model.SemanticHit;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.SemanticIndexPort;
import me.golemcore.memory.port.outbound.StoragePort;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Vector index for anchors, persisted as one JSON document in the workspace.
 *
 * <p>
 * Each entry keeps the embedded text, its vector and string metadata. Search
 * embeds the query and ranks entries by cosine similarity. The index is a
 * projection of the anchor files and can always be rebuilt from them.
 *
 * <p>
 * Any embedding failure surfaces as {@link StorageUnavailableException}; the
 * persisted entries are left untouched in that case.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class LocalSemanticIndexAdapter implements SemanticIndexPort {

    private static final String INDEX_FILE = "index.json";
    private static final TypeReference<LinkedHashMap<String, IndexEntry>> INDEX_TYPE = new TypeReference<>() {
    };

    private final EmbeddingPort embeddingPort;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;

    private Map<String, IndexEntry> entries;
    private String loadedJson;

    public LocalSemanticIndexAdapter(EmbeddingPort embeddingPort, StoragePort storagePort,
            ObjectMapper objectMapper, MemoryProperties properties) {
        this.embeddingPort = embeddingPort;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getAnchors().getIndexDirectory();
    }

    @Override
    public synchronized void upsert(String id, String content, Map<String, String> metadata) {
        refresh();
        float[] vector = embed(content);
        entries.put(id, new IndexEntry(content, vector, new LinkedHashMap<>(metadata)));
        persist();
        log.debug("[Embedding] Indexed {}", id);
    }

    @Override
    public synchronized void upsertAll(Map<String, String> contentById,
            Map<String, Map<String, String>> metadataById) {
        if (contentById.isEmpty()) {
            return;
        }
        refresh();
        List<String> ids = new ArrayList<>(contentById.keySet());
        List<String> texts = ids.stream().map(contentById::get).toList();
        List<float[]> vectors = embedBatch(texts);
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            Map<String, String> metadata = metadataById.getOrDefault(id, Map.of());
            entries.put(id, new IndexEntry(texts.get(i), vectors.get(i), new LinkedHashMap<>(metadata)));
        }
        persist();
        log.info("[Embedding] Indexed {} entries", ids.size());
    }

    @Override
    public synchronized boolean remove(String id) {
        refresh();
        boolean removed = entries.remove(id) != null;
        if (removed) {
            persist();
        }
        return removed;
    }

    @Override
    public synchronized List<SemanticHit> search(String query, int limit) {
        refresh();
        if (entries.isEmpty() || limit <= 0) {
            return List.of();
        }
        float[] queryVector = embed(query);

        List<SemanticHit> hits = new ArrayList<>();
        for (Map.Entry<String, IndexEntry> entry : entries.entrySet()) {
            IndexEntry value = entry.getValue();
            if (value.getEmbedding() == null || value.getEmbedding().length != queryVector.length) {
                continue;
            }
            double similarity = cosine(queryVector, value.getEmbedding());
            hits.add(new SemanticHit(entry.getKey(), value.getContent(), similarity, value.getMetadata()));
        }

        return hits.stream()
                .sorted((a, b) -> Double.compare(b.score(), a.score()))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized Set<String> ids() {
        refresh();
        return new LinkedHashSet<>(entries.keySet());
    }

    @Override
    public synchronized int count() {
        refresh();
        return entries.size();
    }

    @Override
    public synchronized void clear() {
        entries = new LinkedHashMap<>();
        persist();
        log.info("[Embedding] Index cleared");
    }

    @Override
    public boolean isAvailable() {
        return embeddingPort.isAvailable();
    }

    private float[] embed(String text) {
        if (!embeddingPort.isAvailable()) {
            throw new StorageUnavailableException("Embedding backend not available");
        }
        try {
            return embeddingPort.embed(text).join();
        } catch (CompletionException | IllegalStateException e) {
            throw new StorageUnavailableException("Embedding failed: " + rootMessage(e), e);
        }
    }

    private List<float[]> embedBatch(List<String> texts) {
        if (!embeddingPort.isAvailable()) {
            throw new StorageUnavailableException("Embedding backend not available");
        }
        try {
            List<float[]> vectors = embeddingPort.embedBatch(texts).join();
            if (vectors.size() != texts.size()) {
                throw new StorageUnavailableException(
                        "Embedding backend returned " + vectors.size() + " vectors for " + texts.size() + " texts");
            }
            return vectors;
        } catch (CompletionException | IllegalStateException e) {
            throw new StorageUnavailableException("Batch embedding failed: " + rootMessage(e), e);
        }
    }

    /**
     * Re-read the index file and reparse it when its content differs from what
     * this instance last loaded or wrote, so writes from another process are
     * picked up instead of overwritten.
     */
    private void refresh() {
        String json = storagePort.getText(directory, INDEX_FILE).join();
        if (entries != null && Objects.equals(json, loadedJson)) {
            return;
        }
        loadedJson = json;
        if (json == null || json.isBlank()) {
            entries = new LinkedHashMap<>();
            return;
        }
        try {
            entries = objectMapper.readValue(json, INDEX_TYPE);
            log.info("[Embedding] Loaded {} index entries", entries.size());
        } catch (JsonProcessingException e) {
            log.warn("[Embedding] Index file unreadable, starting empty (resync to rebuild): {}", e.getMessage());
            entries = new LinkedHashMap<>();
        }
    }

    private void persist() {
        String json;
        try {
            json = objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize semantic index", e);
        }
        storagePort.putTextAtomic(directory, INDEX_FILE, json, false).join();
        loadedJson = json;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class IndexEntry {
        private String content;
        private float[] embedding;
        private Map<String, String> metadata;
    }
}
