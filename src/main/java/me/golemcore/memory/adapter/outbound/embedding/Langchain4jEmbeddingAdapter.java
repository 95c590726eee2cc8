package me.golemcore.memory.adapter.outbound.embedding;

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

import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and an OpenAI-compatible endpoint.
 *
 * <p>
 * The model is built lazily on first use. Batch requests are split into
 * chunks of {@code memory.embedding.batch-size} texts, so an anchor resync
 * over many files never exceeds the provider's per-request input limit.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code memory.embedding.api-key} - API key
 * <li>{@code memory.embedding.base-url} - optional OpenAI-compatible base URL
 * <li>{@code memory.embedding.model} - model name, default
 * text-embedding-3-small
 * <li>{@code memory.embedding.timeout-ms} - request timeout
 * </ul>
 *
 * @see me.golemcore.memory.adapter.outbound.index.LocalSemanticIndexAdapter
 */
@Component
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final MemoryProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized;

    public Langchain4jEmbeddingAdapter(MemoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> requireModel().embed(text).content().vector());
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = requireModel();
            int chunkSize = Math.max(1, properties.getEmbedding().getBatchSize());
            List<float[]> vectors = new ArrayList<>(texts.size());
            for (int from = 0; from < texts.size(); from += chunkSize) {
                List<TextSegment> segments = texts.subList(from, Math.min(texts.size(), from + chunkSize))
                        .stream()
                        .map(TextSegment::from)
                        .toList();
                for (Embedding embedding : model.embedAll(segments).content()) {
                    vectors.add(embedding.vector());
                }
            }
            log.debug("[Embedding] Embedded {} texts", vectors.size());
            return vectors;
        });
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    protected EmbeddingModel createModel(MemoryProperties.EmbeddingProperties config) {
        OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
                .apiKey(config.getApiKey())
                .modelName(getModel())
                .maxRetries(0)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        EmbeddingModel model = embeddingModel;
        if (model == null) {
            throw new IllegalStateException("Embedding model not available");
        }
        return model;
    }

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        initialized = true;

        MemoryProperties.EmbeddingProperties config = properties.getEmbedding();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[Embedding] API key not configured, anchor index unavailable");
            return;
        }
        try {
            embeddingModel = createModel(config);
            log.info("[Embedding] Model initialized: {}", getModel());
        } catch (RuntimeException e) {
            log.error("[Embedding] Failed to initialize embedding model", e);
        }
    }
}
