package me.golemcore.memory.adapter.outbound.llm;

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

import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LlmPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Chat model adapter using langchain4j and an OpenAI-compatible endpoint.
 *
 * <p>
 * The chat model is held as an immutable {@link ModelHandle}. Each call reads
 * the handle once and uses it for its whole duration; {@link #reconnect()}
 * builds a new handle and swaps it in, so in-flight calls finish on the old one
 * and are never affected by the restart.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code memory.llm.api-key} - API key
 * <li>{@code memory.llm.base-url} - optional OpenAI-compatible base URL
 * <li>{@code memory.llm.model} - model name
 * <li>{@code memory.llm.timeout-ms} - request timeout
 * </ul>
 */
@Component
@Slf4j
public class Langchain4jLlmAdapter implements LlmPort {

    private final MemoryProperties properties;
    private final AtomicReference<ModelHandle> handle = new AtomicReference<>();

    public Langchain4jLlmAdapter(MemoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ModelHandle current = currentHandle();
            if (current == null) {
                throw new IllegalStateException("LLM not configured");
            }

            List<ChatMessage> messages = new ArrayList<>();
            if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
                messages.add(SystemMessage.from(request.getSystemPrompt()));
            }
            messages.add(UserMessage.from(request.getUserMessage()));

            ChatRequest.Builder builder = ChatRequest.builder()
                    .messages(messages)
                    .temperature(request.getTemperature());
            if (request.getMaxTokens() != null) {
                builder.maxOutputTokens(request.getMaxTokens());
            }

            try {
                ChatResponse response = current.model().chat(builder.build());
                AiMessage aiMessage = response.aiMessage();
                return LlmResponse.builder()
                        .content(aiMessage.text())
                        .model(current.modelName())
                        .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                        .build();
            } catch (RuntimeException e) {
                log.error("[LLM] Chat failed on handle #{}: {}", current.generation(), e.getMessage());
                throw e;
            }
        });
    }

    @Override
    public void reconnect() {
        ModelHandle fresh = buildHandle(nextGeneration());
        ModelHandle previous = handle.getAndSet(fresh);
        log.info("[LLM] Reconnected: handle #{} replaced #{}",
                fresh != null ? fresh.generation() : -1,
                previous != null ? previous.generation() : -1);
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        return currentHandle() != null;
    }

    private ModelHandle currentHandle() {
        ModelHandle current = handle.get();
        if (current != null) {
            return current;
        }
        ModelHandle created = buildHandle(1);
        if (created == null) {
            return null;
        }
        return handle.compareAndSet(null, created) ? created : handle.get();
    }

    private long nextGeneration() {
        ModelHandle current = handle.get();
        return current != null ? current.generation() + 1 : 1;
    }

    private ModelHandle buildHandle(long generation) {
        MemoryProperties.LlmProperties config = properties.getLlm();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[LLM] API key not configured, summarization and crystallization unavailable");
            return null;
        }
        return new ModelHandle(createModel(config), config.getModel(), generation);
    }

    protected ChatModel createModel(MemoryProperties.LlmProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Callers decide whether to retry
                .temperature(config.getTemperature())
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }

        return builder.build();
    }

    /**
     * Owned chat model instance. Never mutated; replaced as a whole.
     */
    record ModelHandle(ChatModel model, String modelName, long generation) {
    }
}
