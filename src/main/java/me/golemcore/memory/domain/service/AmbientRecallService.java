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
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.HealthStatus;
import me.golemcore.memory.domain.model.LayerManifest;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.RecallReport;
import me.golemcore.memory.domain.model.RecallResult;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;

/**
 * Single query surface over every recall layer.
 *
 * <p>
 * The context {@code "startup"} is a package, not a query: it loads the
 * newest crystals, anchors and summaries plus every unsummarized turn. Any
 * other context is searched in every layer in parallel; a layer that fails
 * or times out contributes nothing and is reported as degraded, the rest of
 * the answer is unaffected.
 */
@Service
@Slf4j
public class AmbientRecallService {

    public static final String STARTUP_CONTEXT = "startup";

    private static final DateTimeFormatter CLOCK_FORMAT = DateTimeFormatter
            .ofPattern("EEEE, MMMM d, yyyy 'at' h:mm a", Locale.ENGLISH);

    private final List<RecallLayerComponent> layers;
    private final TurnStoreService turnStore;
    private final MemoryProperties properties;
    private final Clock clock;
    private final ExecutorService executor = Executors.newFixedThreadPool(RecallLayer.values().length, r -> {
        Thread t = new Thread(r, "ambient-recall");
        t.setDaemon(true);
        return t;
    });

    public AmbientRecallService(List<RecallLayerComponent> layers, TurnStoreService turnStore,
            MemoryProperties properties, Clock clock) {
        this.layers = layers.stream().sorted(Comparator.comparing(RecallLayerComponent::layer)).toList();
        this.turnStore = turnStore;
        this.properties = properties;
        this.clock = clock;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public RecallReport recall(String context, int limitPerLayer) {
        String effectiveContext = context == null || context.isBlank() ? STARTUP_CONTEXT : context.strip();
        int limit = limitPerLayer > 0 ? limitPerLayer : properties.getRecall().getDefaultLimitPerLayer();

        long unsummarized = countOrMinusOne(turnStore::countUnsummarized, "unsummarized");
        long uningested = countOrMinusOne(turnStore::countUningested, "uningested");

        Map<RecallLayer, HealthStatus> status = new EnumMap<>(RecallLayer.class);
        List<RecallResult> results;
        if (STARTUP_CONTEXT.equalsIgnoreCase(effectiveContext)) {
            results = startupPackage(status);
        } else {
            results = searchAll(effectiveContext, limit, status);
        }

        RecallReport report = RecallReport.builder()
                .context(effectiveContext)
                .clockLine(clockLine())
                .memoryHealthLine(memoryHealthLine(unsummarized, uningested))
                .results(results)
                .manifest(manifest(results))
                .layerStatus(status)
                .unsummarizedCount(unsummarized)
                .uningestedCount(uningested)
                .build();
        report.setFormatted(format(report));
        log.debug("[Recall] context='{}' -> {} results", effectiveContext, results.size());
        return report;
    }

    // ===== Startup package =====

    private List<RecallResult> startupPackage(Map<RecallLayer, HealthStatus> status) {
        List<RecallResult> results = new ArrayList<>();
        for (RecallLayerComponent layer : layers) {
            if (layer.layer() == RecallLayer.GRAPH) {
                continue;
            }
            try {
                results.addAll(layer.startup());
                status.put(layer.layer(), HealthStatus.HEALTHY);
            } catch (SubstrateException e) {
                log.warn("[Recall] Startup load failed for {}: {}", layer.layer().getKey(), e.getMessage());
                status.put(layer.layer(), HealthStatus.DEGRADED);
            }
        }
        return results;
    }

    // ===== Query fan-out =====

    private List<RecallResult> searchAll(String query, int limit, Map<RecallLayer, HealthStatus> status) {
        Map<RecallLayerComponent, CompletableFuture<List<RecallResult>>> futures = new LinkedHashMap<>();
        for (RecallLayerComponent layer : layers) {
            if (!layer.isEnabled()) {
                status.put(layer.layer(), HealthStatus.DEGRADED);
                continue;
            }
            futures.put(layer, CompletableFuture.supplyAsync(() -> layer.search(query, limit), executor));
        }

        long timeoutMs = properties.getRecall().getLayerTimeoutMs();
        List<RecallResult> results = new ArrayList<>();
        for (Map.Entry<RecallLayerComponent, CompletableFuture<List<RecallResult>>> entry : futures.entrySet()) {
            RecallLayerComponent layer = entry.getKey();
            try {
                results.addAll(entry.getValue().get(timeoutMs, TimeUnit.MILLISECONDS));
                status.put(layer.layer(), layer.isDegraded() ? HealthStatus.DEGRADED : HealthStatus.HEALTHY);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                status.put(layer.layer(), HealthStatus.DEGRADED);
            } catch (ExecutionException e) {
                log.warn("[Recall] Layer {} failed: {}", layer.layer().getKey(),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                status.put(layer.layer(), HealthStatus.DEGRADED);
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                log.warn("[Recall] Layer {} timed out after {}ms", layer.layer().getKey(), timeoutMs);
                status.put(layer.layer(), HealthStatus.DEGRADED);
            }
        }
        results.sort(Comparator.comparingDouble(RecallResult::getScore).reversed());
        return results;
    }

    // ===== Formatting =====

    String clockLine() {
        LocalDateTime now = LocalDateTime.now(clock);
        return "**Clock**: " + CLOCK_FORMAT.format(now);
    }

    String memoryHealthLine(long unsummarized, long uningested) {
        MemoryProperties.SummariesProperties summaries = properties.getSummaries();
        StringBuilder sb = new StringBuilder("**Memory Health**: ");
        sb.append(unsummarized).append(" unsummarized messages");
        if (unsummarized > summaries.getHighBacklog()) {
            sb.append(" (HIGH - summarize soon)");
        } else if (unsummarized > summaries.getRecommendedBacklog()) {
            sb.append(" (summarization recommended)");
        } else if (unsummarized > summaries.getHealthyBacklog()) {
            sb.append(" (healthy, summarization available)");
        } else {
            sb.append(" (healthy)");
        }

        sb.append(" | ").append(uningested).append(" uningested to graph");
        if (uningested > properties.getIngestion().getHighBacklog()) {
            sb.append(" (HIGH - ingest soon)");
        } else if (uningested >= properties.getIngestion().getRecommendThreshold()) {
            sb.append(" (batch ingestion recommended)");
        } else {
            sb.append(" (healthy)");
        }
        return sb.toString();
    }

    private static Map<String, LayerManifest> manifest(List<RecallResult> results) {
        Map<String, LayerManifest> manifest = new LinkedHashMap<>();
        for (RecallLayer layer : RecallLayer.values()) {
            int chars = 0;
            int count = 0;
            for (RecallResult result : results) {
                if (result.getLayer() == layer) {
                    chars += result.getContent() != null ? result.getContent().length() : 0;
                    count++;
                }
            }
            manifest.put(layer.getKey(), new LayerManifest(chars, count));
        }
        return manifest;
    }

    private static String format(RecallReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(report.getClockLine()).append("\n\n");
        sb.append(report.getMemoryHealthLine()).append("\n\n");

        sb.append("=== AMBIENT RECALL MANIFEST ===\n");
        int total = 0;
        for (Map.Entry<String, LayerManifest> entry : report.getManifest().entrySet()) {
            LayerManifest m = entry.getValue();
            sb.append(entry.getKey()).append(": ").append(m.chars()).append(" chars (").append(m.count())
                    .append(" items)\n");
            total += m.chars();
        }
        sb.append("TOTAL: ").append(total).append(" chars\n");
        report.getLayerStatus().forEach((layer, status) -> {
            if (status != HealthStatus.HEALTHY) {
                sb.append("[").append(layer.getKey()).append(" ").append(status).append("]\n");
            }
        });
        sb.append('\n');

        if (report.getResults().isEmpty()) {
            sb.append("No memories surfaced.\n");
            return sb.toString();
        }
        for (RecallResult result : report.getResults()) {
            sb.append("---\n[").append(result.getLayer().getKey()).append("] ").append(result.getSource());
            sb.append(String.format(Locale.ROOT, " (%.2f)", result.getScore())).append('\n');
            sb.append(result.getContent()).append('\n');
        }
        return sb.toString();
    }

    private long countOrMinusOne(LongSupplier counter, String what) {
        try {
            return counter.getAsLong();
        } catch (SubstrateException e) {
            log.warn("[Recall] Could not count {} turns: {}", what, e.getMessage());
            return -1;
        }
    }
}
