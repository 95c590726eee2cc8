package me.golemcore.memory.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the memory substrate, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code memory.*} prefix, with one
 * nested property class per subsystem:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link CrystallizationProperties} - crystal window and triggers</li>
 * <li>{@link SummariesProperties} - summarization and backlog thresholds</li>
 * <li>{@link IngestionProperties} - graph batch ingestion</li>
 * <li>{@link GraphProperties} - graph service connection and namespace</li>
 * <li>{@link CuratorProperties} - graph curation sampling and policy</li>
 * <li>And the remaining subsystems...</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    /**
     * Logical owner of this substrate (the agent entity). Used for lock names and
     * the primary entity in extraction guidance.
     */
    private String owner = "entity";

    private StorageProperties storage = new StorageProperties();
    private TurnsProperties turns = new TurnsProperties();
    private AnchorsProperties anchors = new AnchorsProperties();
    private CrystallizationProperties crystallization = new CrystallizationProperties();
    private SummariesProperties summaries = new SummariesProperties();
    private IngestionProperties ingestion = new IngestionProperties();
    private GraphProperties graph = new GraphProperties();
    private CuratorProperties curator = new CuratorProperties();
    private RecallProperties recall = new RecallProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private LockProperties lock = new LockProperties();
    private LlmProperties llm = new LlmProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/memory";
    }

    @Data
    public static class TurnsProperties {
        private String directory = "turns";
        private int maxBackups = 10;
    }

    @Data
    public static class AnchorsProperties {
        private String directory = "anchors";
        private String indexDirectory = "anchor-index";
    }

    @Data
    public static class CrystallizationProperties {
        private String directory = "crystals";
        private int windowSize = 4;
        private int turnThreshold = 50;
        private int hoursThreshold = 24;
        private int compressionRatio = 6;
        private int maxSourceTurns = 400;
        private int maxTokens = 1500;
        private long timeoutMs = 120_000;
    }

    @Data
    public static class SummariesProperties {
        private String directory = "summaries";
        private int minTurns = 10;
        private int defaultLimit = 50;
        private int healthyBacklog = 50;
        private int recommendedBacklog = 100;
        private int highBacklog = 200;
        private int maxTokens = 800;
        private long timeoutMs = 60_000;
    }

    @Data
    public static class IngestionProperties {
        private String directory = "graph";
        private int batchSize = 20;
        private int recommendThreshold = 20;
        private int highBacklog = 100;
    }

    @Data
    public static class GraphProperties {
        private boolean enabled = true;
        private String url = "http://localhost:8203";
        private String apiKey;
        private String namespace = "default";
        private int timeoutSeconds = 30;
        private String sceneDirectory = "scene";
        private int crystalContextChars = 2000;
        private String terminalSpeaker = "user";
        private int episodeTimeoutSeconds = 120;
    }

    @Data
    public static class CuratorProperties {
        private boolean enabled = false;
        private boolean autoDelete = false;
        private boolean deep = false;
        private long intervalMinutes = 360;
        private List<String> queries = new ArrayList<>(List.of(
                "relationship", "project", "decision", "memory", "awareness"));
        private List<String> deepQueries = new ArrayList<>(List.of(
                "emotion", "goal", "implementation", "reflection", "learning", "place", "symbol"));
        private int resultsPerQuery = 15;
        private int deepResultsPerQuery = 30;
        private List<String> stoplist = new ArrayList<>();
    }

    @Data
    public static class RecallProperties {
        private int defaultLimitPerLayer = 5;
        private int startupCrystals = 3;
        private int startupAnchors = 2;
        private int startupSummaries = 2;
        private int maxStartupTurns = 999_999;
        private int maxTurnChars = 1000;
        private int maxSummaryChars = 500;
        private long layerTimeoutMs = 10_000;
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private int tickSeconds = 60;
        private boolean autoSummarize = false;
        private boolean autoIngest = false;
    }

    @Data
    public static class LockProperties {
        private String directory = "locks";
        private int maxAttempts = 5;
        private long backoffMs = 200;
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private long timeoutMs = 120_000;
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "text-embedding-3-small";
        private long timeoutMs = 30_000;
        private int batchSize = 64;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
