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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.IngestionBatch;
import me.golemcore.memory.domain.model.IngestionStats;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Moves raw turns into the graph in batches.
 *
 * <p>
 * A batch is the oldest contiguous run of uningested turns. Its id is derived
 * from the turn range, so the same range always yields the same id, and the
 * ledger in {@code graph/batches.jsonl} records completed ids. The range is
 * marked ingested only when every turn in it was accepted; otherwise the
 * whole batch is retried on the next call.
 */
@Service
@Slf4j
public class GraphIngestionService {

    static final String BATCHES_FILE = "batches.jsonl";

    private final TurnStoreService turnStore;
    private final GraphTextureService textureService;
    private final StoragePort storagePort;
    private final CooperativeLockService lockService;
    private final ObjectMapper objectMapper;
    private final MemoryProperties properties;
    private final Clock clock;

    public GraphIngestionService(TurnStoreService turnStore, GraphTextureService textureService,
            StoragePort storagePort, CooperativeLockService lockService, ObjectMapper objectMapper,
            MemoryProperties properties, Clock clock) {
        this.turnStore = turnStore;
        this.textureService = textureService;
        this.storagePort = storagePort;
        this.lockService = lockService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public IngestionStats stats() {
        long uningested = turnStore.countUningested();
        return new IngestionStats(uningested, uningested >= properties.getIngestion().getRecommendThreshold());
    }

    /**
     * Ingest the oldest uningested run of turns.
     *
     * @param batchSize
     *            maximum turns in the batch; non-positive means the default
     * @return the processed batch, or {@link IngestionBatch#empty()} when there
     *         is nothing to do
     */
    public IngestionBatch ingestBatch(int batchSize) {
        if (!textureService.isAvailable()) {
            throw new SubstrateException(ErrorKind.STORAGE_UNAVAILABLE, "Graph layer disabled");
        }
        int size = batchSize > 0 ? batchSize : properties.getIngestion().getBatchSize();
        return lockService.runExclusive(lockService.lockName("ingestion"), () -> ingestLocked(size));
    }

    private IngestionBatch ingestLocked(int size) {
        List<Turn> run = turnStore.oldestUningestedRun(size);
        if (run.isEmpty()) {
            log.debug("[Ingestion] Nothing to ingest");
            return IngestionBatch.empty();
        }
        long startId = run.get(0).getId();
        long endId = run.get(run.size() - 1).getId();
        String batchId = batchIdFor(startId, endId);

        Optional<IngestionBatch> completed = batches().stream()
                .filter(b -> batchId.equals(b.getBatchId()) && b.isCompleted())
                .findFirst();
        if (completed.isPresent()) {
            // ledger entry survived but the range mark did not
            log.info("[Ingestion] {}: batch {} ({}..{}) already completed, restoring range mark",
                    ErrorKind.IDEMPOTENCY_VIOLATION, batchId, startId, endId);
            turnStore.markGraphIngested(startId, endId, batchId);
            return IngestionBatch.empty();
        }

        IngestionBatch batch = IngestionBatch.builder()
                .batchId(batchId)
                .startTurnId(startId)
                .endTurnId(endId)
                .build();
        for (Turn turn : run) {
            batch.getChannels().add(turn.getChannel());
            try {
                textureService.addEpisode(turn.getContent(), turn.getChannel(), roleOf(turn), turn.getCreatedAt(),
                        null);
                batch.setIngestedCount(batch.getIngestedCount() + 1);
            } catch (SubstrateException e) {
                batch.setFailedCount(batch.getFailedCount() + 1);
                log.warn("[Ingestion] Turn {} failed: {}", turn.getId(), e.getMessage());
            }
        }

        if (batch.getFailedCount() == 0) {
            turnStore.markGraphIngested(startId, endId, batchId);
            batch.setCompleted(true);
            batch.setCompletedAt(clock.instant());
            log.info("[Ingestion] Batch {} ingested turns {}..{}", batchId, startId, endId);
        } else {
            log.warn("[Ingestion] Batch {} incomplete ({} of {} failed), will retry whole range",
                    batchId, batch.getFailedCount(), run.size());
        }
        appendLedger(batch);
        return batch;
    }

    /**
     * Ledger entries, oldest first. Failed attempts are recorded too.
     */
    public List<IngestionBatch> batches() {
        String text = AsyncResults.join(storagePort.getText(properties.getIngestion().getDirectory(), BATCHES_FILE),
                "Read ingestion ledger");
        List<IngestionBatch> batches = new ArrayList<>();
        if (text == null) {
            return batches;
        }
        for (String line : text.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                batches.add(objectMapper.readValue(line, IngestionBatch.class));
            } catch (JsonProcessingException e) {
                log.warn("[Ingestion] Skipping malformed ledger line: {}", e.getOriginalMessage());
            }
        }
        return batches;
    }

    public ComponentHealth health() {
        IngestionStats stats = stats();
        ComponentHealth health;
        if (stats.uningestedCount() > properties.getIngestion().getHighBacklog()) {
            health = ComponentHealth.degraded("graph_ingestion",
                    "Backlog HIGH: " + stats.uningestedCount() + " uningested turns");
        } else if (stats.recommended()) {
            health = ComponentHealth.healthy("graph_ingestion",
                    stats.uningestedCount() + " uningested turns, ingestion recommended");
        } else {
            health = ComponentHealth.healthy("graph_ingestion", "Backlog OK");
        }
        return health.withCount("uningested", stats.uningestedCount());
    }

    static String batchIdFor(long startId, long endId) {
        return UUID.nameUUIDFromBytes(("ingest:" + startId + "-" + endId).getBytes(StandardCharsets.UTF_8))
                .toString();
    }

    private String roleOf(Turn turn) {
        return properties.getOwner().equalsIgnoreCase(turn.getAuthor()) ? "assistant" : "user";
    }

    private void appendLedger(IngestionBatch batch) {
        try {
            AsyncResults.join(storagePort.appendText(properties.getIngestion().getDirectory(), BATCHES_FILE,
                    objectMapper.writeValueAsString(batch) + "\n"), "Append ingestion ledger");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ingestion batch", e);
        }
    }
}
