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
import me.golemcore.memory.domain.exception.ExtractionFailureException;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.Summary;
import me.golemcore.memory.domain.model.SummaryKind;
import me.golemcore.memory.domain.model.SummarySearchHit;
import me.golemcore.memory.domain.model.SummaryStats;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.domain.model.TurnQuery;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LlmPort;
import me.golemcore.memory.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Compresses unsummarized turn ranges into mid-tier summaries.
 *
 * <p>
 * {@link #summarize(int, SummaryKind)} only calls the LLM and returns a
 * draft; {@link #store(Summary)} persists it to {@code summaries/summaries.jsonl}
 * and marks the covered turn range. Ranges never overlap: storing a summary
 * whose range intersects an existing one is a logged no-op that returns the
 * existing summary.
 */
@Service
@Slf4j
public class SummarizerService {

    static final String SUMMARIES_FILE = "summaries.jsonl";

    private static final String SYSTEM_PROMPT = """
            You compress a stretch of conversation into a dense summary that keeps continuity.

            Keep:
            - decisions made and their reasons
            - breakthroughs and realizations
            - emotional and relational developments
            - problems that remain open, blockers
            - what should happen next

            Remove:
            - greetings and filler
            - repeated debugging attempts (keep only the outcome)
            - tool output and command noise

            Write in the past tense, in the language of the conversation. Output only the summary.""";

    private final TurnStoreService turnStore;
    private final LlmPort llmPort;
    private final StoragePort storagePort;
    private final CooperativeLockService lockService;
    private final ObjectMapper objectMapper;
    private final MemoryProperties properties;
    private final Clock clock;
    private final String directory;

    public SummarizerService(TurnStoreService turnStore, LlmPort llmPort, StoragePort storagePort,
            CooperativeLockService lockService, ObjectMapper objectMapper, MemoryProperties properties, Clock clock) {
        this.turnStore = turnStore;
        this.llmPort = llmPort;
        this.storagePort = storagePort;
        this.lockService = lockService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.directory = properties.getSummaries().getDirectory();
    }

    /**
     * Summarize the oldest contiguous run of unsummarized turns. The summary is
     * not stored; turns already covered by a stored summary get their lost
     * mark back and are skipped.
     *
     * @param limit
     *            maximum number of turns; non-positive means the default
     * @return empty when fewer than the minimum number of turns are pending
     * @throws ExtractionFailureException
     *             if the LLM call fails; the turns stay unsummarized
     */
    public Optional<Summary> summarize(int limit, SummaryKind kind) {
        MemoryProperties.SummariesProperties config = properties.getSummaries();
        int effectiveLimit = limit > 0 ? limit : config.getDefaultLimit();
        List<Turn> turns = turnStore.oldestUnsummarizedRun(effectiveLimit);
        while (!turns.isEmpty() && restoreLostMarks(turns.get(0).getId(), turns.get(turns.size() - 1).getId())) {
            turns = turnStore.oldestUnsummarizedRun(effectiveLimit);
        }
        if (turns.size() < config.getMinTurns()) {
            log.debug("[Summaries] {} pending turns, below minimum of {}", turns.size(), config.getMinTurns());
            return Optional.empty();
        }

        String text = callLlm(turns, kind);
        Set<String> channels = turns.stream().map(Turn::getChannel)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Turn first = turns.get(0);
        Turn last = turns.get(turns.size() - 1);
        return Optional.of(Summary.builder()
                .startTurnId(first.getId())
                .endTurnId(last.getId())
                .messageCount(turns.size())
                .channels(channels)
                .kind(kind != null ? kind : SummaryKind.WORK)
                .text(text)
                .timeSpanStart(first.getCreatedAt())
                .timeSpanEnd(last.getCreatedAt())
                .build());
    }

    /**
     * Persist a summary and mark its range as summarized.
     *
     * @return the stored summary, or the existing one when the range overlaps
     */
    public Summary store(Summary summary) {
        if (summary.getText() == null || summary.getText().isBlank()) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Summary text is required");
        }
        if (summary.getEndTurnId() < summary.getStartTurnId() || summary.getStartTurnId() <= 0) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST,
                    "Invalid summary range: " + summary.getStartTurnId() + ".." + summary.getEndTurnId());
        }

        return lockService.runExclusive(lockService.lockName("summaries"), () -> {
            Optional<Summary> overlapping = all().stream()
                    .filter(s -> s.overlaps(summary.getStartTurnId(), summary.getEndTurnId()))
                    .findFirst();
            if (overlapping.isPresent()) {
                log.info("[Summaries] {}: range {}..{} overlaps {}, not storing", ErrorKind.IDEMPOTENCY_VIOLATION,
                        summary.getStartTurnId(), summary.getEndTurnId(), overlapping.get().getId());
                restoreLostMarks(summary.getStartTurnId(), summary.getEndTurnId());
                return overlapping.get();
            }

            Summary stored = summary.toBuilder()
                    .id("summary_" + summary.getStartTurnId() + "_" + summary.getEndTurnId())
                    .kind(summary.getKind() != null ? summary.getKind() : SummaryKind.WORK)
                    .messageCount(summary.getMessageCount() > 0 ? summary.getMessageCount()
                            : (int) (summary.getEndTurnId() - summary.getStartTurnId() + 1))
                    .createdAt(clock.instant())
                    .build();
            AsyncResults.join(storagePort.appendText(directory, SUMMARIES_FILE, toJson(stored) + "\n"),
                    "Append summary");
            turnStore.markSummarized(stored.getStartTurnId(), stored.getEndTurnId(), stored.getId());
            log.info("[Summaries] Stored {} covering {} turns", stored.getId(), stored.getMessageCount());
            return stored;
        });
    }

    /**
     * Re-mark stored summaries whose turns in {@code startId..endId} are not
     * marked, which happens when a process dies between appending a summary
     * and marking its range.
     *
     * @return whether any mark was restored
     */
    private boolean restoreLostMarks(long startId, long endId) {
        List<Summary> covering = all().stream().filter(s -> s.overlaps(startId, endId)).toList();
        if (covering.isEmpty()) {
            return false;
        }
        Set<Long> unmarked = turnStore.query(TurnQuery.all()).stream()
                .filter(t -> t.getId() >= startId && t.getId() <= endId && !t.isSummarized())
                .map(Turn::getId)
                .collect(Collectors.toSet());
        boolean restored = false;
        for (Summary existing : covering) {
            boolean lost = unmarked.stream()
                    .anyMatch(id -> id >= existing.getStartTurnId() && id <= existing.getEndTurnId());
            if (lost) {
                turnStore.markSummarized(existing.getStartTurnId(), existing.getEndTurnId(), existing.getId());
                log.warn("[Summaries] Restored missing mark for {}", existing.getId());
                restored = true;
            }
        }
        return restored;
    }

    /**
     * Summarize and store in one step.
     */
    public Optional<Summary> summarizeAndStore(int limit, SummaryKind kind) {
        return summarize(limit, kind).map(this::store);
    }

    public long backlogCount() {
        return turnStore.countUnsummarized();
    }

    /**
     * Newest summaries first.
     */
    public List<Summary> recent(int limit) {
        List<Summary> all = new ArrayList<>(all());
        all.sort(Comparator.comparingLong(Summary::getEndTurnId).reversed());
        return limit > 0 && all.size() > limit ? all.subList(0, limit) : all;
    }

    /**
     * Case-insensitive text search; relevance grows with the number of matches.
     */
    public List<SummarySearchHit> search(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.toLowerCase(Locale.ROOT);
        List<SummarySearchHit> hits = new ArrayList<>();
        for (Summary summary : all()) {
            int occurrences = occurrences(summary.getText().toLowerCase(Locale.ROOT), needle);
            if (occurrences > 0) {
                hits.add(new SummarySearchHit(summary, Math.min(1.0, 0.3 + 0.2 * occurrences)));
            }
        }
        return hits.stream()
                .sorted(Comparator.comparingDouble(SummarySearchHit::relevance).reversed()
                        .thenComparing(h -> -h.summary().getEndTurnId()))
                .limit(limit)
                .toList();
    }

    public SummaryStats stats() {
        List<Summary> all = all();
        long backlog = backlogCount();
        return SummaryStats.builder()
                .unsummarizedCount(backlog)
                .totalSummaries(all.size())
                .lastSummaryAt(all.stream().map(Summary::getCreatedAt).filter(Objects::nonNull)
                        .max(Comparator.naturalOrder()).orElse(null))
                .needsSummarization(backlog >= properties.getSummaries().getHealthyBacklog())
                .build();
    }

    /**
     * Summaries created after the given instant, oldest first.
     */
    public List<Summary> since(Instant after) {
        return all().stream()
                .filter(s -> after == null || (s.getCreatedAt() != null && s.getCreatedAt().isAfter(after)))
                .sorted(Comparator.comparingLong(Summary::getStartTurnId))
                .toList();
    }

    public List<Summary> all() {
        String text = AsyncResults.join(storagePort.getText(directory, SUMMARIES_FILE), "Read summaries");
        List<Summary> summaries = new ArrayList<>();
        if (text == null) {
            return summaries;
        }
        for (String line : text.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                summaries.add(objectMapper.readValue(line, Summary.class));
            } catch (JsonProcessingException e) {
                log.warn("[Summaries] Skipping malformed line: {}", e.getOriginalMessage());
            }
        }
        return summaries;
    }

    public ComponentHealth health() {
        long backlog = backlogCount();
        int total = all().size();
        MemoryProperties.SummariesProperties config = properties.getSummaries();
        ComponentHealth health;
        if (backlog > config.getHighBacklog()) {
            health = ComponentHealth.degraded(RecallLayer.SUMMARIES.getKey(),
                    "Backlog HIGH: " + backlog + " unsummarized turns");
        } else if (backlog > config.getRecommendedBacklog()) {
            health = ComponentHealth.healthy(RecallLayer.SUMMARIES.getKey(),
                    backlog + " unsummarized turns, summarization recommended");
        } else {
            health = ComponentHealth.healthy(RecallLayer.SUMMARIES.getKey(), total + " summaries");
        }
        return health.withCount("summaries", total).withCount("unsummarized", backlog);
    }

    private String callLlm(List<Turn> turns, SummaryKind kind) {
        if (!llmPort.isAvailable()) {
            throw new ExtractionFailureException("LLM not available for summarization");
        }
        SummaryKind effectiveKind = kind != null ? kind : SummaryKind.WORK;
        String conversation = turns.stream()
                .map(t -> "[" + t.getChannel() + "] " + t.getAuthor() + ": " + t.getContent())
                .collect(Collectors.joining("\n"));

        LlmRequest request = LlmRequest.builder()
                .model(llmPort.getCurrentModel())
                .systemPrompt(SYSTEM_PROMPT)
                .userMessage("Summarize this " + effectiveKind.label() + " conversation ("
                        + turns.size() + " messages):\n\n" + conversation)
                .maxTokens(properties.getSummaries().getMaxTokens())
                .temperature(0.3)
                .build();

        long timeoutMs = properties.getSummaries().getTimeoutMs();
        try {
            long start = clock.millis();
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            String text = response.getContent();
            if (text == null || text.isBlank()) {
                throw new ExtractionFailureException("LLM returned empty summary");
            }
            log.info("[Summaries] Summarized {} turns in {}ms ({} chars)", turns.size(), clock.millis() - start,
                    text.length());
            return text.strip();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionFailureException("Summarization interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Summaries] LLM summarization failed: {}", e.getMessage());
            throw new ExtractionFailureException("Summarization failed: " + e.getMessage(), e);
        }
    }

    private String toJson(Summary summary) {
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize summary", e);
        }
    }

    private static int occurrences(String haystack, String needle) {
        int count = 0;
        int idx = haystack.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = haystack.indexOf(needle, idx + needle.length());
        }
        return count;
    }
}
