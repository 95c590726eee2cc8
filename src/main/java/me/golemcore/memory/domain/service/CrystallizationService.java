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

import me.golemcore.memory.domain.exception.ChainIntegrityViolationException;
import me.golemcore.memory.domain.exception.ExtractionFailureException;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.Crystal;
import me.golemcore.memory.domain.model.CrystalListing;
import me.golemcore.memory.domain.model.CrystallizationTrigger;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.Summary;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Maintains the crystal chain: a fixed-size window of current crystals and an
 * unbounded archive.
 *
 * <p>
 * A new crystal is due when enough turns or enough hours have passed since
 * the previous one. Creation gathers the previous crystal, summaries made
 * since, and the unsummarized turns it covers, asks the LLM for a crystal and
 * only then writes anything. After the write, the oldest current crystals are
 * archived until the window fits. Only the newest crystal can be deleted.
 */
@Service
@Slf4j
public class CrystallizationService {

    static final List<String> SECTIONS = List.of(
            "Field State", "Key Events", "Decisions", "Internal Arc", "Continuity Seeds");

    private static final String SYSTEM_PROMPT = """
            You write crystals: dense continuity notes that let a future session pick up where this one left off.

            Compress the material to the ratio given with it. Keep emotional texture, decisions and their
            reasons, how the relationship and the work moved, and threads that need to continue. Drop debugging
            detail, repeated attempts, tool output and filler.

            Use exactly these markdown sections, in this order:
            ## Field State
            ## Key Events
            ## Decisions
            ## Internal Arc
            ## Continuity Seeds

            Output only the crystal.""";

    private final TurnStoreService turnStore;
    private final SummarizerService summarizer;
    private final CrystalChainStore chainStore;
    private final LlmPort llmPort;
    private final CooperativeLockService lockService;
    private final MemoryProperties properties;
    private final Clock clock;

    public CrystallizationService(TurnStoreService turnStore, SummarizerService summarizer,
            CrystalChainStore chainStore, LlmPort llmPort, CooperativeLockService lockService,
            MemoryProperties properties, Clock clock) {
        this.turnStore = turnStore;
        this.summarizer = summarizer;
        this.chainStore = chainStore;
        this.llmPort = llmPort;
        this.lockService = lockService;
        this.properties = properties;
        this.clock = clock;
    }

    // ===== Trigger =====

    /**
     * Due when turns since the last crystal reach the turn threshold, or when
     * the hour threshold has passed with at least one new turn.
     */
    public CrystallizationTrigger checkTrigger() {
        MemoryProperties.CrystallizationProperties config = properties.getCrystallization();
        Optional<Crystal> previous = newest();
        List<Turn> pending = turnStore.turnsSince(previous.map(Crystal::getThroughTurnId).orElse(0L));
        if (pending.isEmpty()) {
            return new CrystallizationTrigger(false, 0, 0, "No turns since last crystal");
        }

        Instant reference = previous.map(Crystal::getCreatedAt)
                .orElse(pending.get(0).getCreatedAt());
        double hours = reference == null ? 0
                : Duration.between(reference, clock.instant()).toMinutes() / 60.0;
        int turns = pending.size();

        if (turns >= config.getTurnThreshold()) {
            return new CrystallizationTrigger(true, turns, hours,
                    turns + " turns since last crystal (threshold " + config.getTurnThreshold() + ")");
        }
        if (hours >= config.getHoursThreshold()) {
            return new CrystallizationTrigger(true, turns, hours,
                    String.format(Locale.ROOT, "%.1f hours since last crystal (threshold %d)", hours,
                            config.getHoursThreshold()));
        }
        return new CrystallizationTrigger(false, turns, hours, "Below thresholds");
    }

    /**
     * Create a crystal when the trigger fires.
     */
    public Optional<Crystal> crystallizeIfDue() {
        CrystallizationTrigger trigger = checkTrigger();
        if (!trigger.triggered()) {
            return Optional.empty();
        }
        log.info("[Crystals] Trigger fired: {}", trigger.reason());
        return Optional.of(crystallize(null));
    }

    // ===== Creation =====

    /**
     * Create the next crystal.
     *
     * @param manualContent
     *            crystal text written by the caller, or {@code null} to have the
     *            LLM write it
     * @throws ExtractionFailureException
     *             if the LLM call fails; the chain is left untouched
     */
    public Crystal crystallize(String manualContent) {
        if (manualContent != null) {
            List<String> missing = missingSections(manualContent);
            if (!missing.isEmpty()) {
                throw new SubstrateException(ErrorKind.INVALID_REQUEST,
                        "Crystal is missing sections: " + String.join(", ", missing));
            }
        }
        return lockService.runExclusive(lockService.lockName("crystallization"),
                () -> crystallizeLocked(manualContent));
    }

    private Crystal crystallizeLocked(String manualContent) {
        Optional<Crystal> previous = newest();
        long throughBefore = previous.map(Crystal::getThroughTurnId).orElse(0L);
        List<Turn> turns = turnStore.turnsSince(throughBefore);
        int maxTurns = properties.getCrystallization().getMaxSourceTurns();
        if (turns.size() > maxTurns) {
            turns = turns.subList(turns.size() - maxTurns, turns.size());
        }
        List<Summary> summaries = summarizer.since(previous.map(Crystal::getCreatedAt).orElse(null));

        String content;
        if (manualContent != null) {
            content = manualContent.strip();
        } else {
            if (turns.isEmpty() && summaries.isEmpty()) {
                throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Nothing new to crystallize");
            }
            content = callLlm(previous.orElse(null), summaries, turns);
        }

        // nothing has been written up to this point
        Instant now = clock.instant();
        int sequence = chainStore.nextSequence();
        Crystal crystal = Crystal.builder()
                .sequence(sequence)
                .filename(CrystalChainStore.filenameFor(sequence))
                .timespanStart(timespanStart(previous.orElse(null), summaries, turns, now))
                .timespanEnd(turns.isEmpty() ? now : turns.get(turns.size() - 1).getCreatedAt())
                .tokenEstimate(content.length() / 4)
                .throughTurnId(turns.isEmpty() ? throughBefore : turns.get(turns.size() - 1).getId())
                .createdAt(now)
                .content(content)
                .build();
        chainStore.write(crystal);
        rotate();
        log.info("[Crystals] Created {} ({} turns, {} summaries, ~{} tokens)", crystal.getFilename(), turns.size(),
                summaries.size(), crystal.getTokenEstimate());
        return crystal;
    }

    private void rotate() {
        int window = properties.getCrystallization().getWindowSize();
        List<Crystal> current = chainStore.current();
        for (int i = 0; i < current.size() - window; i++) {
            chainStore.archive(current.get(i));
        }
    }

    // ===== Reads =====

    public CrystalListing listCrystals() {
        return new CrystalListing(chainStore.current(), chainStore.archived());
    }

    /**
     * The newest {@code count} crystals, oldest first.
     */
    public List<Crystal> getCrystals(int count) {
        List<Crystal> current = chainStore.current();
        if (count <= current.size()) {
            return count <= 0 ? current : current.subList(current.size() - count, current.size());
        }
        List<Crystal> all = new ArrayList<>(chainStore.archived());
        all.addAll(current);
        all.sort(Comparator.comparingInt(Crystal::getSequence));
        return all.size() <= count ? all : all.subList(all.size() - count, all.size());
    }

    // ===== Deletion =====

    /**
     * Delete the newest crystal. Archived crystals are not moved back.
     *
     * @param filename
     *            the crystal to delete, or {@code null} for the newest
     * @throws ChainIntegrityViolationException
     *             if {@code filename} is not the newest crystal
     */
    public Crystal deleteLatest(String filename) {
        return lockService.runExclusive(lockService.lockName("crystallization"), () -> {
            Crystal latest = chainStore.latest()
                    .orElseThrow(() -> new SubstrateException(ErrorKind.INVALID_REQUEST, "No current crystals"));
            if (filename != null && !filename.equals(latest.getFilename())) {
                throw new ChainIntegrityViolationException("Only the latest crystal (" + latest.getFilename()
                        + ") can be deleted, not " + filename);
            }
            chainStore.deleteCurrent(latest);
            log.info("[Crystals] Deleted {}", latest.getFilename());
            return latest;
        });
    }

    public ComponentHealth health() {
        String key = RecallLayer.CRYSTALS.getKey();
        List<Crystal> current = chainStore.current();
        int archived = chainStore.archived().size();
        CrystallizationTrigger trigger = checkTrigger();
        ComponentHealth health;
        if (trigger.triggered()) {
            health = ComponentHealth.healthy(key, "Crystallization due: " + trigger.reason());
        } else {
            health = ComponentHealth.healthy(key, current.size() + " current crystals");
        }
        return health.withCount("current", current.size())
                .withCount("archived", archived)
                .withCount("turns_since_last", trigger.turnsSince());
    }

    static List<String> missingSections(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        return SECTIONS.stream()
                .filter(section -> !lower.contains(section.toLowerCase(Locale.ROOT)))
                .toList();
    }

    private Optional<Crystal> newest() {
        Optional<Crystal> latest = chainStore.latest();
        if (latest.isPresent()) {
            return latest;
        }
        List<Crystal> archived = chainStore.archived();
        return archived.isEmpty() ? Optional.empty() : Optional.of(archived.get(archived.size() - 1));
    }

    private Instant timespanStart(Crystal previous, List<Summary> summaries, List<Turn> turns, Instant now) {
        Optional<Instant> fromSummaries = summaries.stream()
                .map(Summary::getTimeSpanStart)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder());
        if (fromSummaries.isPresent()) {
            return fromSummaries.get();
        }
        if (!turns.isEmpty()) {
            return turns.get(0).getCreatedAt();
        }
        return previous != null && previous.getTimespanEnd() != null ? previous.getTimespanEnd() : now;
    }

    private String callLlm(Crystal previous, List<Summary> summaries, List<Turn> turns) {
        if (!llmPort.isAvailable()) {
            throw new ExtractionFailureException("LLM not available for crystallization");
        }
        StringBuilder material = new StringBuilder();
        material.append("Target compression: about ").append(properties.getCrystallization().getCompressionRatio())
                .append(":1\n\n");
        if (previous != null) {
            material.append("# Previous crystal (").append(previous.getFilename()).append(")\n\n")
                    .append(previous.getContent()).append("\n\n");
        }
        if (!summaries.isEmpty()) {
            material.append("# Summaries since then\n\n");
            for (Summary summary : summaries) {
                material.append("- [").append(summary.getStartTurnId()).append("..").append(summary.getEndTurnId())
                        .append("] ").append(summary.getText()).append('\n');
            }
            material.append('\n');
        }
        List<Turn> unsummarized = turns.stream().filter(t -> !t.isSummarized()).toList();
        if (!unsummarized.isEmpty()) {
            material.append("# Recent turns\n\n");
            material.append(unsummarized.stream()
                    .map(t -> "[" + t.getChannel() + "] " + t.getAuthor() + ": " + t.getContent())
                    .collect(Collectors.joining("\n")));
        }

        LlmRequest request = LlmRequest.builder()
                .model(llmPort.getCurrentModel())
                .systemPrompt(SYSTEM_PROMPT)
                .userMessage(material.toString())
                .maxTokens(properties.getCrystallization().getMaxTokens())
                .temperature(0.4)
                .build();

        try {
            long start = clock.millis();
            LlmResponse response = llmPort.chat(request)
                    .get(properties.getCrystallization().getTimeoutMs(), TimeUnit.MILLISECONDS);
            String text = response.getContent();
            if (text == null || text.isBlank()) {
                throw new ExtractionFailureException("LLM returned an empty crystal");
            }
            List<String> missing = missingSections(text);
            if (!missing.isEmpty()) {
                throw new ExtractionFailureException("LLM crystal is missing sections: " + String.join(", ", missing));
            }
            log.info("[Crystals] LLM crystal in {}ms ({} chars)", clock.millis() - start, text.length());
            return text.strip();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionFailureException("Crystallization interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Crystals] LLM crystallization failed: {}", e.getMessage());
            throw new ExtractionFailureException("Crystallization failed: " + e.getMessage(), e);
        }
    }
}
