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

import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.CurationCandidate;
import me.golemcore.memory.domain.model.CurationReport;
import me.golemcore.memory.domain.model.GraphDeleteResult;
import me.golemcore.memory.domain.model.GraphFact;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Samples the graph and removes exact duplicates and facts attached to vague
 * entities.
 *
 * <p>
 * Only two rules produce candidates:
 * <ul>
 * <li><b>duplicate</b> - a fact whose signature {@code (normalize(source),
 * predicate, normalize(target))} was already seen earlier in the sample; the
 * first occurrence is always kept</li>
 * <li><b>vague entity</b> - source or target normalizes to a stoplist token
 * (articles, pronouns, placeholders) or to a single character</li>
 * </ul>
 * Everything else is left alone. Deletions are independent: a failure is
 * logged and the pass continues. A pass can be stopped between deletions and
 * leaves the graph valid.
 */
@Service
@Slf4j
public class GraphCuratorService {

    static final Set<String> DEFAULT_STOPLIST = Set.of(
            "the", "a", "an", "?", "...", "", "n/a", "unknown", "null", "none",
            "it", "this", "that", "these", "those", "he", "she", "they", "them", "we", "you", "i", "me",
            "something", "nothing", "someone", "be", "is", "was", "were");

    private final GraphTextureService textureService;
    private final MemoryProperties properties;
    private final Clock clock;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    public GraphCuratorService(GraphTextureService textureService, MemoryProperties properties, Clock clock) {
        this.textureService = textureService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Run one pass with the configured mode and policy.
     */
    public CurationReport curate() {
        MemoryProperties.CuratorProperties config = properties.getCurator();
        return curate(config.isDeep(), config.isAutoDelete());
    }

    public CurationReport curate(boolean deep, boolean autoDelete) {
        if (!running.compareAndSet(false, true)) {
            log.info("[Curator] Pass already running, skipping");
            return CurationReport.builder().namespace(textureService.namespace()).deep(deep).autoDelete(autoDelete)
                    .interrupted(true).startedAt(clock.instant()).finishedAt(clock.instant()).build();
        }
        stopRequested.set(false);
        try {
            return runPass(deep, autoDelete);
        } finally {
            running.set(false);
        }
    }

    /**
     * Ask a running pass to stop before its next deletion.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    private CurationReport runPass(boolean deep, boolean autoDelete) {
        MemoryProperties.CuratorProperties config = properties.getCurator();
        List<String> queries = new ArrayList<>(config.getQueries());
        if (deep) {
            queries.addAll(config.getDeepQueries());
        }
        int perQuery = deep ? config.getDeepResultsPerQuery() : config.getResultsPerQuery();

        CurationReport report = CurationReport.builder()
                .namespace(textureService.namespace())
                .deep(deep)
                .autoDelete(autoDelete)
                .startedAt(clock.instant())
                .build();
        log.info("[Curator] Starting {} pass over {} queries ({} results each, auto-delete: {})",
                deep ? "deep" : "standard", queries.size(), perQuery, autoDelete);

        // Sample, keeping each fact once even when several queries return it
        Map<String, GraphFact> unique = new LinkedHashMap<>();
        int sampled = 0;
        for (String query : queries) {
            if (stopRequested.get() || Thread.currentThread().isInterrupted()) {
                report.setInterrupted(true);
                break;
            }
            try {
                List<GraphFact> facts = textureService.search(query, perQuery);
                sampled += facts.size();
                for (GraphFact fact : facts) {
                    String key = fact.getUuid() != null ? fact.getUuid() : "anon-" + unique.size();
                    unique.putIfAbsent(key, fact);
                }
                report.setQueriesRun(report.getQueriesRun() + 1);
            } catch (SubstrateException e) {
                log.warn("[Curator] Query '{}' failed: {}", query, e.getMessage());
            }
        }
        report.setFactsSampled(sampled);
        report.setUniqueFacts(unique.size());

        List<CurationCandidate> candidates = findCandidates(new ArrayList<>(unique.values()));
        report.getCandidates().addAll(candidates);
        report.setDuplicates((int) candidates.stream()
                .filter(c -> c.reason() == CurationCandidate.Reason.DUPLICATE).count());
        report.setVagueEntities((int) candidates.stream()
                .filter(c -> c.reason() == CurationCandidate.Reason.VAGUE_ENTITY).count());
        report.setAmbiguous((int) candidates.stream()
                .filter(c -> c.reason() == CurationCandidate.Reason.AMBIGUOUS).count());

        if (autoDelete && !report.isInterrupted()) {
            deleteCandidates(candidates, report);
        }

        report.setFinishedAt(clock.instant());
        log.info("[Curator] Pass done: {} unique facts, {} duplicates, {} vague, {} ambiguous, {} deleted, {} failed{}",
                report.getUniqueFacts(), report.getDuplicates(), report.getVagueEntities(), report.getAmbiguous(),
                report.getDeleted(), report.getFailed(), report.isInterrupted() ? " (interrupted)" : "");
        return report;
    }

    /**
     * Apply the two candidate rules to a sample of distinct facts.
     */
    public List<CurationCandidate> findCandidates(List<GraphFact> facts) {
        Set<String> stoplist = stoplist();
        List<CurationCandidate> candidates = new ArrayList<>();
        Set<String> seenSignatures = new HashSet<>();

        for (GraphFact fact : facts) {
            String source = normalize(fact.getSourceEntity());
            String target = normalize(fact.getTargetEntity());
            if (fact.getSourceEntity() == null || fact.getTargetEntity() == null) {
                candidates.add(new CurationCandidate(fact, CurationCandidate.Reason.AMBIGUOUS,
                        "Unresolved endpoint in '" + fact.getFact() + "'"));
                continue;
            }
            String signature = source + "|" + fact.getPredicate() + "|" + target;
            boolean firstOfSignature = seenSignatures.add(signature);

            CurationCandidate.Reason reason;
            String detail;
            if (isVague(source, stoplist) || isVague(target, stoplist)) {
                String which = isVague(source, stoplist) ? fact.getSourceEntity() : fact.getTargetEntity();
                reason = CurationCandidate.Reason.VAGUE_ENTITY;
                detail = "Vague entity '" + which + "'";
            } else if (!firstOfSignature) {
                reason = CurationCandidate.Reason.DUPLICATE;
                detail = "Duplicate of " + signature;
            } else {
                continue;
            }
            if (fact.isEndpointsInferred()) {
                // a guessed split can look vague or duplicated without being so
                reason = CurationCandidate.Reason.AMBIGUOUS;
                detail = detail + " (endpoints inferred from fact text)";
            }
            candidates.add(new CurationCandidate(fact, reason, detail));
        }
        return candidates;
    }

    private void deleteCandidates(List<CurationCandidate> candidates, CurationReport report) {
        for (CurationCandidate candidate : candidates) {
            if (!candidate.deletable()) {
                continue;
            }
            if (stopRequested.get() || Thread.currentThread().isInterrupted()) {
                report.setInterrupted(true);
                log.info("[Curator] Stopped after {} deletions", report.getDeleted());
                return;
            }
            String uuid = candidate.fact().getUuid();
            if (uuid == null) {
                report.setFailed(report.getFailed() + 1);
                continue;
            }
            try {
                GraphDeleteResult result = textureService.delete(uuid);
                if (result.deleted()) {
                    report.setDeleted(report.getDeleted() + 1);
                    report.getDeletedUuids().add(uuid);
                    log.debug("[Curator] Deleted {} ({})", uuid, candidate.detail());
                } else {
                    report.setFailed(report.getFailed() + 1);
                    log.info("[Curator] Skipped {}: {}", uuid, result.message());
                }
            } catch (SubstrateException e) {
                report.setFailed(report.getFailed() + 1);
                log.warn("[Curator] Failed to delete {}: {}", uuid, e.getMessage());
            }
        }
    }

    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String collapsed = name.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        String stripped = collapsed.replaceAll("^[\\p{Punct}&&[^?]]+|[\\p{Punct}&&[^?]]+$", "").trim();
        return stripped.isEmpty() && !collapsed.isEmpty() ? collapsed : stripped;
    }

    private static boolean isVague(String normalized, Set<String> stoplist) {
        return normalized.length() <= 1 || stoplist.contains(normalized);
    }

    private Set<String> stoplist() {
        Set<String> stoplist = new HashSet<>(DEFAULT_STOPLIST);
        for (String token : properties.getCurator().getStoplist()) {
            stoplist.add(token.toLowerCase(Locale.ROOT).trim());
        }
        return stoplist;
    }
}
