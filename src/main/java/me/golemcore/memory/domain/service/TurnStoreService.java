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
import me.golemcore.memory.domain.model.RangeMark;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.domain.model.TurnAppendedEvent;
import me.golemcore.memory.domain.model.TurnIntegrityReport;
import me.golemcore.memory.domain.model.TurnMatch;
import me.golemcore.memory.domain.model.TurnQuery;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.infrastructure.event.SpringEventBus;
import me.golemcore.memory.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Append-only ledger of conversational turns.
 *
 * <p>
 * Storage layout under {@code turns/}:
 * <ul>
 * <li>{@code turns.jsonl} - one JSON turn per line, never rewritten</li>
 * <li>{@code marks.jsonl} - summarized / graph-ingested range marks</li>
 * <li>{@code turns.seq} - last allocated id</li>
 * <li>{@code backups/<timestamp>/} - snapshots taken by {@link #backup()}</li>
 * </ul>
 *
 * <p>
 * Ids are allocated from {@code turns.seq} under a short cross-process lock
 * that writers queue on, so every writer gets a strictly increasing id that
 * is never reused and no append is dropped for contention. Turn lines are immutable; the
 * summary and ingestion fields of a turn are derived from the mark log on
 * read. Appending publishes {@link TurnAppendedEvent}; listeners hand off to
 * their own executor so append never waits on downstream work.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class TurnStoreService {

    static final String TURNS_FILE = "turns.jsonl";
    static final String MARKS_FILE = "marks.jsonl";
    static final String SEQ_FILE = "turns.seq";
    static final String BACKUPS_PREFIX = "backups";

    private static final DateTimeFormatter BACKUP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS")
            .withZone(ZoneOffset.UTC);

    private final StoragePort storagePort;
    private final CooperativeLockService lockService;
    private final SpringEventBus eventBus;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MemoryProperties properties;
    private final String directory;

    // guarded by the turns lock
    private boolean sequenceVerified;

    public TurnStoreService(StoragePort storagePort, CooperativeLockService lockService, SpringEventBus eventBus,
            ObjectMapper objectMapper, Clock clock, MemoryProperties properties) {
        this.storagePort = storagePort;
        this.lockService = lockService;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
        this.directory = properties.getTurns().getDirectory();
    }

    // ===== Append =====

    /**
     * Append a turn. Id and timestamp are assigned here; a caller-provided
     * {@code createdAt} is kept.
     *
     * @return the stored turn with its id
     */
    public Turn append(String channel, String author, String content) {
        return append(Turn.builder().channel(channel).author(author).content(content).build());
    }

    public Turn append(Turn draft) {
        if (draft.getContent() == null) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Turn content is required");
        }
        Turn stored = lockService.runQueued(lockService.lockName("turns"), () -> {
            long id = nextId();
            Turn turn = Turn.builder()
                    .id(id)
                    .channel(draft.getChannel() != null ? draft.getChannel() : "unknown")
                    .author(draft.getAuthor() != null ? draft.getAuthor() : "unknown")
                    .content(draft.getContent())
                    .createdAt(draft.getCreatedAt() != null ? draft.getCreatedAt() : clock.instant())
                    .build();
            // sequence first: a crash after it leaves a gap, never a reused id
            AsyncResults.join(storagePort.putTextAtomic(directory, SEQ_FILE, String.valueOf(id), false),
                    "Write turn sequence");
            AsyncResults.join(storagePort.appendText(directory, TURNS_FILE, toJson(turn) + "\n"), "Append turn");
            return turn;
        });
        log.debug("[TurnStore] Appended turn {} ({}/{})", stored.getId(), stored.getChannel(), stored.getAuthor());
        eventBus.publish(new TurnAppendedEvent(stored.getId(), stored.getChannel()));
        return stored;
    }

    /**
     * Next id from the sequence file. The log is scanned only the first time
     * this instance allocates, or when the sequence file is missing or
     * unreadable.
     */
    private long nextId() {
        long last = readSequence();
        if (last < 0 || !sequenceVerified) {
            long fromLog = readRawTurns().stream().mapToLong(Turn::getId).max().orElse(0);
            if (fromLog > last && last >= 0) {
                log.warn("[TurnStore] Sequence {} behind log {}, continuing from log", last, fromLog);
            }
            last = Math.max(last, fromLog);
            sequenceVerified = true;
        }
        return last + 1;
    }

    private long readSequence() {
        String seq = AsyncResults.join(storagePort.getText(directory, SEQ_FILE), "Read turn sequence");
        if (seq == null || seq.isBlank()) {
            return -1;
        }
        try {
            return Long.parseLong(seq.trim());
        } catch (NumberFormatException e) {
            log.warn("[TurnStore] Sequence file unreadable, recovering from log");
            return -1;
        }
    }

    // ===== Queries =====

    public Optional<Turn> get(long id) {
        return all().stream().filter(t -> t.getId() == id).findFirst();
    }

    /**
     * Filtered turns in id order. A positive limit keeps the newest matches.
     */
    public List<Turn> query(TurnQuery query) {
        Predicate<Turn> filter = t -> true;
        if (query.getChannel() != null) {
            filter = filter.and(t -> query.getChannel().equalsIgnoreCase(t.getChannel()));
        }
        if (query.getAuthor() != null) {
            filter = filter.and(t -> query.getAuthor().equalsIgnoreCase(t.getAuthor()));
        }
        if (query.getFrom() != null) {
            filter = filter.and(t -> t.getCreatedAt() != null && !t.getCreatedAt().isBefore(query.getFrom()));
        }
        if (query.getUntil() != null) {
            filter = filter.and(t -> t.getCreatedAt() != null && !t.getCreatedAt().isAfter(query.getUntil()));
        }
        if (query.getText() != null && !query.getText().isBlank()) {
            String needle = query.getText().toLowerCase(Locale.ROOT);
            filter = filter.and(t -> t.getContent().toLowerCase(Locale.ROOT).contains(needle));
        }
        List<Turn> matches = all().stream().filter(filter).toList();
        return tail(matches, query.getLimit());
    }

    public List<Turn> recent(int limit) {
        return tail(all(), limit);
    }

    public List<Turn> turnsSince(long afterId) {
        return all().stream().filter(t -> t.getId() > afterId).toList();
    }

    public List<Turn> unsummarized(int limit) {
        List<Turn> pending = all().stream().filter(t -> !t.isSummarized()).toList();
        return limit > 0 && pending.size() > limit ? pending.subList(0, limit) : pending;
    }

    /**
     * Oldest run of consecutive turns that have not been summarized, at most
     * {@code limit} long.
     */
    public List<Turn> oldestUnsummarizedRun(int limit) {
        return oldestRun(t -> !t.isSummarized(), limit);
    }

    /**
     * Oldest run of consecutive turns not yet ingested into the graph.
     */
    public List<Turn> oldestUningestedRun(int limit) {
        return oldestRun(t -> !t.isIngestedToGraph(), limit);
    }

    public long countUnsummarized() {
        return all().stream().filter(t -> !t.isSummarized()).count();
    }

    public long countUningested() {
        return all().stream().filter(t -> !t.isIngestedToGraph()).count();
    }

    public long count() {
        return readRawTurns().size();
    }

    public long lastId() {
        return readRawTurns().stream().mapToLong(Turn::getId).max().orElse(0);
    }

    /**
     * Best-effort content search ranked by how often the query terms occur.
     */
    public List<TurnMatch> search(String text, int limit) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] terms = text.toLowerCase(Locale.ROOT).split("\\s+");
        List<TurnMatch> matches = new ArrayList<>();
        for (Turn turn : all()) {
            String content = turn.getContent().toLowerCase(Locale.ROOT);
            int hits = 0;
            for (String term : terms) {
                hits += occurrences(content, term);
            }
            if (hits > 0) {
                double score = Math.min(1.0, (double) hits / (terms.length * 3.0) + 0.2);
                matches.add(new TurnMatch(turn, score));
            }
        }
        return matches.stream()
                .sorted(Comparator.comparingDouble(TurnMatch::score).reversed()
                        .thenComparing(m -> -m.turn().getId()))
                .limit(limit)
                .toList();
    }

    // ===== Marks =====

    public void markSummarized(long startId, long endId, String summaryId) {
        appendMark(RangeMark.Type.SUMMARIZED, startId, endId, summaryId);
    }

    public void markGraphIngested(long startId, long endId, String batchId) {
        appendMark(RangeMark.Type.GRAPH_INGESTED, startId, endId, batchId);
    }

    private void appendMark(RangeMark.Type type, long startId, long endId, String refId) {
        if (endId < startId) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST,
                    "Invalid range: " + startId + ".." + endId);
        }
        RangeMark mark = RangeMark.builder()
                .type(type)
                .startId(startId)
                .endId(endId)
                .refId(refId)
                .markedAt(clock.instant())
                .build();
        AsyncResults.join(storagePort.appendText(directory, MARKS_FILE, toJson(mark) + "\n"), "Append mark");
        log.debug("[TurnStore] Marked {} {}..{} ({})", type, startId, endId, refId);
    }

    public List<RangeMark> marks() {
        String text = AsyncResults.join(storagePort.getText(directory, MARKS_FILE), "Read marks");
        List<RangeMark> marks = new ArrayList<>();
        if (text == null) {
            return marks;
        }
        for (String line : text.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                marks.add(objectMapper.readValue(line, RangeMark.class));
            } catch (JsonProcessingException e) {
                log.warn("[TurnStore] Skipping malformed mark line: {}", e.getOriginalMessage());
            }
        }
        return marks;
    }

    // ===== Integrity and backups =====

    /**
     * Scan the log for malformed lines and id ordering violations.
     */
    public TurnIntegrityReport integrityCheck() {
        String text = AsyncResults.join(storagePort.getText(directory, TURNS_FILE), "Read turns");
        TurnIntegrityReport report = TurnIntegrityReport.builder().build();
        if (text == null) {
            return report;
        }
        Set<Long> seen = new HashSet<>();
        long previous = 0;
        int lineNumber = 0;
        int total = 0;
        int valid = 0;
        for (String line : text.split("\n")) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            total++;
            Turn turn = parseTurn(line);
            if (turn == null || turn.getId() <= 0 || turn.getContent() == null) {
                report.getMalformedLines().add(lineNumber);
                continue;
            }
            if (!seen.add(turn.getId())) {
                report.getDuplicateIds().add(turn.getId());
            } else if (turn.getId() <= previous) {
                report.getNonMonotonicIds().add(turn.getId());
            }
            previous = Math.max(previous, turn.getId());
            valid++;
        }
        report.setTotalLines(total);
        report.setValidTurns(valid);
        report.setLastId(previous);
        if (!report.isHealthy()) {
            log.warn("[TurnStore] Integrity problems: {} malformed, {} duplicate, {} out of order",
                    report.getMalformedLines().size(), report.getDuplicateIds().size(),
                    report.getNonMonotonicIds().size());
        }
        return report;
    }

    /**
     * Copy the turn log, mark log and sequence into a new snapshot.
     *
     * @return snapshot name
     */
    public String backup() {
        String snapshot = uniqueSnapshotName(BACKUP_FORMAT.format(clock.instant()));
        lockService.runQueued(lockService.lockName("turns"), () -> {
            for (String file : List.of(TURNS_FILE, MARKS_FILE, SEQ_FILE)) {
                String content = AsyncResults.join(storagePort.getText(directory, file), "Read " + file);
                if (content != null) {
                    AsyncResults.join(storagePort.putTextAtomic(directory,
                            BACKUPS_PREFIX + "/" + snapshot + "/" + file, content, false), "Backup " + file);
                }
            }
        });
        pruneBackups();
        log.info("[TurnStore] Backup created: {}", snapshot);
        return snapshot;
    }

    /**
     * Snapshot names, oldest first.
     */
    public List<String> listBackups() {
        List<String> files = AsyncResults.join(storagePort.listObjects(directory, BACKUPS_PREFIX), "List backups");
        return files.stream()
                .map(f -> f.substring(BACKUPS_PREFIX.length() + 1))
                .filter(f -> f.contains("/"))
                .map(f -> f.substring(0, f.indexOf('/')))
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Replace the live log with a snapshot. The current state is backed up
     * first, so a restore can itself be undone.
     */
    public void restore(String snapshot) {
        if (!listBackups().contains(snapshot)) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Unknown backup: " + snapshot);
        }
        String safety = backup();
        lockService.runQueued(lockService.lockName("turns"), () -> {
            // the live sequence stays: ids handed out after the snapshot are never reissued
            for (String file : List.of(TURNS_FILE, MARKS_FILE)) {
                String content = AsyncResults.join(storagePort.getText(directory,
                        BACKUPS_PREFIX + "/" + snapshot + "/" + file), "Read backup " + file);
                if (content != null) {
                    AsyncResults.join(storagePort.putTextAtomic(directory, file, content, true), "Restore " + file);
                } else {
                    AsyncResults.join(storagePort.deleteObject(directory, file), "Remove " + file);
                }
            }
        });
        log.warn("[TurnStore] Restored snapshot {} (previous state saved as {})", snapshot, safety);
    }

    // a restore takes a safety backup, which must never overwrite its source
    private String uniqueSnapshotName(String base) {
        List<String> existing = listBackups();
        String name = base;
        int suffix = 1;
        while (existing.contains(name)) {
            name = base + "-" + suffix++;
        }
        return name;
    }

    private void pruneBackups() {
        List<String> backups = listBackups();
        int excess = backups.size() - properties.getTurns().getMaxBackups();
        for (int i = 0; i < excess; i++) {
            String snapshot = backups.get(i);
            for (String file : List.of(TURNS_FILE, MARKS_FILE, SEQ_FILE)) {
                AsyncResults.join(storagePort.deleteObject(directory, BACKUPS_PREFIX + "/" + snapshot + "/" + file),
                        "Prune backup");
            }
            log.debug("[TurnStore] Pruned backup {}", snapshot);
        }
    }

    public ComponentHealth health() {
        TurnIntegrityReport report = integrityCheck();
        ComponentHealth health;
        if (report.isHealthy()) {
            health = ComponentHealth.healthy("turn_store", report.getValidTurns() + " turns, log intact");
        } else {
            health = ComponentHealth.critical("turn_store", "Integrity problems in " + report.getMalformedLines().size()
                    + " lines and " + (report.getDuplicateIds().size() + report.getNonMonotonicIds().size())
                    + " ids; restore from backup");
        }
        return health.withCount("turns", report.getValidTurns())
                .withCount("last_id", report.getLastId())
                .withCount("unsummarized", countUnsummarized())
                .withCount("uningested", countUningested())
                .withCount("backups", listBackups().size());
    }

    // ===== Internals =====

    private List<Turn> all() {
        List<Turn> turns = readRawTurns();
        List<RangeMark> marks = marks();
        if (marks.isEmpty()) {
            return turns;
        }
        List<Turn> overlaid = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            Turn copy = turn.toBuilder().build();
            for (RangeMark mark : marks) {
                if (!mark.covers(turn.getId())) {
                    continue;
                }
                if (mark.getType() == RangeMark.Type.SUMMARIZED && copy.getSummaryId() == null) {
                    copy.setSummaryId(mark.getRefId());
                } else if (mark.getType() == RangeMark.Type.GRAPH_INGESTED && !copy.isIngestedToGraph()) {
                    copy.setIngestedToGraph(true);
                    copy.setIngestionBatchId(mark.getRefId());
                }
            }
            overlaid.add(copy);
        }
        return overlaid;
    }

    private List<Turn> readRawTurns() {
        String text = AsyncResults.join(storagePort.getText(directory, TURNS_FILE), "Read turns");
        if (text == null) {
            return List.of();
        }
        List<Turn> turns = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (String line : text.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            Turn turn = parseTurn(line);
            if (turn != null && turn.getContent() != null && seen.add(turn.getId())) {
                turns.add(turn);
            }
        }
        turns.sort(Comparator.comparingLong(Turn::getId));
        return turns;
    }

    private List<Turn> oldestRun(Predicate<Turn> pending, int limit) {
        List<Turn> run = new ArrayList<>();
        for (Turn turn : all()) {
            if (pending.test(turn)) {
                run.add(turn);
                if (limit > 0 && run.size() >= limit) {
                    break;
                }
            } else if (!run.isEmpty()) {
                break;
            }
        }
        return run;
    }

    private Turn parseTurn(String line) {
        try {
            return objectMapper.readValue(line, Turn.class);
        } catch (JsonProcessingException e) {
            log.warn("[TurnStore] Skipping malformed turn line: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static List<Turn> tail(List<Turn> turns, int limit) {
        if (limit <= 0 || turns.size() <= limit) {
            return turns;
        }
        return turns.subList(turns.size() - limit, turns.size());
    }

    private static int occurrences(String haystack, String needle) {
        if (needle.isEmpty()) {
            return 0;
        }
        int count = 0;
        int idx = haystack.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = haystack.indexOf(needle, idx + needle.length());
        }
        return count;
    }
}
