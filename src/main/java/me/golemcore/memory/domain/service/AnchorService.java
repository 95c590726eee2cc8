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

import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.Anchor;
import me.golemcore.memory.domain.model.AnchorDeleteResult;
import me.golemcore.memory.domain.model.AnchorListing;
import me.golemcore.memory.domain.model.AnchorSaveResult;
import me.golemcore.memory.domain.model.AnchorStatus;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.RecallLayer;
import me.golemcore.memory.domain.model.RecallResult;
import me.golemcore.memory.domain.model.ResyncResult;
import me.golemcore.memory.domain.model.SemanticHit;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.SemanticIndexPort;
import me.golemcore.memory.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Curated markdown anchors ("word-photos") with a derived semantic index.
 *
 * <p>
 * Disk is the source of truth. Every anchor file {@code anchors/<stem>.md}
 * should have exactly one index entry with id {@code <stem>}. Save and delete
 * touch both sides; when the index cannot be updated the drift shows up in
 * {@link #list()} and is repaired by {@link #resync()}, which wipes the index
 * and rebuilds it from the files. Resync excludes concurrent save and delete.
 *
 * <p>
 * Search never fails: an unreachable embedding backend yields an empty result
 * and marks the layer degraded until the next successful index call.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AnchorService {

    private static final String EXTENSION = ".md";
    private static final String LOCATION = "location";

    private final StoragePort storagePort;
    private final SemanticIndexPort indexPort;
    private final Clock clock;
    private final String directory;

    private final ReadWriteLock resyncLock = new ReentrantReadWriteLock();
    private final AtomicReference<String> indexError = new AtomicReference<>();

    public AnchorService(StoragePort storagePort, SemanticIndexPort indexPort, Clock clock,
            MemoryProperties properties) {
        this.storagePort = storagePort;
        this.indexPort = indexPort;
        this.clock = clock;
        this.directory = properties.getAnchors().getDirectory();
    }

    /**
     * Write an anchor file and index it.
     *
     * @param location
     *            optional context tag (terminal, discord, ...), stored as front
     *            matter
     */
    public AnchorSaveResult save(String title, String content, String location) {
        if (title == null || title.isBlank()) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Anchor title is required");
        }
        if (content == null || content.isBlank()) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Anchor content is required");
        }

        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        String filename = today + "_" + safeTitle(title) + EXTENSION;
        String body = render(title, content, location);

        resyncLock.readLock().lock();
        try {
            AsyncResults.join(storagePort.putTextAtomic(directory, filename, body, false), "Write anchor");
            Anchor anchor = parse(filename, body);
            boolean indexed = index(anchor, body);
            log.info("[Anchors] Saved {} (indexed: {})", filename, indexed);
            return new AnchorSaveResult(anchor, indexed);
        } finally {
            resyncLock.readLock().unlock();
        }
    }

    public List<RecallResult> search(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        try {
            List<SemanticHit> hits = indexPort.search(query, limit);
            indexError.set(null);
            return hits.stream().map(this::toResult).toList();
        } catch (StorageUnavailableException e) {
            indexError.set(e.getMessage());
            log.warn("[Anchors] Search degraded: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Delete an anchor from disk and index. The outcome of each side is reported
     * separately, so an orphaned index entry can be removed even when the file
     * is already gone.
     */
    public AnchorDeleteResult delete(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Filename is required");
        }
        String normalized = filename.endsWith(EXTENSION) ? filename : filename + EXTENSION;

        resyncLock.readLock().lock();
        try {
            boolean fromDisk = AsyncResults.join(storagePort.deleteObject(directory, normalized), "Delete anchor");
            boolean fromIndex = indexPort.remove(Anchor.indexIdOf(normalized));
            log.info("[Anchors] Deleted {} (disk: {}, index: {})", normalized, fromDisk, fromIndex);
            return new AnchorDeleteResult(normalized, fromDisk, fromIndex);
        } finally {
            resyncLock.readLock().unlock();
        }
    }

    /**
     * Disk/index inventory. Entries only on one side indicate drift.
     */
    public AnchorListing list() {
        Set<String> onDisk = new TreeSet<>(diskFiles());
        Set<String> inIndex = new TreeSet<>();
        for (String id : indexPort.ids()) {
            inIndex.add(id + EXTENSION);
        }

        Set<String> all = new TreeSet<>(onDisk);
        all.addAll(inIndex);
        List<AnchorStatus> entries = new ArrayList<>();
        for (String filename : all) {
            entries.add(new AnchorStatus(filename, inIndex.contains(filename), onDisk.contains(filename)));
        }
        boolean synced = entries.stream().allMatch(AnchorStatus::isSynced);
        if (!synced) {
            log.debug("[Anchors] {} drift: {} on disk, {} in index", ErrorKind.SYNC_DRIFT, onDisk.size(),
                    inIndex.size());
        }
        return AnchorListing.builder()
                .entries(entries)
                .diskCount(onDisk.size())
                .indexCount(inIndex.size())
                .synced(synced)
                .indexAvailable(indexPort.isAvailable() && indexError.get() == null)
                .build();
    }

    /**
     * Wipe the index and rebuild it from the anchor files. Idempotent.
     *
     * @throws StorageUnavailableException
     *             if the embedding backend fails; the index is left empty and
     *             a later resync completes the rebuild
     */
    public ResyncResult resync() {
        resyncLock.writeLock().lock();
        try {
            int previous = indexPort.count();
            indexPort.clear();

            Map<String, String> contentById = new LinkedHashMap<>();
            Map<String, Map<String, String>> metadataById = new LinkedHashMap<>();
            List<String> files = diskFiles();
            for (String filename : files) {
                String body = AsyncResults.join(storagePort.getText(directory, filename), "Read anchor");
                if (body == null) {
                    continue;
                }
                Anchor anchor = parse(filename, body);
                contentById.put(anchor.getIndexId(), body);
                metadataById.put(anchor.getIndexId(), metadata(anchor, body));
            }

            try {
                indexPort.upsertAll(contentById, metadataById);
                indexError.set(null);
            } catch (StorageUnavailableException e) {
                indexError.set(e.getMessage());
                throw e;
            }
            log.info("[Anchors] Resync complete: {} files indexed (index had {})", contentById.size(), previous);
            return new ResyncResult(files.size(), contentById.size(), previous);
        } finally {
            resyncLock.writeLock().unlock();
        }
    }

    /**
     * All anchors on disk, newest first.
     */
    public List<Anchor> readAll() {
        List<Anchor> anchors = new ArrayList<>();
        for (String filename : diskFiles()) {
            String body = AsyncResults.join(storagePort.getText(directory, filename), "Read anchor");
            if (body != null) {
                anchors.add(parse(filename, body));
            }
        }
        anchors.sort(Comparator.comparing(Anchor::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(Anchor::getFilename, Comparator.reverseOrder()));
        return anchors;
    }

    public List<Anchor> newest(int count) {
        List<Anchor> all = readAll();
        return all.size() <= count ? all : all.subList(0, count);
    }

    public boolean isIndexDegraded() {
        return !indexPort.isAvailable() || indexError.get() != null;
    }

    public ComponentHealth health() {
        AnchorListing listing = list();
        ComponentHealth health;
        if (!indexPort.isAvailable() || indexError.get() != null) {
            String reason = indexError.get() != null ? indexError.get() : "embedding backend not configured";
            health = ComponentHealth.degraded(RecallLayer.ANCHORS.getKey(),
                    "Index unavailable, " + listing.getDiskCount() + " files on disk: " + reason);
        } else if (!listing.isSynced()) {
            health = ComponentHealth.degraded(RecallLayer.ANCHORS.getKey(),
                    "Disk/index drift (" + listing.getDiskCount() + " files, " + listing.getIndexCount()
                            + " indexed); run resync");
        } else {
            health = ComponentHealth.healthy(RecallLayer.ANCHORS.getKey(),
                    listing.getDiskCount() + " anchors, index in sync");
        }
        return health.withCount("files", listing.getDiskCount())
                .withCount("indexed", listing.getIndexCount())
                .withCount("synced", listing.isSynced());
    }

    // ===== Internals =====

    private boolean index(Anchor anchor, String body) {
        try {
            indexPort.upsert(anchor.getIndexId(), body, metadata(anchor, body));
            indexError.set(null);
            return true;
        } catch (StorageUnavailableException e) {
            indexError.set(e.getMessage());
            log.warn("[Anchors] {} written to disk but not indexed: {}", anchor.getFilename(), e.getMessage());
            return false;
        }
    }

    private List<String> diskFiles() {
        return AsyncResults.join(storagePort.listObjects(directory, null), "List anchors").stream()
                .filter(f -> f.endsWith(EXTENSION) && !f.contains("/"))
                .toList();
    }

    private RecallResult toResult(SemanticHit hit) {
        Map<String, Object> metadata = new LinkedHashMap<>(hit.metadata());
        return RecallResult.builder()
                .layer(RecallLayer.ANCHORS)
                .source(hit.id() + EXTENSION)
                .content(hit.content())
                .score(Math.max(0.0, Math.min(1.0, hit.score())))
                .metadata(metadata)
                .build();
    }

    private static Map<String, String> metadata(Anchor anchor, String body) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("filename", anchor.getFilename());
        metadata.put("title", anchor.getTitle());
        metadata.put("location", anchor.getLocation() != null ? anchor.getLocation() : "unknown");
        metadata.put("content_hash", sha256(body));
        return metadata;
    }

    static String safeTitle(String title) {
        StringBuilder sb = new StringBuilder();
        for (char c : title.toLowerCase(Locale.ROOT).toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' ? c : '_');
        }
        return sb.toString();
    }

    private static String render(String title, String content, String location) {
        if (FrontMatter.present(content)) {
            return content;
        }
        String loc = location != null && !location.isBlank() ? location : "unknown";
        String body = content.stripLeading().startsWith("#") ? content : "# " + title + "\n\n" + content;
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(LOCATION, loc);
        return FrontMatter.render(fields, body);
    }

    static Anchor parse(String filename, String text) {
        FrontMatter.Document document = FrontMatter.parse(text, filename);
        String rest = document.body();

        String title = Anchor.indexIdOf(filename);
        for (String line : rest.split("\n")) {
            if (line.startsWith("# ")) {
                title = line.substring(2).trim();
                break;
            }
        }

        return Anchor.builder()
                .filename(filename)
                .title(title)
                .content(rest)
                .location(document.string(LOCATION))
                .createdAt(dateOf(filename))
                .build();
    }

    private static Instant dateOf(String filename) {
        if (filename.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(filename.substring(0, 10)).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
