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

import me.golemcore.memory.domain.model.Crystal;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File layout of the crystal chain: {@code crystals/current/crystal_NNN.md}
 * for the window and {@code crystals/archive/} for the tail. Each file is
 * markdown with a front matter block carrying the chain metadata.
 */
@Component
@Slf4j
public class CrystalChainStore {

    private static final Pattern FILE_PATTERN = Pattern.compile("crystal_(\\d+)\\.md");

    private final StoragePort storagePort;
    private final String currentDir;
    private final String archiveDir;

    public CrystalChainStore(StoragePort storagePort, MemoryProperties properties) {
        this.storagePort = storagePort;
        String base = properties.getCrystallization().getDirectory();
        this.currentDir = base + "/current";
        this.archiveDir = base + "/archive";
    }

    /**
     * Current window, oldest first.
     */
    public List<Crystal> current() {
        return read(currentDir, false);
    }

    /**
     * Archived tail, oldest first.
     */
    public List<Crystal> archived() {
        return read(archiveDir, true);
    }

    public Optional<Crystal> latest() {
        List<Crystal> current = current();
        return current.isEmpty() ? Optional.empty() : Optional.of(current.get(current.size() - 1));
    }

    /**
     * Next sequence number: one past the newest crystal in either directory.
     */
    public int nextSequence() {
        int max = 0;
        for (String dir : List.of(currentDir, archiveDir)) {
            for (String file : list(dir)) {
                Matcher matcher = FILE_PATTERN.matcher(file);
                if (matcher.matches()) {
                    max = Math.max(max, Integer.parseInt(matcher.group(1)));
                }
            }
        }
        return max + 1;
    }

    public void write(Crystal crystal) {
        AsyncResults.join(storagePort.putTextAtomic(currentDir, crystal.getFilename(), render(crystal), false),
                "Write crystal");
    }

    public void archive(Crystal crystal) {
        AsyncResults.join(storagePort.moveObject(currentDir, crystal.getFilename(), archiveDir, crystal.getFilename()),
                "Archive crystal");
        log.info("[Crystals] Archived {}", crystal.getFilename());
    }

    public void deleteCurrent(Crystal crystal) {
        AsyncResults.join(storagePort.deleteObject(currentDir, crystal.getFilename()), "Delete crystal");
    }

    public static String filenameFor(int sequence) {
        return String.format("crystal_%03d.md", sequence);
    }

    // ===== Format =====

    static String render(Crystal crystal) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("sequence", crystal.getSequence());
        fields.put("timespan_start", instantText(crystal.getTimespanStart()));
        fields.put("timespan_end", instantText(crystal.getTimespanEnd()));
        fields.put("token_estimate", crystal.getTokenEstimate());
        fields.put("through_turn_id", crystal.getThroughTurnId());
        fields.put("created_at", instantText(crystal.getCreatedAt()));
        return FrontMatter.render(fields, crystal.getContent().strip() + "\n");
    }

    static Crystal parse(String filename, String text, boolean archived) {
        Crystal.CrystalBuilder builder = Crystal.builder().filename(filename).archived(archived);
        Matcher matcher = FILE_PATTERN.matcher(filename);
        if (matcher.matches()) {
            builder.sequence(Integer.parseInt(matcher.group(1)));
        }

        FrontMatter.Document document = FrontMatter.parse(text, filename);
        for (Map.Entry<String, Object> field : document.fields().entrySet()) {
            applyField(builder, field.getKey(), String.valueOf(field.getValue()));
        }
        String content = document.body();
        builder.content(content);
        Crystal crystal = builder.build();
        if (crystal.getTokenEstimate() == 0) {
            crystal.setTokenEstimate(content.length() / 4);
        }
        return crystal;
    }

    private static void applyField(Crystal.CrystalBuilder builder, String key, String value) {
        try {
            switch (key) {
            case "sequence" -> builder.sequence(Integer.parseInt(value));
            case "timespan_start" -> builder.timespanStart(Instant.parse(value));
            case "timespan_end" -> builder.timespanEnd(Instant.parse(value));
            case "token_estimate" -> builder.tokenEstimate(Integer.parseInt(value));
            case "through_turn_id" -> builder.throughTurnId(Long.parseLong(value));
            case "created_at" -> builder.createdAt(Instant.parse(value));
            default -> {
                // unknown keys are kept in the file only
            }
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("[Crystals] Ignoring bad front matter field {}: {}", key, value);
        }
    }

    private static String instantText(Instant value) {
        return value != null ? value.toString() : null;
    }

    private List<Crystal> read(String dir, boolean archived) {
        List<Crystal> crystals = new ArrayList<>();
        for (String file : list(dir)) {
            if (!FILE_PATTERN.matcher(file).matches()) {
                continue;
            }
            String text = AsyncResults.join(storagePort.getText(dir, file), "Read crystal");
            if (text != null) {
                crystals.add(parse(file, text, archived));
            }
        }
        crystals.sort(Comparator.comparingInt(Crystal::getSequence));
        return crystals;
    }

    private List<String> list(String dir) {
        return AsyncResults.join(storagePort.listObjects(dir, null), "List crystals").stream()
                .filter(f -> !f.contains("/"))
                .toList();
    }
}
