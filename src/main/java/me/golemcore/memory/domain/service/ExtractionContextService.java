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
import me.golemcore.memory.domain.model.EdgeTypes;
import me.golemcore.memory.domain.model.EntityType;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Composes per-call extraction guidance for graph ingestion.
 *
 * <p>
 * Sections are assembled in a fixed order from named inputs only:
 * <ol>
 * <li>primary-entity resolution hint</li>
 * <li>base context (entity and edge schema, guidelines, optional workspace
 * {@code scene/base_context.md})</li>
 * <li>channel overlay (discord, terminal or reflection)</li>
 * <li>current scene ({@code scene/current_scene.md})</li>
 * <li>most recent crystal, truncated</li>
 * <li>additional hints from the caller</li>
 * </ol>
 * Identical inputs always produce identical text.
 */
@Service
@Slf4j
public class ExtractionContextService {

    static final String SCENE_FILE = "current_scene.md";
    static final String BASE_CONTEXT_FILE = "base_context.md";

    private static final String RESOLUTION_TEMPLATE = """
            ## Primary Entity Resolution

            **%1$s** is the primary entity whose memory this graph represents.
            There is only one %1$s in this dataset; never create a duplicate.

            - "%1$s", "%2$s", "I" when %1$s speaks and "me" referring to %1$s all resolve to the same entity
            - If an existing "%1$s" node is present, reuse it
            """;

    private static final String GUIDELINES = """
            ## Extraction Guidelines

            1. Attribute every statement to its speaker.
            2. Link technical artifacts to the people working on them.
            3. Capture relational dynamics in emotional moments, not only facts.
            4. Prefer recurring patterns over one-off mentions.
            5. Edge endpoints must reference entities from the extracted entity list.
            """;

    private static final String DISCORD_OVERLAY = """
            ## Discord Channel Context

            Casual, relational conversation. Focus on emotional dynamics and how they shift,
            moments of connection, sensory details that anchor the scene, recurring jokes
            and how topics flow into one another.
            """;

    private static final String TERMINAL_OVERLAY = """
            ## Terminal Channel Context

            Technical work. Focus on which files change and why, bugs and their root causes,
            architectural decisions with their rationale, who makes which change, and lessons learned.
            Track how understanding evolves over the session.
            """;

    private static final String REFLECTION_OVERLAY = """
            ## Reflection Channel Context

            Autonomous self-observation. Focus on self-insights, memory maintenance,
            patterns noticed in own behavior, decisions made without prompting, and growth.
            """;

    private final StoragePort storagePort;
    private final CrystalChainStore crystalChainStore;
    private final MemoryProperties properties;

    public ExtractionContextService(StoragePort storagePort, CrystalChainStore crystalChainStore,
            MemoryProperties properties) {
        this.storagePort = storagePort;
        this.crystalChainStore = crystalChainStore;
        this.properties = properties;
    }

    /**
     * Named inputs for one composition. Null sections are omitted.
     */
    public record Inputs(String entityName, String channel, String baseContextExtra, String scene,
            String crystal, String hints) {
    }

    /**
     * Build guidance for a channel using the workspace scene and the latest
     * crystal.
     */
    public String forChannel(String channel, String hints) {
        return compose(gatherInputs(channel, hints));
    }

    public Inputs gatherInputs(String channel, String hints) {
        String sceneDir = properties.getGraph().getSceneDirectory();
        String scene = readOptional(sceneDir, SCENE_FILE);
        String baseExtra = readOptional(sceneDir, BASE_CONTEXT_FILE);
        String crystal = latestCrystalExcerpt().orElse(null);
        return new Inputs(entityName(), channel, baseExtra, scene, crystal, hints);
    }

    /**
     * Deterministic composition of the given inputs.
     */
    public String compose(Inputs inputs) {
        List<String> parts = new ArrayList<>();
        String entity = inputs.entityName() != null ? inputs.entityName() : entityName();
        parts.add(String.format(RESOLUTION_TEMPLATE, entity, entity.toLowerCase(Locale.ROOT)));
        parts.add(baseContext(inputs.baseContextExtra()));

        channelOverlay(inputs.channel()).ifPresent(parts::add);

        if (hasText(inputs.scene())) {
            parts.add("## Current Scene Context\n\n" + inputs.scene().strip()
                    + "\n\nUse this to ground extraction in the current moment.\n");
        }
        if (hasText(inputs.crystal())) {
            parts.add("## Recent Crystal (Temporal Context)\n\n" + inputs.crystal().strip()
                    + "\n\nWeight extraction toward these themes.\n");
        }
        if (hasText(inputs.hints())) {
            parts.add("## Additional Guidance\n\n" + inputs.hints().strip() + "\n");
        }
        return String.join("\n", parts);
    }

    /**
     * Speaker of a {@code Name: message} line, or a channel-based default.
     */
    public String speakerOf(String content, String channel) {
        if (content != null) {
            int idx = content.indexOf(": ");
            if (idx > 0 && idx < 50) {
                String candidate = content.substring(0, idx);
                if (candidate.replace(" ", "").chars().allMatch(Character::isLetterOrDigit)) {
                    return candidate;
                }
            }
        }
        String ch = channel != null ? channel.toLowerCase(Locale.ROOT) : "";
        if (ch.contains("discord")) {
            return "discord_user";
        }
        if (ch.contains("terminal")) {
            return properties.getGraph().getTerminalSpeaker();
        }
        if (ch.contains("reflection")) {
            return entityName();
        }
        return "unknown";
    }

    public String entityName() {
        String owner = properties.getOwner();
        if (owner == null || owner.isBlank()) {
            return "Entity";
        }
        return owner.substring(0, 1).toUpperCase(Locale.ROOT) + owner.substring(1);
    }

    private static Optional<String> channelOverlay(String channel) {
        if (channel == null) {
            return Optional.empty();
        }
        String ch = channel.toLowerCase(Locale.ROOT);
        if (ch.contains("discord")) {
            return Optional.of(DISCORD_OVERLAY);
        }
        if (ch.contains("terminal")) {
            return Optional.of(TERMINAL_OVERLAY);
        }
        if (ch.contains("reflection")) {
            return Optional.of(REFLECTION_OVERLAY);
        }
        return Optional.empty();
    }

    private static String baseContext(String extra) {
        StringBuilder sb = new StringBuilder("## Entity Types\n\n");
        for (EntityType type : EntityType.values()) {
            sb.append("- **").append(type.getTypeName()).append("**: ").append(type.getDescription()).append('\n');
        }
        sb.append("\n## Relationship Types\n\n");
        for (Map.Entry<String, List<String>> entry : EdgeTypes.asMap().entrySet()) {
            sb.append("- ").append(entry.getKey()).append(": ").append(String.join(", ", entry.getValue()))
                    .append('\n');
        }
        sb.append('\n').append(GUIDELINES);
        if (hasText(extra)) {
            sb.append('\n').append(extra.strip()).append('\n');
        }
        return sb.toString();
    }

    private Optional<String> latestCrystalExcerpt() {
        try {
            Optional<Crystal> latest = crystalChainStore.latest();
            int max = properties.getGraph().getCrystalContextChars();
            return latest.map(c -> c.getContent().length() > max ? c.getContent().substring(0, max) : c.getContent());
        } catch (RuntimeException e) {
            log.warn("[Graph] Could not load crystal context: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String readOptional(String directory, String file) {
        try {
            return storagePort.getText(directory, file).join();
        } catch (RuntimeException e) {
            log.warn("[Graph] Could not read {}/{}: {}", directory, file, e.getMessage());
            return null;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
