package me.golemcore.memory;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore memory substrate.
 *
 * <p>
 * The substrate keeps a conversational agent's memory across process restarts
 * and context-window limits. It is organized in layers:
 * <ul>
 * <li><b>Turn Store</b> - append-only log of every captured turn</li>
 * <li><b>Anchors</b> - curated markdown word-photos mirrored into a semantic
 * index</li>
 * <li><b>Texture</b> - knowledge graph ingestion, search and curation</li>
 * <li><b>Summaries</b> - mid-tier compression of turn ranges</li>
 * <li><b>Crystals</b> - rolling chain of dense continuity artifacts</li>
 * <li><b>Ambient Recall</b> - one query surface across all layers</li>
 * </ul>
 *
 * <p>
 * Configuration is bound from {@code application.yml} under the
 * {@code memory.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryApplication.class, args);
    }
}
