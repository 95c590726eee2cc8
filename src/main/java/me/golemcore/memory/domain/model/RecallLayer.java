package me.golemcore.memory.domain.model;

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

/**
 * Retrieval layers fanned out by ambient recall. The key is the label used in
 * manifests and tool output.
 */
public enum RecallLayer {

    CRYSTALS("crystals"),
    ANCHORS("word_photos"),
    GRAPH("rich_texture"),
    SUMMARIES("summaries"),
    RAW_TURNS("recent_turns");

    private final String key;

    RecallLayer(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
