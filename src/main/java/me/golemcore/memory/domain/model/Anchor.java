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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Curated markdown memory ("word-photo") stored on disk and mirrored into the
 * semantic index under {@link #getIndexId()}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Anchor {

    private String filename;
    private String title;
    private String content;
    private String location;
    private Instant createdAt;

    /**
     * Index id is the file name without the markdown extension.
     */
    public String getIndexId() {
        return indexIdOf(filename);
    }

    public static String indexIdOf(String filename) {
        if (filename == null) {
            return null;
        }
        return filename.endsWith(".md") ? filename.substring(0, filename.length() - 3) : filename;
    }
}
