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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One captured conversational message. Identity, channel, author, content and
 * timestamp never change after append; the summary and ingestion fields are
 * derived from range marks when the turn is read back.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Turn {

    private long id;
    private String channel;
    private String author;
    private String content;
    private Instant createdAt;

    @JsonIgnore
    private String summaryId;

    @JsonIgnore
    private boolean ingestedToGraph;

    @JsonIgnore
    private String ingestionBatchId;

    @JsonIgnore
    public boolean isSummarized() {
        return summaryId != null;
    }
}
