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
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One graph ingestion pass over a contiguous turn range. The batch id is
 * derived from the range, so the same range always maps to the same batch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionBatch {

    private String batchId;
    private long startTurnId;
    private long endTurnId;

    @Builder.Default
    private Set<String> channels = new LinkedHashSet<>();

    private int ingestedCount;
    private int failedCount;
    private boolean completed;
    private Instant completedAt;

    public static IngestionBatch empty() {
        return IngestionBatch.builder().completed(false).build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return batchId == null;
    }
}
