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
 * Persisted marker covering an inclusive turn-id range. Marks are appended to
 * the turn store's mark log and overlaid on turns when they are read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RangeMark {

    public enum Type {
        SUMMARIZED, GRAPH_INGESTED
    }

    private Type type;
    private long startId;
    private long endId;
    private String refId;
    private Instant markedAt;

    public boolean covers(long turnId) {
        return turnId >= startId && turnId <= endId;
    }

    public boolean overlaps(long start, long end) {
        return start <= endId && end >= startId;
    }
}
