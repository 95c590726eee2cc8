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
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mid-tier summary of a contiguous turn range. A summary produced by the
 * summarizer has no id until it is stored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Summary {

    private String id;
    private long startTurnId;
    private long endTurnId;
    private int messageCount;

    @Builder.Default
    private Set<String> channels = new LinkedHashSet<>();

    private SummaryKind kind;
    private String text;
    private Instant timeSpanStart;
    private Instant timeSpanEnd;
    private Instant createdAt;

    public boolean overlaps(long start, long end) {
        return start <= endTurnId && end >= startTurnId;
    }
}
