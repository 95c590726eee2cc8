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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of scanning the turn log for corruption.
 */
@Data
@Builder
public class TurnIntegrityReport {

    private int totalLines;
    private int validTurns;
    private long lastId;

    @Builder.Default
    private List<Integer> malformedLines = new ArrayList<>();

    @Builder.Default
    private List<Long> duplicateIds = new ArrayList<>();

    @Builder.Default
    private List<Long> nonMonotonicIds = new ArrayList<>();

    public boolean isHealthy() {
        return malformedLines.isEmpty() && duplicateIds.isEmpty() && nonMonotonicIds.isEmpty();
    }
}
