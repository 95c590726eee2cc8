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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one curation pass.
 */
@Data
@Builder
public class CurationReport {

    private String namespace;
    private boolean deep;
    private boolean autoDelete;
    private int queriesRun;
    private int factsSampled;
    private int uniqueFacts;
    private int duplicates;
    private int vagueEntities;
    private int ambiguous;
    private int deleted;
    private int failed;
    private boolean interrupted;
    private Instant startedAt;
    private Instant finishedAt;

    @Builder.Default
    private List<CurationCandidate> candidates = new ArrayList<>();

    @Builder.Default
    private List<String> deletedUuids = new ArrayList<>();
}
