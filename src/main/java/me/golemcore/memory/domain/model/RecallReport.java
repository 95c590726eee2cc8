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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of an ambient recall: header lines, merged results and per-layer
 * status. {@link #getFormatted()} is the text handed to the agent.
 */
@Data
@Builder
public class RecallReport {

    private String context;
    private String clockLine;
    private String memoryHealthLine;

    @Builder.Default
    private List<RecallResult> results = new ArrayList<>();

    @Builder.Default
    private Map<String, LayerManifest> manifest = new LinkedHashMap<>();

    @Builder.Default
    private Map<RecallLayer, HealthStatus> layerStatus = new LinkedHashMap<>();

    private long unsummarizedCount;
    private long uningestedCount;
    private String formatted;
}
