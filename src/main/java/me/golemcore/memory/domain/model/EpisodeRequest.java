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
 * Episode submitted for extraction. {@code speaker} is the attributed author,
 * {@code roleType} is the conversational role ("user" or "assistant").
 */
@Data
@Builder
public class EpisodeRequest {

    private String content;
    private String speaker;

    @Builder.Default
    private String roleType = "user";

    private String channel;
    private Instant referenceTime;
    private String namespace;

    @Builder.Default
    private List<EntityType> entityTypes = new ArrayList<>(List.of(EntityType.values()));

    private String extractionInstructions;
}
