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

/**
 * Filter for turn store queries. All criteria are optional and combined with
 * AND; {@code text} is a case-insensitive substring match over content.
 */
@Data
@Builder
public class TurnQuery {

    private String channel;
    private String author;
    private Instant from;
    private Instant until;
    private String text;

    @Builder.Default
    private int limit = 0;

    public static TurnQuery all() {
        return TurnQuery.builder().build();
    }
}
