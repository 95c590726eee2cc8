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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Independently reported status of one substrate component.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ComponentHealth {

    private String component;
    private HealthStatus status;
    private String message;

    @Builder.Default
    private Map<String, Object> counts = new LinkedHashMap<>();

    public static ComponentHealth healthy(String component, String message) {
        return ComponentHealth.builder().component(component).status(HealthStatus.HEALTHY).message(message).build();
    }

    public static ComponentHealth degraded(String component, String message) {
        return ComponentHealth.builder().component(component).status(HealthStatus.DEGRADED).message(message).build();
    }

    public static ComponentHealth critical(String component, String message) {
        return ComponentHealth.builder().component(component).status(HealthStatus.CRITICAL).message(message).build();
    }

    public ComponentHealth withCount(String key, Object value) {
        counts.put(key, value);
        return this;
    }
}
