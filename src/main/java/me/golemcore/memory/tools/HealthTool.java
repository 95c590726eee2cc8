package me.golemcore.memory.tools;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.memory.domain.component.ToolComponent;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.SubstrateHealth;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.HealthService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class HealthTool implements ToolComponent {

    public static final String TOOL_NAME = "pps_health";

    private final HealthService healthService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Health of every memory component: healthy, degraded or critical, with counts.")
                .inputSchema(ToolSupport.schema(Map.of(), List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        try {
            SubstrateHealth health = healthService.check();
            StringBuilder sb = new StringBuilder("Overall: ").append(health.overall()).append('\n');
            for (ComponentHealth component : health.components()) {
                sb.append("- ").append(component.getComponent()).append(": ").append(component.getStatus())
                        .append(" - ").append(component.getMessage()).append('\n');
            }
            return CompletableFuture.completedFuture(ToolResult.success(sb.toString().trim(), health));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ToolSupport.failure("Health", TOOL_NAME, e));
        }
    }
}
