package me.golemcore.memory.adapter.inbound.web.controller;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.adapter.inbound.web.ErrorStatusMapper;
import me.golemcore.memory.domain.component.ToolComponent;
import me.golemcore.memory.domain.model.HealthStatus;
import me.golemcore.memory.domain.model.SubstrateHealth;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.HealthService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP transport over the tool surface.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class ToolsController {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final HealthService healthService;

    public ToolsController(List<ToolComponent> toolComponents, HealthService healthService) {
        for (ToolComponent tool : toolComponents) {
            tools.put(tool.getToolName(), tool);
        }
        this.healthService = healthService;
        log.info("[API] Registered tools: {}", tools.keySet());
    }

    @GetMapping("/tools")
    public Mono<ResponseEntity<List<ToolDefinition>>> listTools() {
        List<ToolDefinition> definitions = tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
        return Mono.just(ResponseEntity.ok(definitions));
    }

    @PostMapping("/tools/{tool}")
    public Mono<ResponseEntity<ToolResult>> execute(@PathVariable("tool") String toolName,
            @RequestBody(required = false) Map<String, Object> parameters) {
        ToolComponent tool = tools.get(toolName);
        if (tool == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown tool: " + toolName));
        }
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        return Mono.fromFuture(() -> tool.execute(params))
                .map(result -> ResponseEntity
                        .status(result.isSuccess() ? HttpStatus.OK : ErrorStatusMapper.statusOf(result.getErrorKind()))
                        .body(result));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<SubstrateHealth>> health() {
        return Mono.fromCallable(healthService::check)
                .map(health -> ResponseEntity
                        .status(health.overall() == HealthStatus.CRITICAL ? HttpStatus.SERVICE_UNAVAILABLE
                                : HttpStatus.OK)
                        .body(health));
    }
}
