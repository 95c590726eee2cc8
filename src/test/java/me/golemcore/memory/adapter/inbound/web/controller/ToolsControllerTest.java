package me.golemcore.memory.adapter.inbound.web.controller;

import me.golemcore.memory.domain.component.ToolComponent;
import me.golemcore.memory.domain.model.ComponentHealth;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.HealthStatus;
import me.golemcore.memory.domain.model.SubstrateHealth;
import me.golemcore.memory.domain.model.ToolDefinition;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.HealthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ToolsControllerTest {

    private ToolComponent turns;
    private ToolComponent texture;
    private HealthService healthService;
    private ToolsController controller;

    @BeforeEach
    void setUp() {
        turns = tool("turns", true);
        texture = tool("texture", false);
        healthService = mock(HealthService.class);
        controller = new ToolsController(List.of(turns, texture), healthService);
    }

    @Test
    void shouldListOnlyEnabledTools() {
        StepVerifier.create(controller.listTools())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(List.of("turns"),
                            response.getBody().stream().map(ToolDefinition::getName).toList());
                })
                .verifyComplete();
    }

    @Test
    void shouldExecuteTool() {
        when(turns.execute(Map.of("operation", "turn_append", "content", "hi")))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("Stored turn 1")));

        StepVerifier.create(controller.execute("turns", Map.of("operation", "turn_append", "content", "hi")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("Stored turn 1", response.getBody().getOutput());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapFailureKindToStatus() {
        when(turns.execute(Map.of())).thenReturn(CompletableFuture.completedFuture(
                ToolResult.failure(ErrorKind.LOCK_CONTENDED, "busy")));

        StepVerifier.create(controller.execute("turns", null))
                .assertNext(response -> assertEquals(HttpStatus.LOCKED, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownTool() {
        StepVerifier.create(controller.execute("nope", Map.of()))
                .expectErrorMatches(e -> e instanceof ResponseStatusException rse
                        && HttpStatus.NOT_FOUND.equals(rse.getStatusCode()))
                .verify();
    }

    @Test
    void shouldReturnServiceUnavailableWhenCritical() {
        when(healthService.check()).thenReturn(new SubstrateHealth(HealthStatus.CRITICAL,
                List.of(ComponentHealth.critical("turn_store", "malformed lines")), Instant.EPOCH));

        StepVerifier.create(controller.health())
                .assertNext(response -> assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldReturnOkWhenDegraded() {
        when(healthService.check()).thenReturn(new SubstrateHealth(HealthStatus.DEGRADED, List.of(),
                Instant.EPOCH));

        StepVerifier.create(controller.health())
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();
    }

    private static ToolComponent tool(String name, boolean enabled) {
        ToolComponent tool = mock(ToolComponent.class);
        ToolDefinition definition = ToolDefinition.builder().name(name).build();
        when(tool.getDefinition()).thenReturn(definition);
        when(tool.getToolName()).thenReturn(name);
        when(tool.isEnabled()).thenReturn(enabled);
        return tool;
    }
}
