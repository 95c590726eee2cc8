package me.golemcore.memory.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.adapter.outbound.lock.FileLockAdapter;
import me.golemcore.memory.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.memory.domain.service.CooperativeLockService;
import me.golemcore.memory.domain.service.TurnStoreService;
import me.golemcore.memory.infrastructure.config.AutoConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.infrastructure.event.SpringEventBus;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.mock;

/**
 * Real file-backed workspace under a temporary directory: storage, locks and
 * the turn store wired the way the application wires them.
 */
public final class TestWorkspace {

    public static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private final MemoryProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final LocalStorageAdapter storage;
    private final CooperativeLockService lockService;
    private final SpringEventBus eventBus;

    public TestWorkspace(Path root) {
        this(root, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    public TestWorkspace(Path root, Clock clock) {
        this.properties = new MemoryProperties();
        properties.getStorage().setBasePath(root.toString());
        properties.getLock().setMaxAttempts(2);
        properties.getLock().setBackoffMs(1);
        properties.getScheduler().setEnabled(false);
        this.clock = clock;
        this.objectMapper = AutoConfiguration.objectMapper();
        this.storage = new LocalStorageAdapter(properties);
        storage.init();
        this.lockService = new CooperativeLockService(new FileLockAdapter(properties, objectMapper, clock),
                properties);
        this.eventBus = mock(SpringEventBus.class);
    }

    public TurnStoreService newTurnStore() {
        return new TurnStoreService(storage, lockService, eventBus, objectMapper, clock, properties);
    }

    public MemoryProperties properties() {
        return properties;
    }

    public Clock clock() {
        return clock;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public LocalStorageAdapter storage() {
        return storage;
    }

    public CooperativeLockService lockService() {
        return lockService;
    }

    public SpringEventBus eventBus() {
        return eventBus;
    }
}
