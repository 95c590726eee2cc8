package me.golemcore.memory.adapter.outbound.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LockPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class FileLockAdapterTest {

    private static final String LOCK = "crystallization-entity";

    @TempDir
    Path tempDir;

    private FileLockAdapter adapter;

    @BeforeEach
    void setUp() {
        MemoryProperties properties = new MemoryProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        adapter = new FileLockAdapter(properties, new ObjectMapper(),
                Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldGrantLockOnlyOnceUntilReleased() {
        Optional<LockPort.LockHandle> first = adapter.tryAcquire(LOCK, "holder-1");
        assertTrue(first.isPresent());
        assertTrue(adapter.isLocked(LOCK));

        assertTrue(adapter.tryAcquire(LOCK, "holder-2").isEmpty());

        first.get().close();
        assertFalse(adapter.isLocked(LOCK));

        Optional<LockPort.LockHandle> again = adapter.tryAcquire(LOCK, "holder-2");
        assertTrue(again.isPresent());
        again.get().close();
    }

    @Test
    void shouldKeepDifferentNamesIndependent() {
        Optional<LockPort.LockHandle> crystals = adapter.tryAcquire(LOCK, "a");
        Optional<LockPort.LockHandle> turns = adapter.tryAcquire("turns-entity", "b");

        assertTrue(crystals.isPresent());
        assertTrue(turns.isPresent());

        crystals.get().close();
        turns.get().close();
    }

    @Test
    void shouldRecordHolderInLockFile() throws IOException {
        Optional<LockPort.LockHandle> handle = adapter.tryAcquire(LOCK, "pid-42/main");
        assertTrue(handle.isPresent());

        String content = Files.readString(tempDir.resolve("locks").resolve(LOCK + ".lock"));
        assertTrue(content.contains("pid-42/main"));
        assertTrue(content.contains("2026-01-01T12:00:00Z"));

        handle.get().close();
    }

    @Test
    void shouldReportUnknownLockAsFree() {
        assertFalse(adapter.isLocked("never-created"));
    }

    @Test
    void shouldBlockQueuedAcquireUntilHolderReleases() throws Exception {
        LockPort.LockHandle first = adapter.acquire(LOCK, "holder-1");

        CompletableFuture<LockPort.LockHandle> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return adapter.acquire(LOCK, "holder-2");
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        assertThrows(TimeoutException.class, () -> waiting.get(200, TimeUnit.MILLISECONDS));
        assertTrue(adapter.tryAcquire(LOCK, "holder-3").isEmpty());

        first.close();
        LockPort.LockHandle second = waiting.get(5, TimeUnit.SECONDS);
        assertTrue(adapter.isLocked(LOCK));
        second.close();
        assertFalse(adapter.isLocked(LOCK));
    }

    @Test
    void shouldTolerateDoubleRelease() {
        LockPort.LockHandle handle = adapter.tryAcquire(LOCK, "holder-1").orElseThrow();
        handle.close();
        handle.close();

        Optional<LockPort.LockHandle> again = adapter.tryAcquire(LOCK, "holder-2");
        assertTrue(again.isPresent());
        assertTrue(adapter.tryAcquire(LOCK, "holder-3").isEmpty());
        again.get().close();
    }
}
