package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.LockContendedException;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LockPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CooperativeLockServiceTest {

    private LockPort lockPort;
    private LockPort.LockHandle handle;
    private CooperativeLockService service;

    @BeforeEach
    void setUp() {
        lockPort = mock(LockPort.class);
        handle = mock(LockPort.LockHandle.class);
        MemoryProperties properties = new MemoryProperties();
        properties.setOwner("nova");
        properties.getLock().setMaxAttempts(3);
        properties.getLock().setBackoffMs(1);
        service = new CooperativeLockService(lockPort, properties);
    }

    @Test
    void shouldNameLocksPerOwner() {
        assertEquals("crystallization-nova", service.lockName("crystallization"));
    }

    @Test
    void shouldRunWorkAndReleaseHandle() {
        when(lockPort.tryAcquire(eq("turns-nova"), anyString())).thenReturn(Optional.of(handle));

        String result = service.runExclusive("turns-nova", () -> "done");

        assertEquals("done", result);
        verify(handle).close();
    }

    @Test
    void shouldRetryUntilLockIsFree() {
        when(lockPort.tryAcquire(eq("turns-nova"), anyString()))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(handle));

        assertEquals(7, service.runExclusive("turns-nova", () -> 7));
        verify(lockPort, times(2)).tryAcquire(eq("turns-nova"), anyString());
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        when(lockPort.tryAcquire(anyString(), anyString())).thenReturn(Optional.empty());

        LockContendedException thrown = assertThrows(LockContendedException.class,
                () -> service.runExclusive("turns-nova", () -> "never"));

        assertTrue(thrown.isRetryable());
        verify(lockPort, times(3)).tryAcquire(eq("turns-nova"), anyString());
    }

    @Test
    void shouldReleaseHandleWhenWorkFails() {
        when(lockPort.tryAcquire(anyString(), anyString())).thenReturn(Optional.of(handle));

        assertThrows(IllegalStateException.class, () -> service.runExclusive("turns-nova", (Runnable) () -> {
            throw new IllegalStateException("boom");
        }));
        verify(handle).close();
    }

    @Test
    void shouldWaitForQueuedLockInsteadOfGivingUp() throws InterruptedException {
        when(lockPort.acquire(eq("turns-nova"), anyString())).thenReturn(handle);

        assertEquals("appended", service.runQueued("turns-nova", () -> "appended"));

        verify(lockPort, never()).tryAcquire(anyString(), anyString());
        verify(handle).close();
    }

    @Test
    void shouldSurfaceInterruptWhileQueued() throws InterruptedException {
        when(lockPort.acquire(anyString(), anyString())).thenThrow(new InterruptedException("stop"));

        try {
            assertThrows(LockContendedException.class, () -> service.runQueued("turns-nova", () -> "never"));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
