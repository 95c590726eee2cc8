package me.golemcore.memory.domain.service;

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

import me.golemcore.memory.domain.exception.LockContendedException;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LockPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs work under a named advisory lock shared by every process using the
 * workspace. {@link #runExclusive} backs off exponentially and gives up with
 * {@link LockContendedException} after the configured number of attempts;
 * {@link #runQueued} waits its turn and is meant for short critical sections
 * that must not be dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CooperativeLockService {

    private final LockPort lockPort;
    private final MemoryProperties properties;

    /**
     * Lock name for an operation of the configured owner, e.g.
     * {@code crystallization-entity}.
     */
    public String lockName(String operation) {
        return operation + "-" + properties.getOwner();
    }

    public <T> T runExclusive(String lockName, Supplier<T> work) {
        MemoryProperties.LockProperties config = properties.getLock();
        String holder = holder();
        long backoffMs = config.getBackoffMs();
        int attempts = Math.max(1, config.getMaxAttempts());

        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<LockPort.LockHandle> handle = lockPort.tryAcquire(lockName, holder);
            if (handle.isPresent()) {
                try (LockPort.LockHandle ignored = handle.get()) {
                    return work.get();
                }
            }
            if (attempt < attempts) {
                log.debug("[Lock] {} busy (attempt {}/{}), retrying in {}ms", lockName, attempt, attempts, backoffMs);
                sleep(backoffMs, lockName);
                backoffMs = (long) (backoffMs * config.getBackoffMultiplier());
            }
        }

        log.warn("[Lock] Gave up on {} after {} attempts", lockName, attempts);
        throw new LockContendedException(lockName);
    }

    /**
     * Run {@code work} once the lock is free, however long that takes. Only
     * an interrupt aborts the wait.
     */
    public <T> T runQueued(String lockName, Supplier<T> work) {
        LockPort.LockHandle handle;
        try {
            handle = lockPort.acquire(lockName, holder());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockContendedException(lockName);
        }
        try (LockPort.LockHandle ignored = handle) {
            return work.get();
        }
    }

    public void runQueued(String lockName, Runnable work) {
        runQueued(lockName, () -> {
            work.run();
            return null;
        });
    }

    public void runExclusive(String lockName, Runnable work) {
        runExclusive(lockName, () -> {
            work.run();
            return null;
        });
    }

    public boolean isLocked(String lockName) {
        return lockPort.isLocked(lockName);
    }

    private static String holder() {
        return "pid-" + ProcessHandle.current().pid() + "/" + Thread.currentThread().getName();
    }

    private static void sleep(long millis, String lockName) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockContendedException(lockName);
        }
    }
}
