package me.golemcore.memory.adapter.outbound.lock;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LockPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.FileLockInterruptionException;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Advisory lock backed by OS file locks under {@code locks/}.
 *
 * <p>
 * The lock file holds JSON describing the current holder. OS locks are
 * per-process, so every lock file also has a JVM-wide gate: a thread must pass
 * the gate before it touches the file lock, and threads of the same process
 * queue on the gate the way foreign processes queue on the file lock. Lock
 * files are left in place on release.
 */
@Component
@Slf4j
public class FileLockAdapter implements LockPort {

    // shared by every adapter instance: the OS lock belongs to the whole JVM
    private static final Map<Path, Semaphore> GATES = new ConcurrentHashMap<>();

    private final Path lockDirectory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, FileLockHandle> held = new ConcurrentHashMap<>();

    public FileLockAdapter(MemoryProperties properties, ObjectMapper objectMapper, Clock clock) {
        String base = properties.getStorage().getBasePath()
                .replace("${user.home}", System.getProperty("user.home"));
        this.lockDirectory = Paths.get(base).toAbsolutePath().normalize()
                .resolve(properties.getLock().getDirectory());
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<LockHandle> tryAcquire(String name, String holder) {
        Path lockFile = lockFile(name);
        Semaphore gate = gate(lockFile);
        if (!gate.tryAcquire()) {
            log.debug("[Lock] {} already held in this process", name);
            return Optional.empty();
        }

        FileChannel channel = null;
        try {
            channel = open(lockFile);
            FileLock fileLock = channel.tryLock();
            if (fileLock == null) {
                closeQuietly(channel);
                gate.release();
                log.debug("[Lock] {} held by another process", name);
                return Optional.empty();
            }
            return Optional.of(granted(name, holder, channel, fileLock, gate));
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            gate.release();
            return Optional.empty();
        } catch (IOException e) {
            closeQuietly(channel);
            gate.release();
            throw new UncheckedIOException("Failed to acquire lock: " + name, e);
        }
    }

    @Override
    public LockHandle acquire(String name, String holder) throws InterruptedException {
        Path lockFile = lockFile(name);
        Semaphore gate = gate(lockFile);
        gate.acquire();

        FileChannel channel = null;
        try {
            channel = open(lockFile);
            FileLock fileLock = channel.lock();
            return granted(name, holder, channel, fileLock, gate);
        } catch (FileLockInterruptionException e) {
            closeQuietly(channel);
            gate.release();
            throw new InterruptedException("Interrupted waiting for lock: " + name);
        } catch (IOException e) {
            closeQuietly(channel);
            gate.release();
            throw new UncheckedIOException("Failed to acquire lock: " + name, e);
        }
    }

    @Override
    public boolean isLocked(String name) {
        if (held.containsKey(name)) {
            return true;
        }
        Path lockFile = lockFile(name);
        if (!Files.exists(lockFile)) {
            return false;
        }
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.WRITE)) {
            FileLock trial = channel.tryLock();
            if (trial == null) {
                return true;
            }
            trial.release();
            return false;
        } catch (OverlappingFileLockException e) {
            return true;
        } catch (IOException e) {
            log.warn("[Lock] Failed to check {}: {}", name, e.getMessage());
            return false;
        }
    }

    private FileLockHandle granted(String name, String holder, FileChannel channel, FileLock fileLock,
            Semaphore gate) {
        FileLockHandle handle = new FileLockHandle(name, channel, fileLock, gate);
        held.put(name, handle);
        try {
            writeHolder(channel, holder);
        } catch (IOException e) {
            // the handle owns the channel and the gate from here on
            handle.close();
            throw new UncheckedIOException("Failed to record holder of lock: " + name, e);
        }
        log.debug("[Lock] Acquired {} for {}", name, holder);
        return handle;
    }

    private FileChannel open(Path lockFile) throws IOException {
        Files.createDirectories(lockDirectory);
        return FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    }

    private static Semaphore gate(Path lockFile) {
        return GATES.computeIfAbsent(lockFile, key -> new Semaphore(1, true));
    }

    private void writeHolder(FileChannel channel, String holder) throws IOException {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("holder", holder);
        info.put("pid", ProcessHandle.current().pid());
        info.put("acquiredAt", clock.instant().toString());
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(info);
        } catch (JsonProcessingException e) {
            bytes = ("{\"holder\":\"" + holder + "\"}").getBytes(StandardCharsets.UTF_8);
        }
        channel.truncate(0);
        channel.write(ByteBuffer.wrap(bytes), 0);
        channel.force(false);
    }

    private Path lockFile(String name) {
        String safe = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return lockDirectory.resolve(safe + ".lock");
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[Lock] Failed to close channel: {}", e.getMessage());
        }
    }

    private final class FileLockHandle implements LockHandle {

        private final String name;
        private final FileChannel channel;
        private final FileLock fileLock;
        private final Semaphore gate;
        private boolean released;

        private FileLockHandle(String name, FileChannel channel, FileLock fileLock, Semaphore gate) {
            this.name = name;
            this.channel = channel;
            this.fileLock = fileLock;
            this.gate = gate;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public synchronized void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                if (fileLock.isValid()) {
                    fileLock.release();
                }
            } catch (IOException e) {
                log.warn("[Lock] Failed to release {}: {}", name, e.getMessage());
            } finally {
                closeQuietly(channel);
                held.remove(name, this);
                gate.release();
                log.debug("[Lock] Released {}", name);
            }
        }
    }
}
