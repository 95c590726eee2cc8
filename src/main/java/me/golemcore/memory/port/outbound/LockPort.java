package me.golemcore.memory.port.outbound;

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

import java.util.Optional;

/**
 * Port for advisory locks shared between processes using the same workspace.
 */
public interface LockPort {

    /**
     * Try to take the named lock without waiting.
     *
     * @param name
     *            lock name, unique per protected operation and owner
     * @param holder
     *            description of the caller, recorded for diagnostics
     * @return a handle to release, or empty if another holder has it
     */
    Optional<LockHandle> tryAcquire(String name, String holder);

    /**
     * Take the named lock, waiting for the current holder to release it.
     *
     * @throws InterruptedException
     *             if the calling thread is interrupted while waiting
     */
    LockHandle acquire(String name, String holder) throws InterruptedException;

    /**
     * Whether the named lock is currently held by anyone.
     */
    boolean isLocked(String name);

    /**
     * Held lock. Closing releases it.
     */
    interface LockHandle extends AutoCloseable {

        String name();

        @Override
        void close();
    }
}
