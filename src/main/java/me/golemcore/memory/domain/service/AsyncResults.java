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

import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.exception.SubstrateException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits on port futures and unwraps their failures. Substrate exceptions are
 * rethrown as they are; anything else from a backend call becomes
 * {@link StorageUnavailableException}.
 */
final class AsyncResults {

    private AsyncResults() {
    }

    static <T> T await(CompletableFuture<T> future, long timeoutMs, String operation) {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException(operation + " interrupted", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StorageUnavailableException(operation + " timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause(), operation);
        }
    }

    static <T> T join(CompletableFuture<T> future, String operation) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause(), operation);
        }
    }

    static RuntimeException unwrap(Throwable cause, String operation) {
        Throwable current = cause;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof SubstrateException substrateException) {
            return substrateException;
        }
        String message = current != null ? current.getMessage() : "unknown error";
        return new StorageUnavailableException(operation + " failed: " + message, current);
    }
}
