package me.golemcore.memory.domain.model;

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

/**
 * Error taxonomy surfaced at the API boundary.
 */
public enum ErrorKind {

    /**
     * An embedding or graph backend is unreachable. Reads degrade to empty.
     */
    STORAGE_UNAVAILABLE(true),

    /**
     * Disk and index parity is broken; repaired only by resync.
     */
    SYNC_DRIFT(false),

    /**
     * The crystal chain would be broken by the operation.
     */
    CHAIN_INTEGRITY_VIOLATION(false),

    /**
     * The range was already processed. Treated as a no-op by callers.
     */
    IDEMPOTENCY_VIOLATION(false),

    /**
     * LLM-backed summarization, crystallization or extraction failed. Source
     * data stays unconsumed.
     */
    EXTRACTION_FAILURE(true),

    /**
     * Another process holds the cooperative lock.
     */
    LOCK_CONTENDED(true),

    INVALID_REQUEST(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
