package me.golemcore.memory.adapter.inbound.web;

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

import me.golemcore.memory.domain.model.ErrorKind;
import org.springframework.http.HttpStatus;

/**
 * HTTP status for each substrate error kind.
 */
public final class ErrorStatusMapper {

    private ErrorStatusMapper() {
    }

    public static HttpStatus statusOf(ErrorKind kind) {
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
        case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
        case CHAIN_INTEGRITY_VIOLATION, SYNC_DRIFT -> HttpStatus.CONFLICT;
        case LOCK_CONTENDED -> HttpStatus.LOCKED;
        case STORAGE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        case EXTRACTION_FAILURE -> HttpStatus.BAD_GATEWAY;
        case IDEMPOTENCY_VIOLATION -> HttpStatus.OK;
        };
    }
}
