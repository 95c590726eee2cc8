package me.golemcore.memory.tools;

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

import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter coercion and error mapping shared by the tools.
 */
@Slf4j
final class ToolSupport {

    static final String PARAM_OPERATION = "operation";

    private ToolSupport() {
    }

    static String string(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().strip();
        return text.isEmpty() ? null : text;
    }

    static String requireString(Map<String, Object> params, String key) {
        String value = string(params, key);
        if (value == null) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Missing required parameter: " + key);
        }
        return value;
    }

    static int integer(Map<String, Object> params, String key, int defaultValue) {
        Long value = longValue(params, key);
        return value != null ? value.intValue() : defaultValue;
    }

    static Long longValue(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().strip());
        } catch (NumberFormatException e) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Parameter " + key + " must be a number");
        }
    }

    static long requireLong(Map<String, Object> params, String key) {
        Long value = longValue(params, key);
        if (value == null) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST, "Missing required parameter: " + key);
        }
        return value;
    }

    static boolean bool(Map<String, Object> params, String key, boolean defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        return Boolean.parseBoolean(value.toString().strip());
    }

    static Instant instant(Map<String, Object> params, String key) {
        String value = string(params, key);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new SubstrateException(ErrorKind.INVALID_REQUEST,
                    "Parameter " + key + " must be an ISO-8601 instant, got: " + value);
        }
    }

    static List<String> strings(Map<String, Object> params, String key) {
        Object value = params.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().strip());
                }
            }
        } else if (value != null) {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.strip());
                }
            }
        }
        return result;
    }

    static Map<String, Object> schema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    static Map<String, Object> param(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    /**
     * Map a failure to a result. Substrate errors keep their kind; anything
     * else is reported as a backend problem.
     */
    static ToolResult failure(String tool, String operation, RuntimeException e) {
        if (e instanceof SubstrateException substrate) {
            log.warn("[{}] {} failed ({}): {}", tool, operation, substrate.getKind(), e.getMessage());
            return ToolResult.failure(substrate.getKind(), e.getMessage());
        }
        log.error("[{}] {} failed", tool, operation, e);
        return ToolResult.failure(ErrorKind.STORAGE_UNAVAILABLE, operation + " failed: " + e.getMessage());
    }
}
