package me.golemcore.memory.adapter.outbound.graph;

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

import java.util.List;
import java.util.Locale;

/**
 * Recovers subject and object names from a fact sentence when the graph
 * service does not return node names alongside the edge. The result is a
 * guess; an endpoint that cannot be recovered at all is {@code null}.
 */
final class FactEntityExtractor {

    private static final List<String> VERB_PATTERNS = List.of(
            " owns ", " has ", " is ", " are ", " was ", " were ",
            " loves ", " likes ", " wants ", " needs ", " uses ",
            " created ", " made ", " built ", " wrote ",
            " wears ", " wearing ",
            " debugs ", " debugging ", " develops ", " developing ",
            " subscribed to ", " subscribes to ",
            " cares for ", " built together ", " working on ");

    private static final String TRAILING_PUNCTUATION = "[.,;:!?]+$";

    private FactEntityExtractor() {
    }

    /**
     * @return two-element array {subject, object}; either may be null
     */
    static String[] extract(String factText) {
        if (factText == null || factText.isBlank()) {
            return new String[] { null, null };
        }

        String lower = factText.toLowerCase(Locale.ROOT);
        for (String pattern : VERB_PATTERNS) {
            int idx = lower.indexOf(pattern);
            if (idx < 0) {
                continue;
            }
            String subject = factText.substring(0, idx).trim();
            String object = factText.substring(idx + pattern.length()).trim();
            int comma = object.indexOf(',');
            if (comma >= 0) {
                object = object.substring(0, comma).trim();
            }
            object = object.replaceAll(TRAILING_PUNCTUATION, "");
            if (!subject.isEmpty() && !object.isEmpty()) {
                return new String[] { subject, object };
            }
        }

        String[] parts = factText.trim().split(" ", 3);
        if (parts.length >= 3) {
            return new String[] { parts[0], parts[2].replaceAll(TRAILING_PUNCTUATION, "") };
        }
        if (parts.length == 2) {
            return new String[] { parts[0], parts[1].replaceAll(TRAILING_PUNCTUATION, "") };
        }
        return new String[] { factText.trim(), null };
    }
}
