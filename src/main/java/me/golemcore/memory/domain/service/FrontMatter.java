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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YAML front matter of the markdown artifacts (anchors, crystals): a
 * {@code ---} delimited block at the top of the file, then the body.
 */
@Slf4j
final class FrontMatter {

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---\\s*\\n(.*?)\\n---\\s*\\n(.*)$", Pattern.DOTALL);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private FrontMatter() {
    }

    record Document(Map<String, Object> fields, String body) {

        String string(String key) {
            Object value = fields.get(key);
            return value != null ? String.valueOf(value) : null;
        }
    }

    static boolean present(String text) {
        return FRONTMATTER_PATTERN.matcher(text).matches();
    }

    /**
     * Split a file into fields and body. Text without front matter is all
     * body; an unparseable block is dropped with a warning and the body kept.
     */
    static Document parse(String text, String file) {
        Matcher matcher = FRONTMATTER_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return new Document(Map.of(), text.strip());
        }
        String body = matcher.group(2).strip();
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> yaml = YAML_MAPPER.readValue(matcher.group(1), Map.class);
            return new Document(yaml != null ? yaml : Map.of(), body);
        } catch (JsonProcessingException e) {
            log.warn("[Storage] Failed to parse front matter of {}: {}", file, e.getOriginalMessage());
            return new Document(Map.of(), body);
        }
    }

    /**
     * Render fields as a front matter block followed by the body. Null values
     * are left out.
     */
    static String render(Map<String, Object> fields, String body) {
        Map<String, Object> present = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (value != null) {
                present.put(key, value);
            }
        });
        try {
            return "---\n" + YAML_MAPPER.writeValueAsString(present) + "---\n\n" + body;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render front matter", e);
        }
    }
}
