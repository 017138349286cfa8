package me.golemcore.gaplens.domain.stage;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the JSON object from free-form backend text. Models often wrap JSON
 * in a markdown fence or surround it with prose.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackendResponseParser {

    private static final Pattern JSON_FENCE_PATTERN = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```",
            Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    /**
     * Returns the JSON object found in the text, or empty when there is none or
     * it does not parse.
     */
    public Optional<JsonNode> parseObject(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String json = extractJson(text);
        try {
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Backend response is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.isTextual() ? value.asText() : value.toString();
        return text.isBlank() ? null : text.trim();
    }

    public List<String> textList(JsonNode node, String field) {
        List<String> result = new ArrayList<>();
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return result;
        }
        for (JsonNode item : value) {
            if (item.isValueNode() && !item.asText().isBlank()) {
                result.add(item.asText().trim());
            }
        }
        return result;
    }

    private String extractJson(String text) {
        Matcher fenced = JSON_FENCE_PATTERN.matcher(text);
        if (fenced.find()) {
            return fenced.group(1);
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return text.trim();
    }
}
