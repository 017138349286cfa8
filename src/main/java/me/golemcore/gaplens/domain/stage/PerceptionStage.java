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

import me.golemcore.gaplens.domain.exception.StageExecutionException;
import me.golemcore.gaplens.domain.model.ContextKeys;
import me.golemcore.gaplens.domain.model.GenerationResult;
import me.golemcore.gaplens.domain.model.ReasoningPattern;
import me.golemcore.gaplens.port.outbound.MemoryStorePort;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * First stage: understands the raw user input.
 *
 * <p>
 * Skills are extracted with the {@link SkillCatalog} so that known names are
 * always found in canonical spelling; entities reported by the backend are
 * merged in after them. The normalized question is the input with whitespace
 * collapsed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PerceptionStage implements StageContract {

    public static final String NAME = "perception";

    static final String DEFAULT_INTENT = "skills_analysis";

    private static final double PARSED_CONFIDENCE = 0.8;
    private static final double UNPARSED_CONFIDENCE = 0.6;

    private final SkillCatalog skillCatalog;
    private final BackendResponseParser responseParser;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<String> declaredInputs() {
        return Set.of(ContextKeys.RAW_INPUT);
    }

    @Override
    public Map<String, Class<?>> declaredOutputs() {
        return Map.of(
                ContextKeys.INTENT, String.class,
                ContextKeys.ENTITIES, List.class,
                ContextKeys.NORMALIZED_QUESTION, String.class);
    }

    @Override
    public StageResult execute(StageInput input, StageBackend backend, MemoryStorePort memory) {
        String rawInput = input.getString(ContextKeys.RAW_INPUT);
        if (rawInput == null || rawInput.isBlank()) {
            throw new StageExecutionException(NAME, "User input is empty");
        }
        String normalized = rawInput.trim().replaceAll("\\s+", " ");

        GenerationResult generation = backend.generate(buildPrompt(normalized));
        if (!generation.isSuccess()) {
            return StageResult.backendFailure(generation);
        }

        List<String> catalogSkills = skillCatalog.extractSkills(normalized);
        Optional<JsonNode> parsed = responseParser.parseObject(generation.text());

        String intent = parsed.map(node -> responseParser.text(node, "intent")).orElse(DEFAULT_INTENT);
        List<String> backendEntities = parsed.map(node -> responseParser.textList(node, "entities"))
                .orElse(List.of());
        List<String> entities = mergeEntities(catalogSkills, backendEntities);

        log.debug("[Workflow] Perception found {} entities, intent {}", entities.size(), intent);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put(ContextKeys.INTENT, intent);
        output.put(ContextKeys.ENTITIES, entities);
        output.put(ContextKeys.NORMALIZED_QUESTION, normalized);

        List<String> steps = List.of(
                "Reason: read the user input (" + normalized.length() + " chars)",
                "Act: matched " + catalogSkills.size() + " known skills " + catalogSkills,
                "Observe: backend reported " + backendEntities.size() + " entities"
                        + (parsed.isPresent() ? "" : " (response was not JSON)"),
                "Think: intent is " + intent);

        return StageResult.success(output, ReasoningPattern.REACT,
                parsed.isPresent() ? PARSED_CONFIDENCE : UNPARSED_CONFIDENCE, steps);
    }

    private List<String> mergeEntities(List<String> catalogSkills, List<String> backendEntities) {
        List<String> merged = new ArrayList<>(catalogSkills);
        for (String entity : backendEntities) {
            String canonical = skillCatalog.canonicalize(entity).orElse(entity);
            boolean duplicate = merged.stream()
                    .anyMatch(existing -> existing.toLowerCase(Locale.ROOT)
                            .equals(canonical.toLowerCase(Locale.ROOT)));
            if (!duplicate) {
                merged.add(canonical);
            }
        }
        return merged;
    }

    private static String buildPrompt(String question) {
        return """
                Stage: perception
                Identify the user's intent and every skill, role or project mentioned.
                Reply with JSON only: {"intent": "<intent>", "entities": ["<entity>", ...]}

                User input: %s""".formatted(question);
    }
}
