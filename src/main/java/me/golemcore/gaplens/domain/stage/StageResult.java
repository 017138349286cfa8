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

import me.golemcore.gaplens.domain.model.GenerationResult;
import me.golemcore.gaplens.domain.model.ReasoningPattern;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link StageContract#execute}: either the produced output or the
 * backend generation that failed.
 */
public record StageResult(Map<String, Object> output, ReasoningPattern reasoningPattern, Double confidence,
        List<String> reasoningSteps, GenerationResult failedGeneration) {

    public static StageResult success(Map<String, Object> output, ReasoningPattern pattern, Double confidence,
            List<String> reasoningSteps) {
        return new StageResult(output, pattern, confidence,
                reasoningSteps != null ? List.copyOf(reasoningSteps) : List.of(), null);
    }

    public static StageResult backendFailure(GenerationResult generation) {
        return new StageResult(Map.of(), null, null, List.of(), generation);
    }

    public boolean isBackendFailure() {
        return failedGeneration != null;
    }
}
