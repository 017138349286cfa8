package me.golemcore.gaplens.domain.workflow;

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

import me.golemcore.gaplens.domain.model.BackendSelection;
import me.golemcore.gaplens.domain.model.GenerationResult;
import me.golemcore.gaplens.domain.service.BackendSelector;
import me.golemcore.gaplens.domain.stage.StageBackend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link StageBackend} bound to one selection for one stage attempt. Every
 * generation is kept so the engine can trace it after the stage returns.
 */
class SelectedStageBackend implements StageBackend {

    private final BackendSelector selector;
    private final BackendSelection selection;
    private final Map<String, Object> params;
    private final long timeoutMs;
    private final List<GenerationResult> generations = new ArrayList<>();

    SelectedStageBackend(BackendSelector selector, BackendSelection selection, Map<String, Object> params,
            long timeoutMs) {
        this.selector = selector;
        this.selection = selection;
        this.params = params;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String getBackendId() {
        return selection.backendId();
    }

    @Override
    public GenerationResult generate(String prompt) {
        GenerationResult result = selector.generate(selection.backend(), prompt, params, timeoutMs);
        generations.add(result);
        return result;
    }

    List<GenerationResult> getGenerations() {
        return List.copyOf(generations);
    }
}
