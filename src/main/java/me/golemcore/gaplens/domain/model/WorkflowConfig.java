package me.golemcore.gaplens.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Per-run configuration. Null fields fall back to the application defaults
 * under {@code gaplens.*}.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowConfig {

    String backendName;

    @Builder.Default
    Map<String, Object> params = Map.of();

    List<String> stageList;

    public static WorkflowConfig defaults() {
        return WorkflowConfig.builder().build();
    }

    public Object param(String name) {
        return params != null ? params.get(name) : null;
    }
}
