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

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Structured error attached to a failed session and its result.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record StageError(StageErrorType type, String stage, String message, List<String> missingKeys) {

    public StageError {
        missingKeys = missingKeys != null ? List.copyOf(missingKeys) : List.of();
    }

    public static StageError of(StageErrorType type, String stage, String message) {
        return new StageError(type, stage, message, List.of());
    }
}
