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

/**
 * Explicit result of a backend {@code generate} call. Failures are values, not
 * exceptions, so the fallback path is an ordinary branch in the caller.
 */
public record GenerationResult(String backendId, GenerationOutcome outcome, String text, String errorMessage,
        long durationMs) {

    public static GenerationResult ok(String backendId, String text, long durationMs) {
        return new GenerationResult(backendId, GenerationOutcome.OK, text, null, durationMs);
    }

    public static GenerationResult unavailable(String backendId, String errorMessage, long durationMs) {
        return new GenerationResult(backendId, GenerationOutcome.UNAVAILABLE, null, errorMessage, durationMs);
    }

    public static GenerationResult timeout(String backendId, long durationMs) {
        return new GenerationResult(backendId, GenerationOutcome.TIMEOUT, null,
                "Backend call exceeded " + durationMs + "ms", durationMs);
    }

    public boolean isSuccess() {
        return outcome == GenerationOutcome.OK;
    }
}
