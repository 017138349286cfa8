package me.golemcore.gaplens.port.outbound;

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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for text-generation backends. Implementations may fail or hang; callers
 * go through the backend selector, which bounds and classifies each call.
 */
public interface BackendPort {

    /**
     * Returns the backend identifier (e.g., "anthropic", "stub").
     */
    String getBackendId();

    /**
     * Generates text for the prompt. The future completes exceptionally when the
     * backend is unreachable or rejects the request.
     */
    CompletableFuture<String> generate(String prompt, Map<String, Object> params);

    /**
     * Checks if the backend is configured and operational.
     */
    boolean isAvailable();
}
