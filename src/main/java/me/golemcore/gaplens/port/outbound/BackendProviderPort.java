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
import java.util.Set;

/**
 * Builds live backends for one or more backend names. Construction must not
 * perform network I/O so that instances can be created and cached freely.
 */
public interface BackendProviderPort {

    /**
     * Backend names this provider can build (e.g., "anthropic", "openai").
     */
    Set<String> getBackendNames();

    /**
     * Checks whether credentials for the named backend are present in
     * configuration or in the per-run params.
     */
    boolean hasCredentials(String backendName, Map<String, Object> params);

    /**
     * Builds a backend instance for the name and params.
     */
    BackendPort create(String backendName, Map<String, Object> params);
}
