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

import me.golemcore.gaplens.port.outbound.BackendPort;

/**
 * Backend chosen for a stage. When {@code fallback} is set the selector
 * substituted the stub and {@code fallbackTrace} carries the audit entry the
 * engine must append.
 */
public record BackendSelection(BackendPort backend, boolean fallback, TraceEntry fallbackTrace) {

    public static BackendSelection live(BackendPort backend) {
        return new BackendSelection(backend, false, null);
    }

    public static BackendSelection fallback(BackendPort stub, TraceEntry trace) {
        return new BackendSelection(stub, true, trace);
    }

    public String backendId() {
        return backend.getBackendId();
    }
}
