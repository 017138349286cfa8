package me.golemcore.gaplens.domain.exception;

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
 * A backend could not be reached or rejected the call.
 */
public class BackendUnavailableException extends RuntimeException {

    private final String backendId;

    public BackendUnavailableException(String backendId, String message) {
        super(message);
        this.backendId = backendId;
    }

    public BackendUnavailableException(String backendId, String message, Throwable cause) {
        super(message, cause);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}
