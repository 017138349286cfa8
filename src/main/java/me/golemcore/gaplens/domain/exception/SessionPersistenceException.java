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

import me.golemcore.gaplens.domain.model.StageErrorType;

/**
 * A durable write failed after its retry. Results carrying this error may not
 * survive a restart even if their status reads completed.
 */
public class SessionPersistenceException extends WorkflowException {

    public SessionPersistenceException(String message, Throwable cause) {
        super(null, message, cause);
    }

    @Override
    public StageErrorType getErrorType() {
        return StageErrorType.PERSISTENCE;
    }
}
