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

import me.golemcore.gaplens.domain.model.StageError;
import me.golemcore.gaplens.domain.model.StageErrorType;

/**
 * Base type for failures that end a workflow session. Each subtype maps to a
 * {@link StageErrorType} so the engine can record a structured error.
 */
public abstract class WorkflowException extends RuntimeException {

    private final String stage;

    protected WorkflowException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected WorkflowException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }

    public abstract StageErrorType getErrorType();

    public StageError toStageError() {
        return StageError.of(getErrorType(), stage, getMessage());
    }
}
