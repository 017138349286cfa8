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

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A stage's declared inputs are absent from the session context.
 */
public class MissingInputException extends WorkflowException {

    private final List<String> missingKeys;

    public MissingInputException(String stage, Set<String> missingKeys) {
        super(stage, "Stage '" + stage + "' is missing inputs: " + new TreeSet<>(missingKeys));
        this.missingKeys = List.copyOf(new TreeSet<>(missingKeys));
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }

    @Override
    public StageErrorType getErrorType() {
        return StageErrorType.MISSING_INPUT;
    }

    @Override
    public StageError toStageError() {
        return new StageError(getErrorType(), getStage(), getMessage(), missingKeys);
    }
}
