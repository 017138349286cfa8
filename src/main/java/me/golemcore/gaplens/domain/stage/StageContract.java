package me.golemcore.gaplens.domain.stage;

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

import me.golemcore.gaplens.port.outbound.MemoryStorePort;

import java.util.Map;
import java.util.Set;

/**
 * One step of the workflow pipeline.
 *
 * <p>
 * A stage declares the context keys it reads and the keys it writes. The engine
 * checks the inputs before calling {@link #execute} and checks that the output
 * key set equals {@link #declaredOutputs()} afterwards, so a stage only has to
 * produce its values.
 *
 * <p>
 * Output values must be JSON-friendly ({@link String}, {@link java.util.List},
 * {@link Map}, numbers, booleans) because resumed sessions are read back from
 * their persisted JSON form.
 */
public interface StageContract {

    /**
     * Stage name used in the stage list and in the session history.
     */
    String getName();

    /**
     * Context keys that must be present before the stage runs.
     */
    Set<String> declaredInputs();

    /**
     * Context keys the stage writes, with the type each value must have.
     */
    Map<String, Class<?>> declaredOutputs();

    /**
     * Executes the stage.
     *
     * @return a success with the produced values, or a backend failure when the
     *         generation call did not succeed
     * @throws me.golemcore.gaplens.domain.exception.StageExecutionException
     *             on non-recoverable failures
     */
    StageResult execute(StageInput input, StageBackend backend, MemoryStorePort memory);
}
