package me.golemcore.gaplens.port.inbound;

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

import me.golemcore.gaplens.domain.model.SessionResult;
import me.golemcore.gaplens.domain.model.SessionState;
import me.golemcore.gaplens.domain.model.SessionSummary;
import me.golemcore.gaplens.domain.model.WorkflowConfig;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Inbound port exposing workflow execution and memory access to callers.
 */
public interface WorkflowPort {

    /**
     * Runs or resumes a session synchronously. {@code sessionId} may be null to
     * start a new session. Never throws for workflow failures; they are reported
     * in the result.
     */
    SessionResult run(String sessionId, String userInput, WorkflowConfig config);

    /**
     * Runs or resumes a session on the worker pool.
     */
    CompletableFuture<SessionResult> submit(String sessionId, String userInput, WorkflowConfig config);

    Optional<SessionState> getSession(String sessionId);

    Optional<SessionSummary> getSessionSummary(String sessionId);

    void putLongTerm(String category, String key, Object value);

    Optional<Object> getLongTerm(String category, String key);
}
