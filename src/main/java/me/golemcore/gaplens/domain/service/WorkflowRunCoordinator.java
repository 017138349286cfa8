package me.golemcore.gaplens.domain.service;

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
import me.golemcore.gaplens.domain.model.WorkflowConfig;
import me.golemcore.gaplens.domain.workflow.WorkflowEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs workflow sessions on the {@code workflowRunExecutor} pool, one task per
 * session. Stages inside a session stay sequential; the engine's per-session
 * lock orders concurrent submissions for the same id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowRunCoordinator {

    private final WorkflowEngine workflowEngine;
    private final ExecutorService workflowRunExecutor;

    /**
     * Schedules a run. A missing session id is generated here so the caller can
     * correlate the future with the session before it completes.
     */
    public CompletableFuture<SessionResult> submit(String sessionId, String userInput, WorkflowConfig config) {
        String id = sessionId != null ? sessionId : UUID.randomUUID().toString();
        log.debug("[Workflow] Submitting session {}", id);
        return CompletableFuture.supplyAsync(() -> workflowEngine.run(id, userInput, config), workflowRunExecutor);
    }
}
