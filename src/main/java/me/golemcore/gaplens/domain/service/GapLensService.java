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

import me.golemcore.gaplens.domain.model.LongTermEntry;
import me.golemcore.gaplens.domain.model.SessionResult;
import me.golemcore.gaplens.domain.model.SessionState;
import me.golemcore.gaplens.domain.model.SessionSummary;
import me.golemcore.gaplens.domain.model.WorkflowConfig;
import me.golemcore.gaplens.domain.workflow.WorkflowEngine;
import me.golemcore.gaplens.port.inbound.WorkflowPort;
import me.golemcore.gaplens.port.outbound.MemoryStorePort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for callers: workflow runs and direct long-term memory access.
 */
@Service
@RequiredArgsConstructor
public class GapLensService implements WorkflowPort {

    private final WorkflowEngine workflowEngine;
    private final WorkflowRunCoordinator runCoordinator;
    private final MemoryStorePort memoryStore;

    @Override
    public SessionResult run(String sessionId, String userInput, WorkflowConfig config) {
        return workflowEngine.run(sessionId, userInput, config);
    }

    @Override
    public CompletableFuture<SessionResult> submit(String sessionId, String userInput, WorkflowConfig config) {
        return runCoordinator.submit(sessionId, userInput, config);
    }

    @Override
    public Optional<SessionState> getSession(String sessionId) {
        return workflowEngine.getSession(sessionId);
    }

    @Override
    public Optional<SessionSummary> getSessionSummary(String sessionId) {
        return workflowEngine.getSession(sessionId).map(SessionSummary::from);
    }

    @Override
    public void putLongTerm(String category, String key, Object value) {
        memoryStore.putLongTerm(category, key, value);
    }

    @Override
    public Optional<Object> getLongTerm(String category, String key) {
        return memoryStore.getLongTerm(category, key).map(LongTermEntry::value);
    }
}
