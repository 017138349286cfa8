package me.golemcore.gaplens.domain.workflow;

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

import me.golemcore.gaplens.domain.exception.BackendTimeoutException;
import me.golemcore.gaplens.domain.exception.BackendUnavailableException;
import me.golemcore.gaplens.domain.exception.MissingInputException;
import me.golemcore.gaplens.domain.exception.SessionPersistenceException;
import me.golemcore.gaplens.domain.exception.StageExecutionException;
import me.golemcore.gaplens.domain.exception.ValidationException;
import me.golemcore.gaplens.domain.exception.WorkflowException;
import me.golemcore.gaplens.domain.model.BackendSelection;
import me.golemcore.gaplens.domain.model.ContextKeys;
import me.golemcore.gaplens.domain.model.GenerationOutcome;
import me.golemcore.gaplens.domain.model.GenerationResult;
import me.golemcore.gaplens.domain.model.SessionResult;
import me.golemcore.gaplens.domain.model.SessionState;
import me.golemcore.gaplens.domain.model.SessionStatus;
import me.golemcore.gaplens.domain.model.StageError;
import me.golemcore.gaplens.domain.model.StageErrorType;
import me.golemcore.gaplens.domain.model.StageRecord;
import me.golemcore.gaplens.domain.model.TraceEntry;
import me.golemcore.gaplens.domain.model.TraceOutcome;
import me.golemcore.gaplens.domain.model.WorkflowConfig;
import me.golemcore.gaplens.domain.service.BackendSelector;
import me.golemcore.gaplens.domain.stage.StageContract;
import me.golemcore.gaplens.domain.stage.StageInput;
import me.golemcore.gaplens.domain.stage.StageResult;
import me.golemcore.gaplens.infrastructure.config.GapLensProperties;
import me.golemcore.gaplens.port.outbound.MemoryStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives a session through the configured stage list.
 *
 * <p>
 * For every stage not yet in the session history the engine:
 * <ol>
 * <li>checks that the declared inputs are present in the context</li>
 * <li>selects a backend and executes the stage</li>
 * <li>on a recoverable backend failure, retries the stage once on the stub</li>
 * <li>checks the output against the declared keys and types, and that no
 * existing context key would be overwritten</li>
 * <li>merges the output, appends a {@link StageRecord}, appends trace entries
 * and persists the session</li>
 * </ol>
 * Any failure ends the session in {@link SessionStatus#FAILED} with a
 * {@link StageError}; {@link #run} never throws for workflow failures.
 *
 * <p>
 * Runs of the same session id are serialized by a per-session lock. Runs of
 * different ids never block each other.
 */
@Component
@Slf4j
public class WorkflowEngine {

    private final Map<String, StageContract> stageRegistry = new LinkedHashMap<>();
    private final BackendSelector backendSelector;
    private final MemoryStorePort memoryStore;
    private final GapLensProperties properties;
    private final Clock clock;

    private final Map<String, SessionLock> sessionLocks = new ConcurrentHashMap<>();
    private final Map<String, SessionState> activeSessions = new ConcurrentHashMap<>();

    public WorkflowEngine(List<StageContract> stages, BackendSelector backendSelector, MemoryStorePort memoryStore,
            GapLensProperties properties, Clock clock) {
        for (StageContract stage : stages) {
            StageContract previous = stageRegistry.put(stage.getName(), stage);
            if (previous != null) {
                throw new IllegalStateException("Duplicate stage name: " + stage.getName());
            }
        }
        this.backendSelector = backendSelector;
        this.memoryStore = memoryStore;
        this.properties = properties;
        this.clock = clock;
        log.info("[Workflow] Registered stages: {}", stageRegistry.keySet());
    }

    /**
     * Runs a new session or resumes an existing one.
     *
     * @param sessionId
     *            id of the session to resume or create; {@code null} creates a
     *            session with a generated id
     * @param userInput
     *            stored as {@code raw_input} when a session is created
     * @param config
     *            per-run overrides, may be {@code null}
     * @return the session outcome, always COMPLETED or FAILED
     */
    public SessionResult run(String sessionId, String userInput, WorkflowConfig config) {
        WorkflowConfig effective = config != null ? config : WorkflowConfig.defaults();
        String id = sessionId != null ? sessionId : UUID.randomUUID().toString();

        SessionLock lock = acquire(id);
        try {
            return runLocked(id, userInput, effective);
        } finally {
            activeSessions.remove(id);
            release(id, lock);
        }
    }

    /**
     * Returns a read-only snapshot, from the in-flight run when there is one.
     */
    public Optional<SessionState> getSession(String sessionId) {
        SessionState active = activeSessions.get(sessionId);
        if (active != null) {
            return Optional.of(active);
        }
        try {
            return memoryStore.loadSession(sessionId).map(SessionState::snapshot);
        } catch (IllegalArgumentException e) {
            log.debug("[Workflow] Rejected session id {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    public List<String> getStageNames() {
        return List.copyOf(stageRegistry.keySet());
    }

    // ===== Session lifecycle =====

    private SessionResult runLocked(String id, String userInput, WorkflowConfig config) {
        SessionState session;
        try {
            session = memoryStore.loadSession(id).orElse(null);
        } catch (IllegalArgumentException e) {
            log.warn("[Workflow] Rejected session id '{}': {}", id, e.getMessage());
            return rejected(id, StageError.of(StageErrorType.VALIDATION, null, e.getMessage()));
        } catch (SessionPersistenceException e) {
            log.error("[Workflow] Cannot load session {}: {}", id, e.getMessage());
            return rejected(id, e.toStageError());
        }

        if (session != null && session.getStatus().isTerminal()) {
            log.info("[Workflow] Session {} already {}, returning stored result", id, session.getStatus());
            return SessionResult.of(session, true);
        }
        if (session == null) {
            session = newSession(id, userInput);
            log.info("[Workflow] Created session {}", id);
        } else {
            log.info("[Workflow] Resuming session {} after {} stages", id, session.getStageHistory().size());
        }

        String currentStage = null;
        try {
            if (session.getStatus() == SessionStatus.PENDING) {
                session.transitionTo(SessionStatus.RUNNING, clock.instant());
            }
            publish(session);
            memoryStore.saveSession(session);

            for (StageContract stage : resolveStages(config)) {
                if (session.hasCompletedStage(stage.getName())) {
                    log.debug("[Workflow] Session {} skipping completed stage {}", id, stage.getName());
                    continue;
                }
                currentStage = stage.getName();
                runStage(session, stage, config);
            }
            currentStage = null;

            session.transitionTo(SessionStatus.COMPLETED, clock.instant());
            publish(session);
        } catch (WorkflowException e) {
            return fail(session, e);
        } catch (RuntimeException e) {
            log.error("[Workflow] Unexpected failure in session {}", id, e);
            return fail(session, new StageExecutionException(currentStage,
                    "Unexpected failure: " + describe(e), e));
        }

        try {
            memoryStore.saveSession(session);
        } catch (SessionPersistenceException e) {
            log.error("[Workflow] Session {} completed but final write failed: {}", id, e.getMessage());
            session.setError(e.toStageError());
            return SessionResult.of(session, false);
        }
        log.info("[Workflow] Session {} completed ({} stages)", id, session.getStageHistory().size());
        return SessionResult.of(session, true);
    }

    private SessionState newSession(String id, String userInput) {
        Instant now = clock.instant();
        SessionState session = SessionState.builder()
                .id(id)
                .userInput(userInput)
                .createdAt(now)
                .updatedAt(now)
                .build();
        if (userInput != null) {
            session.getContext().put(ContextKeys.RAW_INPUT, userInput);
        }
        return session;
    }

    private List<StageContract> resolveStages(WorkflowConfig config) {
        List<String> names = config.getStageList() != null && !config.getStageList().isEmpty()
                ? config.getStageList()
                : properties.getWorkflow().getStages();
        List<StageContract> stages = new ArrayList<>();
        for (String name : names) {
            StageContract stage = stageRegistry.get(name);
            if (stage == null) {
                throw new ValidationException(name, "Unknown stage '" + name + "', registered: "
                        + stageRegistry.keySet());
            }
            stages.add(stage);
        }
        return stages;
    }

    private SessionResult fail(SessionState session, WorkflowException e) {
        log.error("[Workflow] Session {} failed at stage {}: {}", session.getId(), e.getStage(), e.getMessage());
        session.setError(e.toStageError());
        if (session.getStatus() == SessionStatus.PENDING) {
            session.transitionTo(SessionStatus.RUNNING, clock.instant());
        }
        session.transitionTo(SessionStatus.FAILED, clock.instant());
        publish(session);

        appendTraceQuietly(TraceEntry.builder()
                .sessionId(session.getId())
                .actor(e.getStage() != null ? e.getStage() : "workflow")
                .inputs(Map.of())
                .outputs(Map.of("error", e.getErrorType().name()))
                .durationMs(0)
                .outcome(TraceOutcome.ERROR)
                .message(e.getMessage())
                .timestamp(clock.instant())
                .build());

        boolean persisted;
        try {
            memoryStore.saveSession(session);
            persisted = true;
        } catch (SessionPersistenceException persistFailure) {
            log.error("[Workflow] Could not persist failed session {}: {}", session.getId(),
                    persistFailure.getMessage());
            persisted = false;
        }
        return SessionResult.of(session, persisted && !(e instanceof SessionPersistenceException));
    }

    private SessionResult rejected(String id, StageError error) {
        return new SessionResult(id, SessionStatus.FAILED, Map.of(), List.of(), error, false);
    }

    // ===== Stage execution =====

    private void runStage(SessionState session, StageContract stage, WorkflowConfig config) {
        String stageName = stage.getName();
        Set<String> missing = new TreeSet<>(stage.declaredInputs());
        missing.removeAll(session.getContext().keySet());
        if (!missing.isEmpty()) {
            throw new MissingInputException(stageName, missing);
        }

        Map<String, Object> inputs = new LinkedHashMap<>();
        for (String key : new TreeSet<>(stage.declaredInputs())) {
            inputs.put(key, session.getContext().get(key));
        }
        StageInput input = new StageInput(session.getId(), inputs, config.getParams());
        String backendName = config.getBackendName() != null
                ? config.getBackendName()
                : properties.getBackend().getName();

        long start = System.nanoTime();
        BackendSelection selection = backendSelector.select(backendName, config.getParams());
        if (selection.fallback()) {
            appendTraceQuietly(stamp(selection.fallbackTrace(), session.getId(), stageName));
        }

        log.debug("[Workflow] Session {} running stage {} on {}", session.getId(), stageName,
                selection.backendId());
        Attempt attempt = attempt(session, stage, input, selection, config);
        StageResult result = attempt.result();
        boolean fallbackUsed = selection.fallback();

        if (result.isBackendFailure()) {
            GenerationResult failed = result.failedGeneration();
            log.warn("[Workflow] Stage {} of session {} got {} from {}, retrying on {}", stageName,
                    session.getId(), failed.outcome(), failed.backendId(), BackendSelector.STUB_BACKEND_ID);
            BackendSelection retrySelection = backendSelector.fallback();
            appendTraceQuietly(stamp(retrySelection.fallbackTrace(), session.getId(), stageName).toBuilder()
                    .message("Retrying stage " + stageName + " on stub after " + failed.outcome() + ": "
                            + failed.errorMessage())
                    .build());

            attempt = attempt(session, stage, input, retrySelection, config);
            result = attempt.result();
            fallbackUsed = true;
            if (result.isBackendFailure()) {
                GenerationResult retryFailed = result.failedGeneration();
                throw new StageExecutionException(stageName, "Stage " + stageName
                        + " failed after fallback retry: " + retryFailed.errorMessage(), toException(retryFailed));
            }
        }

        Map<String, Object> raw = result.output() != null ? result.output() : Map.of();
        validateOutput(session, stage, raw);
        Map<String, Object> output = freezeMap(raw);

        StageRecord record;
        try {
            record = StageRecord.builder()
                    .stageName(stageName)
                    .inputSnapshot(freezeMap(inputs))
                    .outputSnapshot(output)
                    .reasoningPatternTag(result.reasoningPattern() != null ? result.reasoningPattern().getTag() : null)
                    .reasoningSteps(result.reasoningSteps())
                    .confidence(result.confidence())
                    .backendId(attempt.backend().getBackendId())
                    .fallbackUsed(fallbackUsed)
                    .timestamp(nextTimestamp(session))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ValidationException(stageName, e.getMessage());
        }

        session.getContext().putAll(output);
        session.appendStageRecord(record);
        publish(session);

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        appendTraceQuietly(TraceEntry.builder()
                .sessionId(session.getId())
                .actor(stageName)
                .inputs(inputs)
                .outputs(output)
                .durationMs(durationMs)
                .outcome(fallbackUsed ? TraceOutcome.FALLBACK : TraceOutcome.OK)
                .message("Completed on " + attempt.backend().getBackendId())
                .timestamp(clock.instant())
                .build());

        memoryStore.saveSession(session);
        log.debug("[Workflow] Session {} finished stage {} in {}ms", session.getId(), stageName, durationMs);
    }

    /**
     * Deep copy into unmodifiable collections, so the context, the stage record
     * and the stage's own objects never share mutable state.
     */
    static Map<String, Object> freezeMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private Attempt attempt(SessionState session, StageContract stage, StageInput input,
            BackendSelection selection, WorkflowConfig config) {
        SelectedStageBackend backend = new SelectedStageBackend(backendSelector, selection, config.getParams(),
                properties.getWorkflow().getStageTimeoutMs());
        try {
            StageResult result = stage.execute(input, backend, memoryStore);
            if (result == null) {
                throw new StageExecutionException(stage.getName(), "Stage returned no result");
            }
            return new Attempt(backend, result);
        } catch (WorkflowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageExecutionException(stage.getName(),
                    "Stage " + stage.getName() + " threw: " + describe(e), e);
        } finally {
            traceGenerations(session.getId(), stage.getName(), backend.getGenerations());
        }
    }

    private void validateOutput(SessionState session, StageContract stage, Map<String, Object> output) {
        Map<String, Class<?>> declared = stage.declaredOutputs();
        if (!output.keySet().equals(declared.keySet())) {
            throw new ValidationException(stage.getName(), "Stage " + stage.getName() + " produced keys "
                    + new TreeSet<>(output.keySet()) + " but declares " + new TreeSet<>(declared.keySet()));
        }
        for (Map.Entry<String, Class<?>> entry : declared.entrySet()) {
            Object value = output.get(entry.getKey());
            if (value == null || !entry.getValue().isInstance(value)) {
                throw new ValidationException(stage.getName(), "Output '" + entry.getKey() + "' of stage "
                        + stage.getName() + " must be " + entry.getValue().getSimpleName() + " but was "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
            }
        }
        for (String key : output.keySet()) {
            if (session.getContext().containsKey(key)) {
                throw new ValidationException(stage.getName(), "Stage " + stage.getName()
                        + " would overwrite context key '" + key + "'");
            }
        }
    }

    // ===== Tracing =====

    private void traceGenerations(String sessionId, String stageName, List<GenerationResult> generations) {
        for (GenerationResult generation : generations) {
            Map<String, Object> outputs = new LinkedHashMap<>();
            outputs.put("outcome", generation.outcome().name());
            if (generation.text() != null) {
                outputs.put("chars", generation.text().length());
            }
            appendTraceQuietly(TraceEntry.builder()
                    .sessionId(sessionId)
                    .actor(generation.backendId())
                    .inputs(Map.of("stage", stageName))
                    .outputs(outputs)
                    .durationMs(generation.durationMs())
                    .outcome(generation.isSuccess() ? TraceOutcome.OK : TraceOutcome.ERROR)
                    .message(generation.errorMessage())
                    .timestamp(clock.instant())
                    .build());
        }
    }

    private TraceEntry stamp(TraceEntry trace, String sessionId, String stageName) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        if (trace.getInputs() != null) {
            inputs.putAll(trace.getInputs());
        }
        inputs.put("stage", stageName);
        return trace.toBuilder()
                .sessionId(sessionId)
                .inputs(inputs)
                .build();
    }

    private void appendTraceQuietly(TraceEntry entry) {
        try {
            memoryStore.appendTrace(entry);
        } catch (SessionPersistenceException e) {
            log.warn("[Workflow] Trace entry for session {} not written: {}", entry.getSessionId(), e.getMessage());
        }
    }

    // ===== Helpers =====

    private Instant nextTimestamp(SessionState session) {
        Instant now = clock.instant();
        List<StageRecord> history = session.getStageHistory();
        if (!history.isEmpty()) {
            Instant last = history.get(history.size() - 1).getTimestamp();
            if (last != null && now.isBefore(last)) {
                return last;
            }
        }
        return now;
    }

    private void publish(SessionState session) {
        activeSessions.put(session.getId(), session.snapshot());
    }

    private static RuntimeException toException(GenerationResult failed) {
        if (failed.outcome() == GenerationOutcome.TIMEOUT) {
            return new BackendTimeoutException(failed.backendId(), failed.durationMs());
        }
        return new BackendUnavailableException(failed.backendId(), failed.errorMessage());
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private SessionLock acquire(String sessionId) {
        SessionLock lock = sessionLocks.compute(sessionId, (id, existing) -> {
            SessionLock holder = existing != null ? existing : new SessionLock();
            holder.users++;
            return holder;
        });
        lock.lock.lock();
        return lock;
    }

    private void release(String sessionId, SessionLock lock) {
        lock.lock.unlock();
        sessionLocks.compute(sessionId, (id, existing) -> {
            if (existing == null) {
                return null;
            }
            existing.users--;
            return existing.users == 0 ? null : existing;
        });
    }

    private record Attempt(SelectedStageBackend backend, StageResult result) {
    }

    private static final class SessionLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
