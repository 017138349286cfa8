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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable state of one workflow run. The context only grows and the stage
 * history is append-only; both are mutated exclusively by the engine that
 * currently owns the session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionState {

    private String id;
    private String userInput;

    @Builder.Default
    private SessionStatus status = SessionStatus.PENDING;

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    @Builder.Default
    private List<StageRecord> stageHistory = new ArrayList<>();

    private StageError error;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Moves the session forward in its lifecycle.
     *
     * @throws IllegalStateException
     *             if the transition would go backwards or skip a state
     */
    public void transitionTo(SessionStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Session " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
        this.updatedAt = at;
    }

    public void appendStageRecord(StageRecord record) {
        if (stageHistory == null) {
            stageHistory = new ArrayList<>();
        }
        if (!stageHistory.isEmpty()) {
            Instant last = stageHistory.get(stageHistory.size() - 1).getTimestamp();
            if (last != null && record.getTimestamp() != null && record.getTimestamp().isBefore(last)) {
                throw new IllegalArgumentException("Stage record timestamp goes backwards for session " + id);
            }
        }
        stageHistory.add(record);
        this.updatedAt = record.getTimestamp();
    }

    public boolean hasCompletedStage(String stageName) {
        return stageHistory != null && stageHistory.stream()
                .anyMatch(record -> stageName.equals(record.getStageName()));
    }

    /**
     * Returns a detached copy whose collections can be handed to readers without
     * exposing the live session.
     */
    public SessionState snapshot() {
        return SessionState.builder()
                .id(id)
                .userInput(userInput)
                .status(status)
                .context(Collections.unmodifiableMap(new LinkedHashMap<>(context)))
                .stageHistory(List.copyOf(stageHistory))
                .error(error)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
