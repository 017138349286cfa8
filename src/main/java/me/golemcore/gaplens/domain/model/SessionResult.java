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

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@code run}. {@code durable} is false when the final session write
 * could not be persisted, in which case the status may not survive a restart.
 */
public record SessionResult(String sessionId, SessionStatus status, Map<String, Object> context,
        List<StageRecord> stageHistory, StageError error, boolean durable) {

    public static SessionResult of(SessionState session, boolean durable) {
        SessionState snapshot = session.snapshot();
        return new SessionResult(snapshot.getId(), snapshot.getStatus(), snapshot.getContext(),
                snapshot.getStageHistory(), snapshot.getError(), durable);
    }

    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }
}
