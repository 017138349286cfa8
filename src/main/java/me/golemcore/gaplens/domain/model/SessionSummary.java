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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Condensed view of a session for listings and diagnostics.
 */
@Value
@Builder
public class SessionSummary {

    String sessionId;
    SessionStatus status;
    Instant createdAt;
    Instant updatedAt;
    int totalRecords;
    List<String> stagesRun;
    Set<String> reasoningPatterns;
    Set<String> contextKeys;

    public static SessionSummary from(SessionState session) {
        List<String> stages = session.getStageHistory().stream()
                .map(StageRecord::getStageName)
                .toList();
        Set<String> patterns = new LinkedHashSet<>();
        for (StageRecord record : session.getStageHistory()) {
            if (record.getReasoningPatternTag() != null) {
                patterns.add(record.getReasoningPatternTag());
            }
        }
        return SessionSummary.builder()
                .sessionId(session.getId())
                .status(session.getStatus())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .totalRecords(stages.size())
                .stagesRun(stages)
                .reasoningPatterns(patterns)
                .contextKeys(Set.copyOf(session.getContext().keySet()))
                .build();
    }
}
