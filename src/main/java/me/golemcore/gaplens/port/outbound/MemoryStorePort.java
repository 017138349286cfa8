package me.golemcore.gaplens.port.outbound;

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
import me.golemcore.gaplens.domain.model.SessionState;
import me.golemcore.gaplens.domain.model.TraceEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable memory with three tiers: per-session records, long-term knowledge
 * and an append-only trace log. Writes are retried once before failing with
 * {@link me.golemcore.gaplens.domain.exception.SessionPersistenceException}.
 */
public interface MemoryStorePort {

    // Session tier

    void saveSession(SessionState session);

    Optional<SessionState> loadSession(String sessionId);

    List<String> listSessionIds();

    int deleteSessionsOlderThan(Instant cutoff);

    // Long-term tier

    void putLongTerm(String category, String key, Object value);

    Optional<LongTermEntry> getLongTerm(String category, String key);

    List<LongTermEntry> listLongTerm(String category);

    // Trace tier

    void appendTrace(TraceEntry entry);

    /**
     * Reads the trace stream for external audit. Never used to drive workflow
     * control flow.
     */
    List<TraceEntry> readTrace();
}
