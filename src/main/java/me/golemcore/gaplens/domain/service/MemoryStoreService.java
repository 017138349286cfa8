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

import me.golemcore.gaplens.domain.exception.SessionPersistenceException;
import me.golemcore.gaplens.domain.model.LongTermEntry;
import me.golemcore.gaplens.domain.model.SessionState;
import me.golemcore.gaplens.domain.model.TraceEntry;
import me.golemcore.gaplens.port.outbound.MemoryStorePort;
import me.golemcore.gaplens.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Three-tier memory on top of {@link StoragePort}.
 *
 * <p>
 * Layout under the workspace:
 * <ul>
 * <li>{@code sessions/<id>.json} - one record per session, rewritten atomically
 * after every stage</li>
 * <li>{@code long-term/<category>/<key>.json} - last-write-wins knowledge
 * entries</li>
 * <li>{@code traces/trace.jsonl} - append-only audit stream, one entry per
 * line</li>
 * </ul>
 *
 * <p>
 * Every durable write is attempted twice; the second failure surfaces as
 * {@link SessionPersistenceException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryStoreService implements MemoryStorePort {

    static final String SESSIONS_DIR = "sessions";
    static final String LONG_TERM_DIR = "long-term";
    static final String TRACES_DIR = "traces";
    static final String TRACE_FILE = "trace.jsonl";

    private static final String JSON_EXTENSION = ".json";
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ===== Session tier =====

    @Override
    public void saveSession(SessionState session) {
        String path = sessionPath(session.getId());
        String json = toJson(session, "session " + session.getId());
        writeWithRetry("session " + session.getId(),
                () -> storagePort.putTextAtomic(SESSIONS_DIR, path, json).join());
        log.debug("[Storage] Saved session {} ({} records)", session.getId(), session.getStageHistory().size());
    }

    @Override
    public Optional<SessionState> loadSession(String sessionId) {
        String json = read(SESSIONS_DIR, sessionPath(sessionId));
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, SessionState.class));
        } catch (JsonProcessingException e) {
            throw new SessionPersistenceException("Unreadable session record: " + sessionId, e);
        }
    }

    @Override
    public List<String> listSessionIds() {
        List<String> files = storagePort.listObjects(SESSIONS_DIR, "").join();
        return files.stream()
                .filter(file -> file.endsWith(JSON_EXTENSION) && !file.contains("/"))
                .map(file -> file.substring(0, file.length() - JSON_EXTENSION.length()))
                .toList();
    }

    @Override
    public int deleteSessionsOlderThan(Instant cutoff) {
        int deleted = 0;
        for (String sessionId : listSessionIds()) {
            Optional<SessionState> session;
            try {
                session = loadSession(sessionId);
            } catch (SessionPersistenceException | IllegalArgumentException e) {
                log.warn("[Storage] Skipping unreadable session {} during retention: {}", sessionId,
                        e.getMessage());
                continue;
            }
            // Only terminal sessions expire; a RUNNING one may be resumed later.
            if (session.isEmpty() || session.get().getStatus() == null
                    || !session.get().getStatus().isTerminal()) {
                continue;
            }
            Instant lastActivity = session.get().getUpdatedAt() != null
                    ? session.get().getUpdatedAt()
                    : session.get().getCreatedAt();
            if (lastActivity != null && lastActivity.isBefore(cutoff)) {
                storagePort.deleteObject(SESSIONS_DIR, sessionPath(sessionId)).join();
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("[Storage] Deleted {} sessions older than {}", deleted, cutoff);
        }
        return deleted;
    }

    // ===== Long-term tier =====

    @Override
    public void putLongTerm(String category, String key, Object value) {
        String path = longTermPath(category, key);
        LongTermEntry entry = new LongTermEntry(category, key, value, clock.instant());
        String json = toJson(entry, "long-term " + category + "/" + key);
        writeWithRetry("long-term " + category + "/" + key,
                () -> storagePort.putTextAtomic(LONG_TERM_DIR, path, json).join());
    }

    @Override
    public Optional<LongTermEntry> getLongTerm(String category, String key) {
        String json = read(LONG_TERM_DIR, longTermPath(category, key));
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(parseLongTerm(json, category + "/" + key));
    }

    @Override
    public List<LongTermEntry> listLongTerm(String category) {
        requireSafeName(category, "category");
        List<String> files = storagePort.listObjects(LONG_TERM_DIR, category).join();
        List<LongTermEntry> entries = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            String json = read(LONG_TERM_DIR, file);
            if (json != null && !json.isBlank()) {
                entries.add(parseLongTerm(json, file));
            }
        }
        return entries;
    }

    // ===== Trace tier =====

    @Override
    public void appendTrace(TraceEntry entry) {
        String line = toJson(entry, "trace entry") + "\n";
        writeWithRetry("trace", () -> storagePort.appendText(TRACES_DIR, TRACE_FILE, line).join());
    }

    @Override
    public List<TraceEntry> readTrace() {
        String content = read(TRACES_DIR, TRACE_FILE);
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<TraceEntry> entries = new ArrayList<>();
        int lineNumber = 0;
        for (String line : content.split("\n")) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, TraceEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("[Storage] Skipping malformed trace line {}: {}", lineNumber, e.getOriginalMessage());
            }
        }
        return entries;
    }

    // ===== Helpers =====

    private void writeWithRetry(String what, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException first) {
            log.warn("[Storage] Write of {} failed, retrying once: {}", what, first.getMessage());
            try {
                write.run();
            } catch (RuntimeException second) {
                second.addSuppressed(first);
                log.error("[Storage] Write of {} failed after retry", what, second);
                throw new SessionPersistenceException("Failed to persist " + what, second);
            }
        }
    }

    private String read(String directory, String path) {
        try {
            return storagePort.getText(directory, path).join();
        } catch (RuntimeException e) {
            throw new SessionPersistenceException("Failed to read " + directory + "/" + path, e);
        }
    }

    private LongTermEntry parseLongTerm(String json, String what) {
        try {
            return objectMapper.readValue(json, LongTermEntry.class);
        } catch (JsonProcessingException e) {
            throw new SessionPersistenceException("Unreadable long-term entry: " + what, e);
        }
    }

    private String toJson(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SessionPersistenceException("Failed to serialize " + what, e);
        }
    }

    private static String sessionPath(String sessionId) {
        requireSafeName(sessionId, "session id");
        return sessionId + JSON_EXTENSION;
    }

    private static String longTermPath(String category, String key) {
        requireSafeName(category, "category");
        requireSafeName(key, "key");
        return category + "/" + key + JSON_EXTENSION;
    }

    static void requireSafeName(String name, String what) {
        if (name == null || !SAFE_NAME.matcher(name).matches() || name.contains("..")) {
            throw new IllegalArgumentException("Invalid " + what + ": " + name);
        }
    }
}
