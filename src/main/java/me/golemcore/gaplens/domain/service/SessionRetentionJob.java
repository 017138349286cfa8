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

import me.golemcore.gaplens.infrastructure.config.GapLensProperties;
import me.golemcore.gaplens.port.outbound.MemoryStorePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Deletes session records whose last activity is older than
 * {@code gaplens.memory.session-retention-days}. Runs hourly when
 * {@code gaplens.memory.retention-cleanup-enabled} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionRetentionJob {

    private static final long INTERVAL_HOURS = 1;
    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final MemoryStorePort memoryStore;
    private final GapLensProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService retentionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "session-retention");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        if (!properties.getMemory().isRetentionCleanupEnabled()) {
            log.info("[Storage] Session retention cleanup disabled");
            return;
        }
        retentionExecutor.scheduleAtFixedRate(this::runSafely, INTERVAL_HOURS, INTERVAL_HOURS, TimeUnit.HOURS);
    }

    @PreDestroy
    void destroy() {
        retentionExecutor.shutdownNow();
        try {
            retentionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Deletes expired sessions now.
     *
     * @return number of deleted session records
     */
    public int purgeExpiredSessions() {
        int retentionDays = properties.getMemory().getSessionRetentionDays();
        if (retentionDays <= 0) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int deleted = memoryStore.deleteSessionsOlderThan(cutoff);
        log.debug("[Storage] Retention pass removed {} sessions (cutoff {})", deleted, cutoff);
        return deleted;
    }

    void runSafely() {
        // An exception escaping here would cancel the schedule.
        try {
            purgeExpiredSessions();
        } catch (RuntimeException e) {
            log.error("[Storage] Retention pass failed: {}", e.getMessage(), e);
        }
    }
}
