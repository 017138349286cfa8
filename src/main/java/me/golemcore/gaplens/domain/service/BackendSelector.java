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

import me.golemcore.gaplens.domain.model.BackendSelection;
import me.golemcore.gaplens.domain.model.GenerationResult;
import me.golemcore.gaplens.domain.model.TraceEntry;
import me.golemcore.gaplens.domain.model.TraceOutcome;
import me.golemcore.gaplens.port.outbound.BackendPort;
import me.golemcore.gaplens.port.outbound.BackendProviderPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a backend name into a callable backend, falling back to the stub.
 *
 * <p>
 * Selection order:
 * <ol>
 * <li>find the provider that serves the name and check its credentials</li>
 * <li>return the cached live backend for {@code (name, params)}, building it on
 * first use</li>
 * <li>otherwise return the stub, flagged as a fallback with a
 * {@link TraceOutcome#FALLBACK} trace entry for the caller to record</li>
 * </ol>
 * Construction failures of a live backend, and live backends that report
 * themselves unavailable, also end in the stub.
 *
 * <p>
 * {@link #generate} bounds every backend call with a timeout and converts all
 * failures into a {@link GenerationResult}; it never throws.
 */
@Service
@Slf4j
public class BackendSelector {

    public static final String STUB_BACKEND_ID = "stub";

    private static final String ACTOR = "backend-selector";

    private final List<BackendProviderPort> providers;
    private final BackendPort stubBackend;
    private final Clock clock;

    private final Map<CacheKey, BackendPort> liveBackends = new ConcurrentHashMap<>();

    public BackendSelector(List<BackendProviderPort> providers, List<BackendPort> backends, Clock clock) {
        this.providers = providers;
        this.clock = clock;
        this.stubBackend = backends.stream()
                .filter(backend -> STUB_BACKEND_ID.equals(backend.getBackendId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No stub backend registered"));
    }

    public BackendSelection select(String backendName, Map<String, Object> params) {
        String name = backendName != null ? backendName.trim().toLowerCase(Locale.ROOT) : "";
        Map<String, Object> safeParams = params != null ? params : Map.of();

        if (STUB_BACKEND_ID.equals(name)) {
            return BackendSelection.live(stubBackend);
        }

        BackendProviderPort provider = providers.stream()
                .filter(candidate -> candidate.getBackendNames().contains(name))
                .findFirst()
                .orElse(null);
        if (provider == null) {
            return fallbackFor(name, "Unknown backend '" + backendName + "'");
        }
        if (!provider.hasCredentials(name, safeParams)) {
            return fallbackFor(name, "No credentials for backend '" + name + "'");
        }

        CacheKey key = new CacheKey(name, new HashMap<>(safeParams));
        BackendPort backend = liveBackends.get(key);
        if (backend == null) {
            try {
                backend = liveBackends.computeIfAbsent(key, k -> provider.create(name, safeParams));
                log.info("[Backend] Selected live backend {}", backend.getBackendId());
            } catch (RuntimeException e) {
                log.warn("[Backend] Failed to build backend '{}': {}", name, e.getMessage());
                return fallbackFor(name, "Failed to build backend '" + name + "': " + e.getMessage());
            }
        }
        if (!backend.isAvailable()) {
            return fallbackFor(name, "Backend '" + name + "' is not available");
        }
        return BackendSelection.live(backend);
    }

    /**
     * The stub path used when a live generation has to be retried.
     */
    public BackendSelection fallback() {
        return fallbackFor(null, "Retrying on stub backend");
    }

    /**
     * Calls the backend and waits at most {@code timeoutMs}. A call that does
     * not finish in time is cancelled and reported as a timeout.
     */
    public GenerationResult generate(BackendPort backend, String prompt, Map<String, Object> params,
            long timeoutMs) {
        String backendId = backend.getBackendId();
        long start = System.nanoTime();
        CompletableFuture<String> future;
        try {
            future = backend.generate(prompt, params != null ? params : Map.of());
        } catch (RuntimeException e) {
            return GenerationResult.unavailable(backendId, describe(e), elapsedMs(start));
        }

        try {
            String text = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (text == null) {
                return GenerationResult.unavailable(backendId, "Empty response", elapsedMs(start));
            }
            return GenerationResult.ok(backendId, text, elapsedMs(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Backend] {} timed out after {}ms", backendId, timeoutMs);
            return GenerationResult.timeout(backendId, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Backend] {} failed: {}", backendId, describe(cause));
            return GenerationResult.unavailable(backendId, describe(cause), elapsedMs(start));
        } catch (CancellationException e) {
            return GenerationResult.unavailable(backendId, "Call cancelled", elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return GenerationResult.unavailable(backendId, "Interrupted while waiting", elapsedMs(start));
        }
    }

    public BackendPort getStubBackend() {
        return stubBackend;
    }

    private BackendSelection fallbackFor(String requested, String reason) {
        if (requested != null) {
            log.warn("[Backend] {}; falling back to {}", reason, STUB_BACKEND_ID);
        }
        Map<String, Object> inputs = new LinkedHashMap<>();
        if (requested != null) {
            inputs.put("requested", requested);
        }
        TraceEntry trace = TraceEntry.builder()
                .actor(ACTOR)
                .inputs(inputs)
                .outputs(Map.of("backend", STUB_BACKEND_ID))
                .durationMs(0)
                .outcome(TraceOutcome.FALLBACK)
                .message(reason)
                .timestamp(clock.instant())
                .build();
        return BackendSelection.fallback(stubBackend, trace);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record CacheKey(String name, Map<String, Object> params) {
    }
}
