package me.golemcore.gaplens.domain.service;

import me.golemcore.gaplens.adapter.outbound.backend.StubBackendAdapter;
import me.golemcore.gaplens.domain.model.BackendSelection;
import me.golemcore.gaplens.domain.model.GenerationOutcome;
import me.golemcore.gaplens.domain.model.GenerationResult;
import me.golemcore.gaplens.domain.model.TraceOutcome;
import me.golemcore.gaplens.port.outbound.BackendPort;
import me.golemcore.gaplens.port.outbound.BackendProviderPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BackendSelectorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private BackendProviderPort provider;
    private BackendPort liveBackend;
    private BackendSelector selector;

    @BeforeEach
    void setUp() {
        provider = mock(BackendProviderPort.class);
        liveBackend = mock(BackendPort.class);
        when(provider.getBackendNames()).thenReturn(Set.of("anthropic", "openai"));
        when(liveBackend.getBackendId()).thenReturn("anthropic");
        when(liveBackend.isAvailable()).thenReturn(true);

        selector = new BackendSelector(List.of(provider), List.of(new StubBackendAdapter()), CLOCK);
    }

    // ===== select =====

    @Test
    void shouldReturnLiveBackendWhenCredentialsPresent() {
        when(provider.hasCredentials("anthropic", Map.of())).thenReturn(true);
        when(provider.create("anthropic", Map.of())).thenReturn(liveBackend);

        BackendSelection selection = selector.select("anthropic", Map.of());

        assertFalse(selection.fallback());
        assertNull(selection.fallbackTrace());
        assertSame(liveBackend, selection.backend());
    }

    @Test
    void shouldCacheLiveBackendPerNameAndParams() {
        when(provider.hasCredentials(eq("anthropic"), anyMap())).thenReturn(true);
        when(provider.create(eq("anthropic"), anyMap())).thenAnswer(inv -> availableBackend());

        BackendSelection first = selector.select("anthropic", Map.of("temperature", 0.1));
        BackendSelection second = selector.select("Anthropic", Map.of("temperature", 0.1));
        BackendSelection other = selector.select("anthropic", Map.of("temperature", 0.9));

        assertSame(first.backend(), second.backend());
        assertNotSame(first.backend(), other.backend());
        verify(provider, times(2)).create(eq("anthropic"), anyMap());
    }

    @Test
    void shouldFallBackToStubWithoutCredentials() {
        when(provider.hasCredentials("anthropic", Map.of())).thenReturn(false);

        BackendSelection selection = selector.select("anthropic", Map.of());

        assertTrue(selection.fallback());
        assertEquals("stub", selection.backendId());
        assertEquals(TraceOutcome.FALLBACK, selection.fallbackTrace().getOutcome());
        assertEquals("anthropic", selection.fallbackTrace().getInputs().get("requested"));
        verify(provider, never()).create(anyString(), anyMap());
    }

    @Test
    void shouldFallBackToStubWhenConstructionFails() {
        when(provider.hasCredentials("openai", Map.of())).thenReturn(true);
        when(provider.create("openai", Map.of())).thenThrow(new IllegalStateException("bad base url"));

        BackendSelection selection = selector.select("openai", Map.of());

        assertTrue(selection.fallback());
        assertTrue(selection.fallbackTrace().getMessage().contains("bad base url"));
    }

    @Test
    void shouldFallBackToStubWhenLiveBackendIsUnavailable() {
        when(liveBackend.isAvailable()).thenReturn(false);
        when(provider.hasCredentials("anthropic", Map.of())).thenReturn(true);
        when(provider.create("anthropic", Map.of())).thenReturn(liveBackend);

        BackendSelection selection = selector.select("anthropic", Map.of());

        assertTrue(selection.fallback());
        assertEquals("stub", selection.backendId());
        assertTrue(selection.fallbackTrace().getMessage().contains("not available"));
    }

    @Test
    void shouldFallBackForUnknownBackendName() {
        BackendSelection selection = selector.select("gemini", Map.of());

        assertTrue(selection.fallback());
        assertEquals("stub", selection.backendId());
    }

    @Test
    void shouldSelectStubDirectlyWithoutFallbackFlag() {
        BackendSelection selection = selector.select("stub", null);

        assertFalse(selection.fallback());
        assertEquals("stub", selection.backendId());
    }

    @Test
    void fallbackPathShouldAlwaysReturnStub() {
        BackendSelection selection = selector.fallback();

        assertTrue(selection.fallback());
        assertSame(selector.getStubBackend(), selection.backend());
        assertEquals(CLOCK.instant(), selection.fallbackTrace().getTimestamp());
    }

    @Test
    void shouldRequireStubBackend() {
        List<BackendPort> noStub = List.of(liveBackend);
        List<BackendProviderPort> providers = List.of(provider);

        assertThrows(IllegalStateException.class, () -> new BackendSelector(providers, noStub, CLOCK));
    }

    // ===== generate =====

    @Test
    void generateShouldReturnOkResult() {
        when(liveBackend.generate(anyString(), anyMap())).thenReturn(CompletableFuture.completedFuture("text"));

        GenerationResult result = selector.generate(liveBackend, "prompt", Map.of(), 1000);

        assertTrue(result.isSuccess());
        assertEquals("text", result.text());
        assertEquals("anthropic", result.backendId());
    }

    @Test
    void generateShouldReportFailedFutureAsUnavailable() {
        when(liveBackend.generate(anyString(), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("connection refused")));

        GenerationResult result = selector.generate(liveBackend, "prompt", Map.of(), 1000);

        assertEquals(GenerationOutcome.UNAVAILABLE, result.outcome());
        assertEquals("connection refused", result.errorMessage());
    }

    @Test
    void generateShouldReportSynchronousThrowAsUnavailable() {
        when(liveBackend.generate(anyString(), any())).thenThrow(new IllegalStateException("closed"));

        GenerationResult result = selector.generate(liveBackend, "prompt", null, 1000);

        assertEquals(GenerationOutcome.UNAVAILABLE, result.outcome());
    }

    @Test
    void generateShouldTimeOutAndCancelHangingCall() {
        CompletableFuture<String> hanging = new CompletableFuture<>();
        when(liveBackend.generate(anyString(), anyMap())).thenReturn(hanging);

        GenerationResult result = selector.generate(liveBackend, "prompt", Map.of(), 50);

        assertEquals(GenerationOutcome.TIMEOUT, result.outcome());
        assertTrue(result.outcome().isRecoverableFailure());
        assertTrue(hanging.isCancelled());
    }

    @Test
    void generateShouldTreatNullTextAsUnavailable() {
        when(liveBackend.generate(anyString(), anyMap())).thenReturn(CompletableFuture.completedFuture(null));

        GenerationResult result = selector.generate(liveBackend, "prompt", Map.of(), 1000);

        assertEquals(GenerationOutcome.UNAVAILABLE, result.outcome());
    }

    private static BackendPort availableBackend() {
        BackendPort backend = mock(BackendPort.class);
        when(backend.isAvailable()).thenReturn(true);
        return backend;
    }
}
