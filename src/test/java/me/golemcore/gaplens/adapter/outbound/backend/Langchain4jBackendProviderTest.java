package me.golemcore.gaplens.adapter.outbound.backend;

import me.golemcore.gaplens.domain.exception.BackendUnavailableException;
import me.golemcore.gaplens.infrastructure.config.GapLensProperties;
import me.golemcore.gaplens.port.outbound.BackendPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class Langchain4jBackendProviderTest {

    private GapLensProperties properties;
    private Langchain4jBackendProvider provider;

    @BeforeEach
    void setUp() {
        properties = new GapLensProperties();
        provider = new Langchain4jBackendProvider(properties);
    }

    private void configureKey(String backend, String apiKey) {
        GapLensProperties.ProviderProperties config = new GapLensProperties.ProviderProperties();
        config.setApiKey(apiKey);
        properties.getBackend().getProviders().put(backend, config);
    }

    // ===== Credentials =====

    @Test
    void shouldServeAnthropicOpenaiAndGroq() {
        assertEquals(Set.of("anthropic", "openai", "groq"), provider.getBackendNames());
    }

    @Test
    void shouldReportMissingCredentialsWhenNothingConfigured() {
        assertFalse(provider.hasCredentials("anthropic", Map.of()));
        assertFalse(provider.hasCredentials("openai", null));
    }

    @Test
    void shouldTreatBlankConfiguredKeyAsMissing() {
        configureKey("anthropic", "  ");

        assertFalse(provider.hasCredentials("anthropic", Map.of()));
    }

    @Test
    void shouldAcceptConfiguredKey() {
        configureKey("openai", "sk-test");

        assertTrue(provider.hasCredentials("openai", Map.of()));
        assertFalse(provider.hasCredentials("anthropic", Map.of()));
    }

    @Test
    void shouldAcceptKeyFromParams() {
        assertTrue(provider.hasCredentials("anthropic", Map.of("api_key", "sk-ant-test")));
    }

    // ===== Construction =====

    @Test
    void shouldBuildOpenAiBackendWithoutNetwork() {
        configureKey("openai", "sk-test");

        BackendPort backend = provider.create("openai", Map.of("model", "gpt-4o", "temperature", 0.5));

        assertEquals("openai", backend.getBackendId());
        assertTrue(backend.isAvailable());
        assertEquals("gpt-4o", ((Langchain4jBackend) backend).getModel());
    }

    @Test
    void shouldBuildAnthropicBackendWithDefaultModel() {
        configureKey("anthropic", "sk-ant-test");

        BackendPort backend = provider.create("anthropic", Map.of());

        assertEquals("claude-3-7-sonnet-20250219", ((Langchain4jBackend) backend).getModel());
    }

    @Test
    void shouldBuildGroqBackendWithDefaultModel() {
        configureKey("groq", "gsk-test");

        BackendPort backend = provider.create("groq", Map.of());

        assertEquals("groq", backend.getBackendId());
        assertTrue(backend.isAvailable());
        assertEquals("llama-3.1-8b-instant", ((Langchain4jBackend) backend).getModel());
    }

    @Test
    void groqShouldTalkToGroqEndpointUnlessOverridden() {
        assertEquals("https://api.groq.com/openai/v1", Langchain4jBackendProvider.baseUrlFor("groq", null));
        assertEquals("http://localhost:8080/v1",
                Langchain4jBackendProvider.baseUrlFor("groq", "http://localhost:8080/v1"));
        assertNull(Langchain4jBackendProvider.baseUrlFor("openai", null));
    }

    @Test
    void shouldRefuseToBuildWithoutCredentials() {
        assertThrows(IllegalStateException.class, () -> provider.create("anthropic", Map.of()));
    }

    @Test
    void shouldRejectUnsupportedBackend() {
        assertThrows(IllegalArgumentException.class,
                () -> provider.create("gemini", Map.of("api_key", "x")));
    }

    // ===== Generation =====

    @Test
    void shouldReturnModelText() throws Exception {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("{\"intent\":\"x\"}"))
                .build());
        Langchain4jBackend backend = new Langchain4jBackend("openai", "gpt-4o-mini", chatModel);

        assertEquals("{\"intent\":\"x\"}", backend.generate("Stage: perception", Map.of()).get());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendSystemPromptFromParams() throws Exception {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());
        Langchain4jBackend backend = new Langchain4jBackend("anthropic", "m", chatModel);

        backend.generate("prompt", Map.of("system_prompt", "Be brief")).get();

        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(2, captor.getValue().size());
        assertInstanceOf(SystemMessage.class, captor.getValue().get(0));
    }

    @Test
    void shouldWrapModelFailureAsBackendUnavailable() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("429 rate limited"));
        Langchain4jBackend backend = new Langchain4jBackend("openai", "gpt-4o-mini", chatModel);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> backend.generate("prompt", Map.of()).get());
        assertInstanceOf(BackendUnavailableException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("429"));
    }

    @Test
    void concurrentCallsShouldAllRunAtOnce() throws Exception {
        int calls = ForkJoinPool.getCommonPoolParallelism() + 2;
        CountDownLatch started = new CountDownLatch(calls);
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenAnswer(invocation -> {
            started.countDown();
            boolean allStarted = started.await(5, TimeUnit.SECONDS);
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from(allStarted ? "ok" : "starved"))
                    .build();
        });
        Langchain4jBackend backend = new Langchain4jBackend("openai", "gpt-4o-mini", chatModel);

        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < calls; i++) {
            futures.add(backend.generate("prompt " + i, Map.of()));
        }

        for (CompletableFuture<String> future : futures) {
            assertEquals("ok", future.get(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void cancellingCallShouldInterruptModel() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenAnswer(invocation -> {
            entered.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return ChatResponse.builder().aiMessage(AiMessage.from("late")).build();
        });
        Langchain4jBackend backend = new Langchain4jBackend("anthropic", "m", chatModel);

        CompletableFuture<String> future = backend.generate("prompt", Map.of());
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        future.cancel(true);

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        assertTrue(future.isCancelled());
    }
}
