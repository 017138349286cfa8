package me.golemcore.gaplens.adapter.outbound.backend;

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

import me.golemcore.gaplens.domain.exception.BackendUnavailableException;
import me.golemcore.gaplens.port.outbound.BackendPort;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live backend wrapping a langchain4j {@link ChatModel}. Instances are immutable
 * and safe to share between sessions.
 *
 * <p>
 * Blocking model calls run on a dedicated pool that starts a thread per
 * in-flight call, so a slow call never delays the start of another session's
 * call. Cancelling the returned future interrupts the call's thread.
 */
@Slf4j
public class Langchain4jBackend implements BackendPort {

    static final String PARAM_SYSTEM_PROMPT = "system_prompt";

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ExecutorService BACKEND_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "gaplens-backend-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final String backendId;
    private final String model;
    private final ChatModel chatModel;

    public Langchain4jBackend(String backendId, String model, ChatModel chatModel) {
        this.backendId = backendId;
        this.model = model;
        this.chatModel = chatModel;
    }

    @Override
    public String getBackendId() {
        return backendId;
    }

    public String getModel() {
        return model;
    }

    @Override
    public CompletableFuture<String> generate(String prompt, Map<String, Object> params) {
        CompletableFuture<String> result = new CompletableFuture<>();
        Future<?> call = BACKEND_EXECUTOR.submit(() -> {
            try {
                result.complete(chat(prompt, params));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((text, error) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        return result;
    }

    private String chat(String prompt, Map<String, Object> params) {
        List<ChatMessage> messages = new ArrayList<>();
        Object systemPrompt = params != null ? params.get(PARAM_SYSTEM_PROMPT) : null;
        if (systemPrompt != null && !systemPrompt.toString().isBlank()) {
            messages.add(SystemMessage.from(systemPrompt.toString()));
        }
        messages.add(UserMessage.from(prompt));

        try {
            ChatResponse response = chatModel.chat(messages);
            if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
                throw new BackendUnavailableException(backendId, "Empty response from " + backendId);
            }
            return response.aiMessage().text();
        } catch (BackendUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Backend] {} call failed: {}", backendId, e.getMessage());
            throw new BackendUnavailableException(backendId, backendId + " call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }
}
