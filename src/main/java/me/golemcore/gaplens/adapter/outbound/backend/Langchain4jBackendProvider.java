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

import me.golemcore.gaplens.infrastructure.config.GapLensProperties;
import me.golemcore.gaplens.port.outbound.BackendPort;
import me.golemcore.gaplens.port.outbound.BackendProviderPort;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Builds live backends on top of langchain4j chat models.
 *
 * <p>
 * Supported backend names:
 * <ul>
 * <li>{@code anthropic} - Claude models via {@link AnthropicChatModel}
 * <li>{@code openai} - OpenAI and OpenAI-compatible endpoints via
 * {@link OpenAiChatModel}
 * <li>{@code groq} - Groq's OpenAI-compatible endpoint via
 * {@link OpenAiChatModel}
 * </ul>
 *
 * <p>
 * Credentials come from {@code gaplens.backend.providers.<name>.api-key} or the
 * per-run {@code api_key} param. Per-run params {@code model},
 * {@code base_url}, {@code temperature} and {@code max_tokens} override the
 * configured values. Models are built with {@code maxRetries(0)}: a failed call
 * is retried by the workflow engine on the stub backend, never on the live one.
 *
 * @see Langchain4jBackend
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jBackendProvider implements BackendProviderPort {

    static final String BACKEND_ANTHROPIC = "anthropic";
    static final String BACKEND_OPENAI = "openai";
    static final String BACKEND_GROQ = "groq";

    static final String GROQ_BASE_URL = "https://api.groq.com/openai/v1";

    static final String PARAM_API_KEY = "api_key";
    static final String PARAM_BASE_URL = "base_url";
    static final String PARAM_MODEL = "model";
    static final String PARAM_TEMPERATURE = "temperature";
    static final String PARAM_MAX_TOKENS = "max_tokens";

    private static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-7-sonnet-20250219";
    private static final String DEFAULT_OPENAI_MODEL = "gpt-4o-mini";
    private static final String DEFAULT_GROQ_MODEL = "llama-3.1-8b-instant";

    private final GapLensProperties properties;

    @Override
    public Set<String> getBackendNames() {
        return Set.of(BACKEND_ANTHROPIC, BACKEND_OPENAI, BACKEND_GROQ);
    }

    @Override
    public boolean hasCredentials(String backendName, Map<String, Object> params) {
        return resolveApiKey(backendName, params) != null;
    }

    @Override
    public BackendPort create(String backendName, Map<String, Object> params) {
        String apiKey = resolveApiKey(backendName, params);
        if (apiKey == null) {
            throw new IllegalStateException("Backend not configured: " + backendName
                    + ". Add gaplens.backend.providers." + backendName + ".api-key");
        }

        GapLensProperties.ProviderProperties config = providerConfig(backendName);
        String baseUrl = stringParam(params, PARAM_BASE_URL, config != null ? config.getBaseUrl() : null);
        String model = stringParam(params, PARAM_MODEL, config != null ? config.getModel() : null);
        double temperature = doubleParam(params, PARAM_TEMPERATURE, properties.getBackend().getTemperature());
        int maxTokens = (int) doubleParam(params, PARAM_MAX_TOKENS, properties.getBackend().getMaxTokens());
        Duration timeout = Duration.ofMillis(properties.getWorkflow().getStageTimeoutMs());

        ChatModel chatModel;
        if (BACKEND_ANTHROPIC.equals(backendName)) {
            model = model != null ? model : DEFAULT_ANTHROPIC_MODEL;
            var builder = AnthropicChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(model)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .maxRetries(0)
                    .timeout(timeout);
            if (baseUrl != null) {
                builder.baseUrl(baseUrl);
            }
            chatModel = builder.build();
        } else if (BACKEND_OPENAI.equals(backendName) || BACKEND_GROQ.equals(backendName)) {
            if (model == null) {
                model = BACKEND_GROQ.equals(backendName) ? DEFAULT_GROQ_MODEL : DEFAULT_OPENAI_MODEL;
            }
            baseUrl = baseUrlFor(backendName, baseUrl);
            var builder = OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(model)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .maxRetries(0)
                    .timeout(timeout);
            if (baseUrl != null) {
                builder.baseUrl(baseUrl);
            }
            chatModel = builder.build();
        } else {
            throw new IllegalArgumentException("Unsupported backend: " + backendName);
        }

        log.info("[Backend] Built {} backend with model {}", backendName, model);
        return new Langchain4jBackend(backendName, model, chatModel);
    }

    /**
     * Groq has no endpoint of its own in langchain4j; it is reached through the
     * OpenAI client pointed at Groq's compatible API.
     */
    static String baseUrlFor(String backendName, String configured) {
        if (configured != null) {
            return configured;
        }
        return BACKEND_GROQ.equals(backendName) ? GROQ_BASE_URL : null;
    }

    private String resolveApiKey(String backendName, Map<String, Object> params) {
        String fromParams = stringParam(params, PARAM_API_KEY, null);
        if (fromParams != null) {
            return fromParams;
        }
        GapLensProperties.ProviderProperties config = providerConfig(backendName);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            return null;
        }
        return config.getApiKey();
    }

    private GapLensProperties.ProviderProperties providerConfig(String backendName) {
        return properties.getBackend().getProviders().get(backendName);
    }

    private static String stringParam(Map<String, Object> params, String name, String defaultValue) {
        Object value = params != null ? params.get(name) : null;
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        return value.toString();
    }

    private static double doubleParam(Map<String, Object> params, String name, double defaultValue) {
        Object value = params != null ? params.get(name) : null;
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                log.warn("[Backend] Ignoring non-numeric param {}={}", name, value);
            }
        }
        return defaultValue;
    }
}
