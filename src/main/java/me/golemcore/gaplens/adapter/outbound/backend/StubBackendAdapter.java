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

import me.golemcore.gaplens.port.outbound.BackendPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Deterministic backend used when no live backend can be selected or when a
 * live call fails. Returns canned JSON keyed on the {@code Stage: <name>} marker
 * that every stage prompt starts with, so downstream parsing behaves the same
 * as with a real model.
 */
@Component
@Slf4j
public class StubBackendAdapter implements BackendPort {

    public static final String BACKEND_ID = "stub";

    static final String PERCEPTION_RESPONSE = """
            {"intent": "skills_analysis", "entities": [], "reasoning": "Input parsed with keyword matching"}""";

    static final String ANALYSIS_RESPONSE = """
            {"summary": "Skill gaps computed from project demand and qualified staff.", \
            "risk_factors": ["Single points of expertise", "Learning curve on new skills"]}""";

    static final String DECISION_RESPONSE = """
            {"rationale": "Prefer upskilling where a learner exists, transfer qualified staff next, \
            hire only for uncovered skills.", "risk": "medium"}""";

    static final String DEFAULT_RESPONSE = "{\"text\": \"Stub response\"}";

    @Override
    public String getBackendId() {
        return BACKEND_ID;
    }

    @Override
    public CompletableFuture<String> generate(String prompt, Map<String, Object> params) {
        String response = respond(prompt);
        log.debug("[Backend] Stub answered {} chars", response.length());
        return CompletableFuture.completedFuture(response);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private String respond(String prompt) {
        String marker = stageMarker(prompt);
        return switch (marker) {
        case "perception" -> PERCEPTION_RESPONSE;
        case "analysis" -> ANALYSIS_RESPONSE;
        case "decision" -> DECISION_RESPONSE;
        default -> DEFAULT_RESPONSE;
        };
    }

    private static String stageMarker(String prompt) {
        if (prompt == null) {
            return "";
        }
        String firstLine = prompt.lines().findFirst().orElse("").trim().toLowerCase(Locale.ROOT);
        if (!firstLine.startsWith("stage:")) {
            return "";
        }
        return firstLine.substring("stage:".length()).trim();
    }
}
