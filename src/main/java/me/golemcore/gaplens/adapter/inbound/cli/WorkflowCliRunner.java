package me.golemcore.gaplens.adapter.inbound.cli;

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

import me.golemcore.gaplens.domain.model.ContextKeys;
import me.golemcore.gaplens.domain.model.SessionResult;
import me.golemcore.gaplens.domain.model.StageRecord;
import me.golemcore.gaplens.domain.model.WorkflowConfig;
import me.golemcore.gaplens.port.inbound.WorkflowPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point. Runs one session when started with
 * {@code --question}:
 *
 * <pre>
 * java -jar gaplens-workflow.jar --question="What skills do we need for a React project?" \
 *     [--backend=anthropic|openai|stub] [--session=&lt;id&gt;] [--project=&lt;project id&gt;]
 * </pre>
 *
 * Without {@code --question} but with {@code --session} the stored session is
 * resumed. Without either option nothing runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowCliRunner implements ApplicationRunner {

    static final String OPTION_QUESTION = "question";
    static final String OPTION_BACKEND = "backend";
    static final String OPTION_SESSION = "session";
    static final String OPTION_PROJECT = "project";

    private static final String SEPARATOR = "=".repeat(60);

    private final WorkflowPort workflowPort;

    @Override
    public void run(ApplicationArguments args) {
        String question = option(args, OPTION_QUESTION);
        String sessionId = option(args, OPTION_SESSION);
        if (question == null && sessionId == null) {
            log.info("[Cli] No --question or --session given, nothing to run");
            return;
        }

        WorkflowConfig config = toConfig(option(args, OPTION_BACKEND), option(args, OPTION_PROJECT));
        log.info("[Cli] Running session {} on backend {}", sessionId != null ? sessionId : "(new)",
                config.getBackendName() != null ? config.getBackendName() : "(configured)");
        SessionResult result = workflowPort.run(sessionId, question, config);
        print(result, System.out);
    }

    static WorkflowConfig toConfig(String backend, String projectId) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (projectId != null) {
            params.put(ContextKeys.PARAM_PROJECT_ID, projectId);
        }
        return WorkflowConfig.builder()
                .backendName(backend)
                .params(params)
                .build();
    }

    static String format(SessionResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(SEPARATOR).append('\n');
        sb.append("Session: ").append(result.sessionId()).append('\n');
        sb.append("Status: ").append(result.status());
        if (!result.durable()) {
            sb.append(" (not persisted)");
        }
        sb.append('\n');
        if (result.error() != null) {
            sb.append("Error: ").append(result.error().type()).append(" at ")
                    .append(result.error().stage() != null ? result.error().stage() : "-")
                    .append(": ").append(result.error().message()).append('\n');
        }
        sb.append(SEPARATOR).append('\n');

        for (StageRecord record : result.stageHistory()) {
            sb.append(String.format("%-12s %-6s backend=%s%s confidence=%s%n", record.getStageName(),
                    record.getReasoningPatternTag() != null ? record.getReasoningPatternTag() : "-",
                    record.getBackendId(), record.isFallbackUsed() ? " (fallback)" : "",
                    record.getConfidence() != null ? String.format("%.2f", record.getConfidence()) : "-"));
        }

        Map<String, Object> context = result.context();
        appendValue(sb, "Intent", context.get(ContextKeys.INTENT));
        appendValue(sb, "Entities", context.get(ContextKeys.ENTITIES));
        appendValue(sb, "Question", context.get(ContextKeys.NORMALIZED_QUESTION));

        if (context.get(ContextKeys.RECOMMENDATIONS) instanceof List<?> recommendations) {
            sb.append("Recommendations:\n");
            for (Object item : recommendations) {
                if (item instanceof Map<?, ?> recommendation) {
                    sb.append(String.format("  - %s %s -> %s (%s weeks, risk %s)%n", recommendation.get("kind"),
                            recommendation.get("skill"), recommendation.get("target"),
                            recommendation.get("timelineWeeks"), recommendation.get("risk")));
                }
            }
        }
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, String label, Object value) {
        if (value != null) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }

    private static void print(SessionResult result, PrintStream out) {
        out.print(format(result));
        out.flush();
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
