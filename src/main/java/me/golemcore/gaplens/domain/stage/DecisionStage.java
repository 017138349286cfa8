package me.golemcore.gaplens.domain.stage;

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

import me.golemcore.gaplens.domain.exception.StageExecutionException;
import me.golemcore.gaplens.domain.model.ContextKeys;
import me.golemcore.gaplens.domain.model.EmployeeSkill;
import me.golemcore.gaplens.domain.model.GenerationResult;
import me.golemcore.gaplens.domain.model.ReasoningPattern;
import me.golemcore.gaplens.domain.model.Recommendation;
import me.golemcore.gaplens.domain.model.SkillGap;
import me.golemcore.gaplens.port.outbound.DataProviderPort;
import me.golemcore.gaplens.port.outbound.MemoryStorePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Final stage: turns skill gaps into upskill, transfer or hire
 * recommendations.
 *
 * <p>
 * Covered skills get a transfer of the strongest qualified employee. Skills
 * with a shortfall get an upskill plan for the first learner candidate, a
 * transfer when nobody can learn it, or a hire when nobody has it at all.
 * Ramp-up time depends on the starting level: beginner 4 weeks, intermediate 2,
 * advanced 1.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecisionStage implements StageContract {

    public static final String NAME = "decision";

    static final int HIRE_WEEKS = 8;

    private static final String LEVEL_BEGINNER = "beginner";
    private static final String LEVEL_INTERMEDIATE = "intermediate";
    private static final double CONFIDENCE = 0.7;

    private static final Map<String, Integer> TIMELINE_WEEKS = Map.of(
            LEVEL_BEGINNER, 4,
            LEVEL_INTERMEDIATE, 2,
            "advanced", 1,
            "expert", 1);

    private static final Map<String, Integer> LEVEL_RANK = Map.of(
            LEVEL_BEGINNER, 0,
            LEVEL_INTERMEDIATE, 1,
            "advanced", 2,
            "expert", 3);

    private final DataProviderPort dataProvider;
    private final BackendResponseParser responseParser;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<String> declaredInputs() {
        return Set.of(ContextKeys.NORMALIZED_QUESTION, ContextKeys.GAP_ANALYSIS);
    }

    @Override
    public Map<String, Class<?>> declaredOutputs() {
        return Map.of(ContextKeys.RECOMMENDATIONS, List.class);
    }

    @Override
    public StageResult execute(StageInput input, StageBackend backend, MemoryStorePort memory) {
        List<SkillGap> gaps = readGaps(input.get(ContextKeys.GAP_ANALYSIS));
        List<Recommendation> drafts = new ArrayList<>();
        for (SkillGap gap : gaps) {
            drafts.add(recommend(gap));
        }

        List<Map<String, Object>> recommendations = drafts.stream()
                .map(recommendation -> objectMapper.convertValue(recommendation,
                        new TypeReference<Map<String, Object>>() {
                        }))
                .toList();

        GenerationResult generation = backend.generate(
                buildPrompt(input.getString(ContextKeys.NORMALIZED_QUESTION), recommendations));
        if (!generation.isSuccess()) {
            return StageResult.backendFailure(generation);
        }
        Optional<JsonNode> parsed = responseParser.parseObject(generation.text());
        String rationale = parsed.map(node -> responseParser.text(node, "rationale"))
                .orElse(generation.text().trim());
        String overallRisk = parsed.map(node -> responseParser.text(node, "risk")).orElse("unknown");

        long upskill = drafts.stream().filter(r -> r.kind() == Recommendation.Kind.UPSKILL).count();
        long transfer = drafts.stream().filter(r -> r.kind() == Recommendation.Kind.TRANSFER).count();
        long hire = drafts.stream().filter(r -> r.kind() == Recommendation.Kind.HIRE).count();
        List<String> steps = List.of(
                "Branch: upskill " + upskill + ", transfer " + transfer + ", hire " + hire,
                "Evaluate: overall risk " + overallRisk,
                "Select: " + rationale);

        log.debug("[Workflow] Decision produced {} recommendations", recommendations.size());
        return StageResult.success(Map.of(ContextKeys.RECOMMENDATIONS, recommendations), ReasoningPattern.TOT,
                CONFIDENCE, steps);
    }

    private List<SkillGap> readGaps(Object gapAnalysis) {
        if (!(gapAnalysis instanceof Map<?, ?> analysis)) {
            throw new StageExecutionException(NAME, "gap_analysis is not an object");
        }
        Object rawGaps = analysis.get(AnalysisStage.FIELD_SKILL_GAPS);
        if (!(rawGaps instanceof List<?> gapList)) {
            throw new StageExecutionException(NAME, "gap_analysis has no skill_gaps list");
        }
        try {
            return gapList.stream()
                    .map(gap -> objectMapper.convertValue(gap, SkillGap.class))
                    .toList();
        } catch (IllegalArgumentException e) {
            throw new StageExecutionException(NAME, "Malformed skill gap: " + e.getMessage(), e);
        }
    }

    Recommendation recommend(SkillGap gap) {
        String risk = riskOf(gap.severity());
        if (gap.shortfall() == 0 && gap.supply() > 0) {
            return transfer(gap, "low");
        }
        if (!gap.learnerCandidates().isEmpty()) {
            String learner = gap.learnerCandidates().get(0);
            String level = levelOf(learner, gap.skill()).orElse(LEVEL_BEGINNER);
            return new Recommendation(Recommendation.Kind.UPSKILL, gap.skill(), learner, weeksFor(level), risk,
                    learner + " can grow " + gap.skill() + " from " + level + " to cover a shortfall of "
                            + gap.shortfall());
        }
        if (gap.supply() > 0) {
            return transfer(gap, risk);
        }
        return new Recommendation(Recommendation.Kind.HIRE, gap.skill(), gap.skill() + " Specialist", HIRE_WEEKS,
                risk, "Nobody holds " + gap.skill() + " and no learner is available" + marketNote(gap.skill()));
    }

    private Recommendation transfer(SkillGap gap, String risk) {
        String best = gap.qualifiedEmployees().get(0);
        String bestLevel = levelOf(best, gap.skill()).orElse(LEVEL_INTERMEDIATE);
        for (String candidate : gap.qualifiedEmployees()) {
            String level = levelOf(candidate, gap.skill()).orElse(LEVEL_INTERMEDIATE);
            if (rank(level) > rank(bestLevel)) {
                best = candidate;
                bestLevel = level;
            }
        }
        return new Recommendation(Recommendation.Kind.TRANSFER, gap.skill(), best, weeksFor(bestLevel), risk,
                best + " already holds " + gap.skill() + " at " + bestLevel + " level");
    }

    private Optional<String> levelOf(String employeeName, String skill) {
        return dataProvider.getEmployees().stream()
                .filter(employee -> employee.name().equals(employeeName))
                .findFirst()
                .flatMap(employee -> employee.findSkill(skill))
                .map(EmployeeSkill::level)
                .map(level -> level.toLowerCase(Locale.ROOT));
    }

    private String marketNote(String skill) {
        Map<String, Object> market = dataProvider.getSkillMarketData().get(skill);
        if (market == null || market.get("hourlyRate") == null) {
            return "";
        }
        return " (market rate " + market.get("hourlyRate") + "/h, demand " + market.get("demand") + ")";
    }

    static int weeksFor(String level) {
        return TIMELINE_WEEKS.getOrDefault(level, TIMELINE_WEEKS.get(LEVEL_BEGINNER));
    }

    private static int rank(String level) {
        return LEVEL_RANK.getOrDefault(level, 0);
    }

    static String riskOf(String severity) {
        if (SkillGap.SEVERITY_CRITICAL.equals(severity) || SkillGap.SEVERITY_HIGH.equals(severity)) {
            return "high";
        }
        if (SkillGap.SEVERITY_MEDIUM.equals(severity)) {
            return "medium";
        }
        return "low";
    }

    private String buildPrompt(String question, List<Map<String, Object>> recommendations) {
        String draftsJson;
        try {
            draftsJson = objectMapper.writeValueAsString(recommendations);
        } catch (JsonProcessingException e) {
            throw new StageExecutionException(NAME, "Failed to serialize recommendations", e);
        }
        return """
                Stage: decision
                Weigh the draft recommendations below (upskill, transfer, hire) and justify the plan.
                Reply with JSON only: {"rationale": "<short paragraph>", "risk": "low|medium|high"}

                Question: %s
                Draft recommendations: %s""".formatted(question, draftsJson);
    }
}
