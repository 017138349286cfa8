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

import me.golemcore.gaplens.domain.exception.SessionPersistenceException;
import me.golemcore.gaplens.domain.exception.StageExecutionException;
import me.golemcore.gaplens.domain.model.ContextKeys;
import me.golemcore.gaplens.domain.model.Employee;
import me.golemcore.gaplens.domain.model.EmployeeSkill;
import me.golemcore.gaplens.domain.model.GenerationResult;
import me.golemcore.gaplens.domain.model.Project;
import me.golemcore.gaplens.domain.model.ReasoningPattern;
import me.golemcore.gaplens.domain.model.SkillGap;
import me.golemcore.gaplens.domain.model.Team;
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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Second stage: computes skill gaps between project demand and qualified staff.
 *
 * <p>
 * For every skill required by the projects in scope, demand is the number of
 * projects requiring it and supply the number of employees holding it at
 * intermediate level or above. Skills named in the question are always
 * reported. With the {@code project_id} param only that project is in scope.
 * For each reported skill the teams already covering it are listed.
 * The backend is asked to summarize the computed gaps; its answer is attached
 * but never changes the numbers.
 *
 * <p>
 * Each reported gap is also written to the long-term store under
 * {@code skills/<skill>}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalysisStage implements StageContract {

    public static final String NAME = "analysis";

    public static final String LONG_TERM_CATEGORY = "skills";

    static final String FIELD_SKILL_GAPS = "skill_gaps";
    static final String FIELD_SUMMARY = "summary";
    static final String FIELD_RISK_FACTORS = "risk_factors";
    static final String FIELD_SCOPE = "scope";
    static final String FIELD_PROJECT_ID = "project_id";
    static final String FIELD_TEAM_COVERAGE = "team_coverage";

    private static final String DEFAULT_SCOPE = "company";
    private static final String HIGH_CAPACITY = "high";
    private static final int MAX_LEARNERS = 3;
    private static final double CONFIDENCE = 0.75;

    private final DataProviderPort dataProvider;
    private final SkillCatalog skillCatalog;
    private final BackendResponseParser responseParser;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<String> declaredInputs() {
        return Set.of(ContextKeys.NORMALIZED_QUESTION);
    }

    @Override
    public Map<String, Class<?>> declaredOutputs() {
        return Map.of(ContextKeys.GAP_ANALYSIS, Map.class);
    }

    @Override
    public StageResult execute(StageInput input, StageBackend backend, MemoryStorePort memory) {
        String question = input.getString(ContextKeys.NORMALIZED_QUESTION);
        if (question == null || question.isBlank()) {
            throw new StageExecutionException(NAME, "No question provided for analysis");
        }
        String projectId = input.param(ContextKeys.PARAM_PROJECT_ID);
        String scope = Optional.ofNullable(input.param(ContextKeys.PARAM_SCOPE)).orElse(DEFAULT_SCOPE);

        List<Project> projects = projectsInScope(projectId);
        List<String> focusSkills = skillCatalog.extractSkills(question);
        List<SkillGap> gaps = computeGaps(projects, focusSkills);
        List<Team> teams = dataProvider.getTeams();
        Map<String, List<String>> teamCoverage = teamCoverage(gaps, teams);

        List<Map<String, Object>> gapMaps = gaps.stream()
                .map(gap -> objectMapper.convertValue(gap, new TypeReference<Map<String, Object>>() {
                }))
                .toList();

        GenerationResult generation = backend.generate(buildPrompt(question, projectId, gapMaps, teamCoverage));
        if (!generation.isSuccess()) {
            return StageResult.backendFailure(generation);
        }
        Optional<JsonNode> parsed = responseParser.parseObject(generation.text());
        String summary = parsed.map(node -> responseParser.text(node, FIELD_SUMMARY))
                .orElse(generation.text().trim());
        List<String> riskFactors = parsed.map(node -> responseParser.textList(node, FIELD_RISK_FACTORS))
                .orElse(List.of());

        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put(FIELD_SCOPE, scope);
        if (projectId != null) {
            analysis.put(FIELD_PROJECT_ID, projectId);
        }
        analysis.put(FIELD_SKILL_GAPS, gapMaps);
        analysis.put(FIELD_TEAM_COVERAGE, teamCoverage);
        analysis.put(FIELD_SUMMARY, summary);
        analysis.put(FIELD_RISK_FACTORS, riskFactors);

        List<String> steps = new ArrayList<>();
        steps.add("Reason: " + projects.size() + " projects and " + teams.size() + " teams in scope, focus skills "
                + focusSkills);
        steps.add("Evaluate: " + gaps.size() + " skills reported, "
                + gaps.stream().filter(gap -> gap.shortfall() > 0).count() + " with a shortfall");
        steps.add(rememberDemand(input.sessionId(), gaps, memory));
        steps.add("Check: backend summary " + (parsed.isPresent() ? "parsed" : "kept as text"));

        log.debug("[Workflow] Analysis reported {} gaps for scope {}", gaps.size(), scope);
        return StageResult.success(Map.of(ContextKeys.GAP_ANALYSIS, analysis), ReasoningPattern.REACT, CONFIDENCE,
                steps);
    }

    private List<Project> projectsInScope(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            return dataProvider.getProjects();
        }
        return dataProvider.getProject(projectId)
                .map(List::of)
                .orElseThrow(() -> new StageExecutionException(NAME, "Unknown project: " + projectId));
    }

    List<SkillGap> computeGaps(List<Project> projects, List<String> focusSkills) {
        Set<String> required = new LinkedHashSet<>(focusSkills);
        for (Project project : projects) {
            required.addAll(project.requiredSkills());
        }
        List<Employee> employees = dataProvider.getEmployees();

        List<SkillGap> gaps = new ArrayList<>();
        for (String skill : required) {
            boolean focus = focusSkills.stream().anyMatch(skill::equalsIgnoreCase);
            int projectDemand = (int) projects.stream()
                    .filter(project -> project.requiredSkills().stream().anyMatch(skill::equalsIgnoreCase))
                    .count();
            int demand = focus ? Math.max(1, projectDemand) : projectDemand;

            List<String> qualified = new ArrayList<>();
            List<String> learners = new ArrayList<>();
            for (Employee employee : employees) {
                Optional<EmployeeSkill> held = employee.findSkill(skill);
                if (held.isPresent() && held.get().isAtLeastIntermediate()) {
                    qualified.add(employee.name());
                } else if (held.isPresent()) {
                    learners.add(0, employee.name());
                } else if (HIGH_CAPACITY.equalsIgnoreCase(employee.upskillingCapacity())) {
                    learners.add(employee.name());
                }
            }
            int supply = qualified.size();
            if (!focus && supply >= demand) {
                continue;
            }
            List<String> candidates = learners.subList(0, Math.min(MAX_LEARNERS, learners.size()));
            gaps.add(new SkillGap(skill, demand, supply, qualified, candidates, severity(demand, supply), focus));
        }

        gaps.sort(Comparator.comparing(SkillGap::focus).reversed()
                .thenComparing(gap -> severityRank(gap.severity()))
                .thenComparing(gap -> gap.skill().toLowerCase(Locale.ROOT)));
        return gaps;
    }

    static Map<String, List<String>> teamCoverage(List<SkillGap> gaps, List<Team> teams) {
        Map<String, List<String>> coverage = new LinkedHashMap<>();
        for (SkillGap gap : gaps) {
            List<String> covering = teams.stream()
                    .filter(team -> team.skillsCoverage().entrySet().stream()
                            .anyMatch(entry -> entry.getKey().equalsIgnoreCase(gap.skill()) && entry.getValue() != null
                                    && entry.getValue() > 0))
                    .map(Team::name)
                    .toList();
            coverage.put(gap.skill(), covering);
        }
        return coverage;
    }

    private String rememberDemand(String sessionId, List<SkillGap> gaps, MemoryStorePort memory) {
        try {
            for (SkillGap gap : gaps) {
                Map<String, Object> value = new LinkedHashMap<>();
                value.put("skill", gap.skill());
                value.put("demand", gap.demand());
                value.put("supply", gap.supply());
                value.put("severity", gap.severity());
                value.put("lastSessionId", sessionId);
                memory.putLongTerm(LONG_TERM_CATEGORY, SkillCatalog.keyOf(gap.skill()), value);
            }
            return "Act: stored demand for " + gaps.size() + " skills in long-term memory";
        } catch (SessionPersistenceException e) {
            log.warn("[Workflow] Long-term update failed for session {}: {}", sessionId, e.getMessage());
            return "Act: long-term update skipped (" + e.getMessage() + ")";
        }
    }

    static String severity(int demand, int supply) {
        if (supply == 0) {
            return SkillGap.SEVERITY_CRITICAL;
        }
        int shortfall = demand - supply;
        if (shortfall >= 2) {
            return SkillGap.SEVERITY_HIGH;
        }
        if (shortfall == 1) {
            return SkillGap.SEVERITY_MEDIUM;
        }
        return SkillGap.SEVERITY_LOW;
    }

    static int severityRank(String severity) {
        return switch (severity) {
        case SkillGap.SEVERITY_CRITICAL -> 0;
        case SkillGap.SEVERITY_HIGH -> 1;
        case SkillGap.SEVERITY_MEDIUM -> 2;
        default -> 3;
        };
    }

    private String buildPrompt(String question, String projectId, List<Map<String, Object>> gaps,
            Map<String, List<String>> teamCoverage) {
        String gapsJson;
        String teamsJson;
        try {
            gapsJson = objectMapper.writeValueAsString(gaps);
            teamsJson = objectMapper.writeValueAsString(teamCoverage);
        } catch (JsonProcessingException e) {
            throw new StageExecutionException(NAME, "Failed to serialize skill gaps", e);
        }
        String focus = projectId != null ? "Focus on project " + projectId + " only." : "Consider all projects.";
        return """
                Stage: analysis
                Summarize the skill gaps below and name the main risks. %s
                Reply with JSON only: {"summary": "<short summary>", "risk_factors": ["<risk>", ...]}

                Question: %s
                Skill gaps: %s
                Teams covering each skill: %s""".formatted(focus, question, gapsJson, teamsJson);
    }
}
