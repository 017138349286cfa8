package me.golemcore.gaplens.domain.stage;

import me.golemcore.gaplens.domain.exception.SessionPersistenceException;
import me.golemcore.gaplens.domain.exception.StageExecutionException;
import me.golemcore.gaplens.domain.model.ContextKeys;
import me.golemcore.gaplens.domain.model.Employee;
import me.golemcore.gaplens.domain.model.EmployeeSkill;
import me.golemcore.gaplens.domain.model.GenerationResult;
import me.golemcore.gaplens.domain.model.Project;
import me.golemcore.gaplens.domain.model.SkillGap;
import me.golemcore.gaplens.domain.model.Team;
import me.golemcore.gaplens.infrastructure.config.AutoConfiguration;
import me.golemcore.gaplens.port.outbound.DataProviderPort;
import me.golemcore.gaplens.port.outbound.MemoryStorePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AnalysisStageTest {

    private static final String SUMMARY_REPLY = """
            {"summary": "React and Kubernetes are short.", "risk_factors": ["Single React expert"]}""";

    private static final Project WEB_PORTAL = new Project("p1", "Web Portal", "Customer portal",
            List.of("React", "Kubernetes"), 4, "high", "planning");
    private static final Project BILLING = new Project("p2", "Billing", "Billing rewrite",
            List.of("React", "Java"), 3, "medium", "planning");
    private static final Project PLATFORM = new Project("p3", "Platform", "Cluster migration",
            List.of("Kubernetes"), 2, "high", "planning");

    private DataProviderPort dataProvider;
    private StageBackend backend;
    private MemoryStorePort memory;
    private AnalysisStage stage;

    @BeforeEach
    void setUp() {
        dataProvider = mock(DataProviderPort.class);
        when(dataProvider.getKnownSkills()).thenReturn(List.of("React", "Java", "Kubernetes", "Python"));
        when(dataProvider.getProjects()).thenReturn(List.of(WEB_PORTAL, BILLING, PLATFORM));
        when(dataProvider.getProject("p3")).thenReturn(Optional.of(PLATFORM));
        when(dataProvider.getProject("nope")).thenReturn(Optional.empty());
        when(dataProvider.getEmployees()).thenReturn(List.of(
                employee("Alice", "medium", skill("React", "expert"), skill("Java", "advanced")),
                employee("Bob", "low", skill("React", "beginner")),
                employee("Carol", "high", skill("Java", "intermediate")),
                employee("Dan", "high", skill("Python", "advanced"))));

        backend = mock(StageBackend.class);
        when(backend.getBackendId()).thenReturn("stub");
        when(backend.generate(anyString())).thenReturn(GenerationResult.ok("stub", SUMMARY_REPLY, 2));
        memory = mock(MemoryStorePort.class);

        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        stage = new AnalysisStage(dataProvider, new SkillCatalog(dataProvider),
                new BackendResponseParser(objectMapper), objectMapper);
    }

    // ===== computeGaps =====

    @Test
    void shouldReportFocusSkillFirstAndSkipCoveredSkills() {
        List<SkillGap> gaps = stage.computeGaps(dataProvider.getProjects(), List.of("React"));

        assertEquals(List.of("React", "Kubernetes"), gaps.stream().map(SkillGap::skill).toList());

        SkillGap react = gaps.get(0);
        assertTrue(react.focus());
        assertEquals(2, react.demand());
        assertEquals(1, react.supply());
        assertEquals(List.of("Alice"), react.qualifiedEmployees());
        assertEquals(List.of("Bob", "Carol", "Dan"), react.learnerCandidates());
        assertEquals(SkillGap.SEVERITY_MEDIUM, react.severity());

        SkillGap kubernetes = gaps.get(1);
        assertEquals(0, kubernetes.supply());
        assertEquals(SkillGap.SEVERITY_CRITICAL, kubernetes.severity());
        assertEquals(List.of("Carol", "Dan"), kubernetes.learnerCandidates());
    }

    @Test
    void focusSkillWithoutProjectsStillHasDemandOfOne() {
        List<SkillGap> gaps = stage.computeGaps(List.of(PLATFORM), List.of("Python"));

        SkillGap python = gaps.get(0);
        assertEquals("Python", python.skill());
        assertEquals(1, python.demand());
        assertEquals(1, python.supply());
        assertEquals(SkillGap.SEVERITY_LOW, python.severity());
    }

    @Test
    void severityShouldFollowShortfall() {
        assertEquals(SkillGap.SEVERITY_CRITICAL, AnalysisStage.severity(1, 0));
        assertEquals(SkillGap.SEVERITY_HIGH, AnalysisStage.severity(4, 2));
        assertEquals(SkillGap.SEVERITY_MEDIUM, AnalysisStage.severity(3, 2));
        assertEquals(SkillGap.SEVERITY_LOW, AnalysisStage.severity(2, 2));
    }

    // ===== execute =====

    @Test
    @SuppressWarnings("unchecked")
    void shouldProduceGapAnalysisWithBackendSummary() {
        StageResult result = stage.execute(input(Map.of()), backend, memory);

        Map<String, Object> analysis = (Map<String, Object>) result.output().get(ContextKeys.GAP_ANALYSIS);
        assertEquals("company", analysis.get("scope"));
        assertEquals("React and Kubernetes are short.", analysis.get("summary"));
        assertEquals(List.of("Single React expert"), analysis.get("risk_factors"));

        List<Map<String, Object>> gaps = (List<Map<String, Object>>) analysis.get("skill_gaps");
        assertEquals("React", gaps.get(0).get("skill"));
        assertEquals(2, gaps.get(0).get("demand"));
        assertEquals(Boolean.TRUE, gaps.get(0).get("focus"));
        assertEquals(0.75, result.confidence());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldLimitScopeToRequestedProject() {
        StageResult result = stage.execute(input(Map.of("project_id", "p3")), backend, memory);

        Map<String, Object> analysis = (Map<String, Object>) result.output().get(ContextKeys.GAP_ANALYSIS);
        assertEquals("p3", analysis.get("project_id"));
        List<Map<String, Object>> gaps = (List<Map<String, Object>>) analysis.get("skill_gaps");
        assertEquals(List.of("React", "Kubernetes"), gaps.stream().map(gap -> gap.get("skill")).toList());
        assertEquals(1, gaps.get(0).get("demand"));
        assertEquals("low", gaps.get(0).get("severity"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldListTeamsCoveringEachReportedSkill() {
        when(dataProvider.getTeams()).thenReturn(List.of(
                new Team("t1", "Frontend", "Engineering", List.of("Alice", "Bob"), Map.of("React", 2)),
                new Team("t2", "Infra", "Operations", List.of("Dan"), Map.of("Kubernetes", 0, "Python", 1))));

        StageResult result = stage.execute(input(Map.of()), backend, memory);

        Map<String, Object> analysis = (Map<String, Object>) result.output().get(ContextKeys.GAP_ANALYSIS);
        Map<String, List<String>> coverage = (Map<String, List<String>>) analysis.get("team_coverage");
        assertEquals(List.of("Frontend"), coverage.get("React"));
        assertEquals(List.of(), coverage.get("Kubernetes"));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(backend).generate(prompt.capture());
        assertTrue(prompt.getValue().contains("Frontend"));
        assertTrue(result.reasoningSteps().get(0).contains("2 teams"));
    }

    @Test
    void shouldFailForUnknownProject() {
        StageInput unknown = input(Map.of("project_id", "nope"));

        StageExecutionException e = assertThrows(StageExecutionException.class,
                () -> stage.execute(unknown, backend, memory));
        assertTrue(e.getMessage().contains("nope"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldStoreGapsInLongTermMemory() {
        stage.execute(input(Map.of()), backend, memory);

        ArgumentCaptor<Object> value = ArgumentCaptor.forClass(Object.class);
        verify(memory).putLongTerm(eq("skills"), eq("react"), value.capture());
        verify(memory).putLongTerm(eq("skills"), eq("kubernetes"), any());
        Map<String, Object> stored = (Map<String, Object>) value.getValue();
        assertEquals(1, stored.get("supply"));
        assertEquals("s-1", stored.get("lastSessionId"));
    }

    @Test
    void longTermFailureShouldNotFailStage() {
        doThrow(new SessionPersistenceException("disk full", new IllegalStateException()))
                .when(memory).putLongTerm(anyString(), anyString(), any());

        StageResult result = stage.execute(input(Map.of()), backend, memory);

        assertFalse(result.isBackendFailure());
        assertTrue(result.reasoningSteps().stream().anyMatch(step -> step.contains("skipped")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldKeepPlainTextSummary() {
        when(backend.generate(anyString())).thenReturn(GenerationResult.ok("openai", "  Mostly fine. ", 2));

        StageResult result = stage.execute(input(Map.of()), backend, memory);

        Map<String, Object> analysis = (Map<String, Object>) result.output().get(ContextKeys.GAP_ANALYSIS);
        assertEquals("Mostly fine.", analysis.get("summary"));
        assertEquals(List.of(), analysis.get("risk_factors"));
    }

    @Test
    void backendFailureShouldSkipLongTermWrites() {
        when(backend.generate(anyString())).thenReturn(GenerationResult.unavailable("openai", "down", 1));

        StageResult result = stage.execute(input(Map.of()), backend, memory);

        assertTrue(result.isBackendFailure());
        verifyNoInteractions(memory);
    }

    private static StageInput input(Map<String, Object> params) {
        return new StageInput("s-1", Map.of(ContextKeys.NORMALIZED_QUESTION, "Who knows React?"), params);
    }

    private static Employee employee(String name, String capacity, EmployeeSkill... skills) {
        return new Employee("emp_" + name.toLowerCase(), name, "Engineer", "Engineering", List.of(skills), 5.0,
                "full-time", capacity);
    }

    private static EmployeeSkill skill(String name, String level) {
        return new EmployeeSkill(name, level, 2.0);
    }
}
