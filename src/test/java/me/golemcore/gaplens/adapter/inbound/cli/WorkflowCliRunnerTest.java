package me.golemcore.gaplens.adapter.inbound.cli;

import me.golemcore.gaplens.domain.model.SessionResult;
import me.golemcore.gaplens.domain.model.SessionStatus;
import me.golemcore.gaplens.domain.model.StageError;
import me.golemcore.gaplens.domain.model.StageErrorType;
import me.golemcore.gaplens.domain.model.StageRecord;
import me.golemcore.gaplens.domain.model.WorkflowConfig;
import me.golemcore.gaplens.port.inbound.WorkflowPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class WorkflowCliRunnerTest {

    private WorkflowPort workflowPort;
    private WorkflowCliRunner runner;

    @BeforeEach
    void setUp() {
        workflowPort = mock(WorkflowPort.class);
        when(workflowPort.run(any(), any(), any())).thenReturn(
                new SessionResult("s-1", SessionStatus.COMPLETED, Map.of(), List.of(), null, true));
        runner = new WorkflowCliRunner(workflowPort);
    }

    @Test
    void shouldDoNothingWithoutQuestionOrSession() {
        runner.run(new DefaultApplicationArguments("--spring.profiles.active=dev"));

        verifyNoInteractions(workflowPort);
    }

    @Test
    void shouldRunQuestionWithBackendAndProject() {
        runner.run(new DefaultApplicationArguments("--question=Who knows React?", "--backend=stub",
                "--project=proj_001"));

        ArgumentCaptor<WorkflowConfig> config = ArgumentCaptor.forClass(WorkflowConfig.class);
        verify(workflowPort).run(isNull(), eq("Who knows React?"), config.capture());
        assertEquals("stub", config.getValue().getBackendName());
        assertEquals("proj_001", config.getValue().param("project_id"));
    }

    @Test
    void shouldResumeStoredSession() {
        runner.run(new DefaultApplicationArguments("--session=s-1"));

        verify(workflowPort).run(eq("s-1"), isNull(), any());
    }

    @Test
    void formatShouldListStagesAndRecommendations() {
        StageRecord record = StageRecord.builder()
                .stageName("decision")
                .reasoningPatternTag("tot")
                .confidence(0.7)
                .backendId("stub")
                .fallbackUsed(true)
                .timestamp(Instant.EPOCH)
                .build();
        SessionResult result = new SessionResult("s-1", SessionStatus.COMPLETED, Map.of(
                "entities", List.of("React"),
                "recommendations", List.of(Map.of("kind", "UPSKILL", "skill", "React", "target", "Bob",
                        "timelineWeeks", 4, "risk", "medium"))),
                List.of(record), null, true);

        String text = WorkflowCliRunner.format(result);

        assertTrue(text.contains("Status: COMPLETED"));
        assertTrue(text.contains("backend=stub (fallback)"));
        assertTrue(text.contains("Entities: [React]"));
        assertTrue(text.contains("UPSKILL React -> Bob (4 weeks, risk medium)"));
    }

    @Test
    void formatShouldShowErrorAndNonDurableResult() {
        SessionResult result = new SessionResult("s-1", SessionStatus.FAILED, Map.of(), List.of(),
                StageError.of(StageErrorType.MISSING_INPUT, "analysis", "missing normalized_question"), false);

        String text = WorkflowCliRunner.format(result);

        assertTrue(text.contains("Status: FAILED (not persisted)"));
        assertTrue(text.contains("Error: MISSING_INPUT at analysis: missing normalized_question"));
    }
}
