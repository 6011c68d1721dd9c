package com.skillpilot.engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillpilot.engine.PackFixtures;
import com.skillpilot.engine.executor.ComposedRunReport;
import com.skillpilot.engine.executor.EntrypointRunReport;
import com.skillpilot.engine.executor.ExecutionReport;
import com.skillpilot.engine.executor.SkillExecutor;
import com.skillpilot.engine.pack.PackStore;
import com.skillpilot.engine.skill.AtomicSkill;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.SkillRunException;
import com.skillpilot.engine.workflow.ExecutionResult;
import com.skillpilot.engine.workflow.RunHandle;
import com.skillpilot.engine.workflow.RunOptions;
import com.skillpilot.engine.workflow.RunStatusClassifier;
import com.skillpilot.engine.workflow.ValidationIssue;
import com.skillpilot.engine.workflow.WorkflowRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SkillRunService: lookup, entrypoints, discovery and metrics.
 * The executor and runner are mocked; the pack store reads a temp directory.
 */
@ExtendWith(MockitoExtension.class)
class SkillRunServiceTest {

    @TempDir Path packsDir;

    @Mock SkillExecutor  executor;
    @Mock WorkflowRunner runner;

    SimpleMeterRegistry meters;
    SkillRunService     service;

    @BeforeEach
    void setUp() {
        meters  = new SimpleMeterRegistry();
        service = new SkillRunService(new PackStore(packsDir, new ObjectMapper()), executor, runner, meters,
                true, Duration.ofSeconds(2), Duration.ofMinutes(5), "ws-default", "proj-1");

        PackFixtures.manifest(packsDir, "content", """
                name: content-pack
                entrypoints:
                  - id: daily
                    workflow: workflows/daily.json
                    default_input: inputs/daily.json
                  - id: weekly
                    workflow: workflows/weekly.json
                """);
        PackFixtures.write(packsDir.resolve("content/inputs/daily.json"), "{\"topic\":\"dogs\",\"lang\":\"en\"}");
        PackFixtures.write(packsDir.resolve("content/workflows/weekly.json"), "{\"name\":\"weekly\",\"nodes\":[]}");
        PackFixtures.installRecord(packsDir, "content", """
                {"provisioned_skills":{"llm-generate":"wf-llm"},"provisioned_entrypoints":{"daily":"wf-daily"}}
                """);
        PackFixtures.skill(packsDir, "content", "llm-generate", "skill.yaml", PackFixtures.LLM_SKILL);
        PackFixtures.skill(packsDir, "content", "blog-pipeline", "compose.yaml", PackFixtures.BLOG_PIPELINE);
    }

    static ExecutionResult succeeded(String workflowId) {
        Map<String, Object> run = Map.of("id", "run-1", "status", "success");
        return new ExecutionResult(new RunHandle(workflowId, "run-1", "success"), run,
                RunStatusClassifier.classify("success"), false);
    }

    double runs(String skill, String kind, String status) {
        var counter = meters.find("skillpilot.skill.runs")
                .tags("skill", skill, "kind", kind, "status", status).counter();
        return counter == null ? 0 : counter.count();
    }

    // ------------------------------------------------------------------
    // Options
    // ------------------------------------------------------------------

    @Test
    void options_nullsFallBackToConfiguredDefaults() {
        RunOptions options = service.options(null, Duration.ofMillis(10), null, " ", null);

        assertThat(options).isEqualTo(new RunOptions(true, Duration.ofMillis(10), Duration.ofMinutes(5),
                "ws-default", false));
    }

    @Test
    void options_nonPositivePollInterval_rejectedLocally() {
        assertThatThrownBy(() -> service.options(null, Duration.ofMillis(-1), null, null, null))
                .isInstanceOf(SkillRunException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.LOCAL_VALIDATION_FAILED)
                .satisfies(e -> assertThat(((SkillRunException) e).getDetails().get("issues"))
                        .isEqualTo(List.of(new ValidationIssue("$.pollIntervalMs", "must be > 0"))));

        assertThatThrownBy(() -> service.options(null, Duration.ZERO, null, null, null))
                .hasFieldOrPropertyWithValue("code", ErrorCode.LOCAL_VALIDATION_FAILED);
        verifyNoInteractions(runner, executor);
    }

    @Test
    void options_negativeTimeout_rejectedLocally() {
        assertThatThrownBy(() -> service.options(null, null, Duration.ofMillis(-5), null, null))
                .isInstanceOf(SkillRunException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.LOCAL_VALIDATION_FAILED)
                .satisfies(e -> assertThat(((SkillRunException) e).getDetails().get("issues"))
                        .isEqualTo(List.of(new ValidationIssue("$.timeoutMs", "must be >= 0"))));
    }

    @Test
    void options_zeroTimeout_accepted() {
        assertThat(service.options(null, null, Duration.ZERO, null, null).timeout()).isEqualTo(Duration.ZERO);
    }

    // ------------------------------------------------------------------
    // runSkill
    // ------------------------------------------------------------------

    @Test
    void runSkill_success_timedAndCounted() {
        ExecutionReport report = new ComposedRunReport("blog-pipeline", Map.of(), Map.of());
        when(executor.run(any(), anyMap(), any())).thenReturn(report);

        assertThat(service.runSkill("blog-pipeline", Map.of("topic", "cats"), service.defaultOptions()))
                .isSameAs(report);

        assertThat(runs("blog-pipeline", "ComposedSkill", "success")).isEqualTo(1.0);
        assertThat(meters.find("skillpilot.skill.duration").tags("skill", "blog-pipeline").timer().count())
                .isEqualTo(1);
    }

    @Test
    void runSkill_unknownSkill_skillNotFoundAndCounted() {
        assertThatThrownBy(() -> service.runSkill("ghost", Map.of(), service.defaultOptions()))
                .isInstanceOf(SkillRunException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.SKILL_NOT_FOUND);

        assertThat(runs("unknown", "unknown", "skill_not_found")).isEqualTo(1.0);
        verifyNoInteractions(executor);
    }

    @Test
    void runSkill_manyUnknownNames_meterCountStaysBounded() {
        for (int i = 0; i < 50; i++) {
            String name = "ghost-" + i;
            String pack = "pack-" + i;
            assertThatThrownBy(() -> service.runSkill(name, Map.of(), service.defaultOptions()))
                    .hasFieldOrPropertyWithValue("code", ErrorCode.SKILL_NOT_FOUND);
            assertThatThrownBy(() -> service.runEntrypoint(pack, "daily", Map.of(), service.defaultOptions()))
                    .hasFieldOrPropertyWithValue("code", ErrorCode.PACK_NOT_FOUND);
        }

        assertThat(meters.getMeters()).hasSize(4);
        assertThat(runs("unknown", "unknown", "skill_not_found")).isEqualTo(50.0);
        assertThat(runs("unknown", "Entrypoint", "pack_not_found")).isEqualTo(50.0);
    }

    @Test
    void runEntrypoint_directoryAlias_taggedWithManifestName() {
        when(runner.submitAndWait(eq("wf-daily"), anyMap(), any())).thenReturn(succeeded("wf-daily"));

        service.runEntrypoint("content", "daily", Map.of(), service.defaultOptions());

        assertThat(runs("content-pack/daily", "Entrypoint", "success")).isEqualTo(1.0);
    }

    @Test
    void runSkill_stepFailure_propagatesWithCodeTag() {
        when(executor.run(any(), anyMap(), any()))
                .thenThrow(new SkillRunException(ErrorCode.SKILL_RUN_STEP_FAILED, "step1 failed"));

        assertThatThrownBy(() -> service.runSkill("blog-pipeline", Map.of(), service.defaultOptions()))
                .hasFieldOrPropertyWithValue("code", ErrorCode.SKILL_RUN_STEP_FAILED);
        assertThat(runs("blog-pipeline", "ComposedSkill", "skill_run_step_failed")).isEqualTo(1.0);
    }

    @Test
    void runSkill_unexpectedException_wrappedAsRequestFailed() {
        when(executor.run(any(), anyMap(), any())).thenThrow(new IllegalStateException("kaboom"));

        assertThatThrownBy(() -> service.runSkill("blog-pipeline", Map.of(), service.defaultOptions()))
                .isInstanceOf(SkillRunException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.REQUEST_FAILED)
                .hasMessageContaining("kaboom")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // runEntrypoint
    // ------------------------------------------------------------------

    @Test
    void runEntrypoint_provisioned_callerInputOverridesDefaults() {
        RunOptions options = service.defaultOptions();
        when(runner.submitAndWait(eq("wf-daily"), anyMap(), eq(options))).thenReturn(succeeded("wf-daily"));

        EntrypointRunReport report = (EntrypointRunReport) service.runEntrypoint(
                "content-pack", "daily", Map.of("topic", "cats"), options);

        assertThat(report.workflowId()).isEqualTo("wf-daily");
        assertThat(report.outcome()).isEqualTo("success");
        verify(runner).submitAndWait("wf-daily", Map.of("topic", "cats", "lang", "en"), options);
        verify(runner, never()).createWorkflow(anyMap(), any(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void runEntrypoint_notProvisioned_createsFromWorkflowFile() {
        RunOptions options = service.defaultOptions();
        when(runner.createWorkflow(anyMap(), eq(options), eq(ErrorCode.SKILL_RUN_CREATE_FAILED))).thenReturn("wf-weekly");
        when(runner.submitAndWait(eq("wf-weekly"), anyMap(), eq(options))).thenReturn(succeeded("wf-weekly"));

        service.runEntrypoint("content", "weekly", null, options);

        ArgumentCaptor<Map<String, Object>> definition = ArgumentCaptor.forClass(Map.class);
        verify(runner).createWorkflow(definition.capture(), eq(options), eq(ErrorCode.SKILL_RUN_CREATE_FAILED));
        assertThat(definition.getValue()).containsEntry("name", "weekly").containsEntry("project_id", "proj-1");
    }

    @Test
    void runEntrypoint_unknownPack_packNotFound() {
        assertThatThrownBy(() -> service.runEntrypoint("nope", "daily", Map.of(), service.defaultOptions()))
                .hasFieldOrPropertyWithValue("code", ErrorCode.PACK_NOT_FOUND);
        assertThat(runs("unknown", "Entrypoint", "pack_not_found")).isEqualTo(1.0);
    }

    @Test
    void runEntrypoint_unknownEntrypoint_entrypointNotFound() {
        assertThatThrownBy(() -> service.runEntrypoint("content-pack", "monthly", Map.of(), service.defaultOptions()))
                .hasFieldOrPropertyWithValue("code", ErrorCode.PACK_ENTRYPOINT_NOT_FOUND);
        verifyNoInteractions(runner);
    }

    // ------------------------------------------------------------------
    // Discovery
    // ------------------------------------------------------------------

    @Test
    void listSkills_summariesWithProvisionedFlag() {
        assertThat(service.listSkills()).containsExactly(
                new SkillSummary("blog-pipeline", "content-pack", "ComposedSkill", "0.3.0", null, false),
                new SkillSummary("llm-generate", "content-pack", "Skill", "1.2.0", "Generate text with an LLM", true));
    }

    @Test
    void describeSkill_returnsDefinitionAndProvisionedWorkflow() {
        SkillDetail detail = service.describeSkill("llm-generate");

        assertThat(detail.pack()).isEqualTo("content-pack");
        assertThat(detail.provisionedWorkflowId()).isEqualTo("wf-llm");
        assertThat(detail.definition()).isInstanceOf(AtomicSkill.class);
    }
}
