package com.skillpilot.engine.service;

import com.skillpilot.engine.executor.EntrypointRunReport;
import com.skillpilot.engine.executor.ExecutionReport;
import com.skillpilot.engine.executor.InvocationContext;
import com.skillpilot.engine.executor.SkillExecutor;
import com.skillpilot.engine.pack.InstalledPack;
import com.skillpilot.engine.pack.PackEntrypoint;
import com.skillpilot.engine.pack.PackStore;
import com.skillpilot.engine.pack.SkillRegistry;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.ResolvedSkill;
import com.skillpilot.engine.skill.SkillRunException;
import com.skillpilot.engine.workflow.ExecutionResult;
import com.skillpilot.engine.workflow.RunOptions;
import com.skillpilot.engine.workflow.ValidationIssue;
import com.skillpilot.engine.workflow.WorkflowRunner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for everything a caller can do with installed skills.
 *
 * Each call takes a fresh snapshot of the pack store, so separate
 * invocations share no mutable state. Every run is timed and counted:
 * <pre>
 *   skillpilot.skill.runs{skill, kind, status}
 *   skillpilot.skill.duration{skill, kind}
 * </pre>
 * {@code status} is the report outcome (success, failed, timed_out, submitted)
 * or the error code of the failure.
 */
@Service
public class SkillRunService {

    private static final Logger log = LoggerFactory.getLogger(SkillRunService.class);

    static final String ENTRYPOINT_KIND = "Entrypoint";

    /** Tag value for names that resolve to nothing, so unknown names add no meters. */
    static final String UNKNOWN = "unknown";

    private final PackStore      packStore;
    private final SkillExecutor  executor;
    private final WorkflowRunner runner;
    private final MeterRegistry  meterRegistry;

    private final boolean  defaultWait;
    private final Duration defaultPollInterval;
    private final Duration defaultTimeout;
    private final String   defaultWorkspaceId;
    private final String   projectId;

    public SkillRunService(
            PackStore packStore,
            SkillExecutor executor,
            WorkflowRunner runner,
            MeterRegistry meterRegistry,
            @Value("${skillpilot.run.wait:true}") boolean defaultWait,
            @Value("${skillpilot.run.poll-interval:2s}") Duration defaultPollInterval,
            @Value("${skillpilot.run.timeout:5m}") Duration defaultTimeout,
            @Value("${skillpilot.api.workspace-id:}") String defaultWorkspaceId,
            @Value("${skillpilot.api.project-id:}") String projectId) {
        this.packStore           = packStore;
        this.executor            = executor;
        this.runner              = runner;
        this.meterRegistry       = meterRegistry;
        this.defaultWait         = defaultWait;
        this.defaultPollInterval = defaultPollInterval;
        this.defaultTimeout      = defaultTimeout;
        this.defaultWorkspaceId  = defaultWorkspaceId;
        this.projectId           = projectId;
    }

    // ------------------------------------------------------------------
    // Options
    // ------------------------------------------------------------------

    /**
     * Run options with every null argument replaced by the configured default.
     * A non-positive poll interval or a negative timeout fails with
     * local_validation_failed before anything is submitted.
     */
    public RunOptions options(Boolean wait, Duration pollInterval, Duration timeout,
                              String workspaceId, Boolean validateRemotely) {
        RunOptions options = new RunOptions(
                wait != null ? wait : defaultWait,
                pollInterval != null ? pollInterval : defaultPollInterval,
                timeout != null ? timeout : defaultTimeout,
                workspaceId != null && !workspaceId.isBlank() ? workspaceId : defaultWorkspaceId,
                Boolean.TRUE.equals(validateRemotely));

        List<ValidationIssue> issues = new ArrayList<>();
        if (options.pollInterval().isNegative() || options.pollInterval().isZero()) {
            issues.add(new ValidationIssue("$.pollIntervalMs", "must be > 0"));
        }
        if (options.timeout().isNegative()) {
            issues.add(new ValidationIssue("$.timeoutMs", "must be >= 0"));
        }
        if (!issues.isEmpty()) {
            throw new SkillRunException(ErrorCode.LOCAL_VALIDATION_FAILED,
                    "Run options failed local validation with " + issues.size() + " issue(s).",
                    Map.of("issues", issues));
        }
        return options;
    }

    public RunOptions defaultOptions() {
        return options(null, null, null, null, null);
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    public ExecutionReport runSkill(String name, Map<String, Object> input, RunOptions options) {
        SkillRegistry registry = packStore.open();
        ResolvedSkill skill = registry.find(name).orElse(null);
        String metricName = skill != null ? skill.name() : UNKNOWN;
        String kind       = skill != null ? skill.skill().kind().label() : UNKNOWN;

        return instrumented(metricName, kind, () -> {
            ResolvedSkill resolved = skill != null ? skill : registry.get(name);
            log.info("Running skill '{}' from pack '{}'", resolved.name(), resolved.packName());
            return executor.run(resolved, input, new InvocationContext(registry, options, projectId));
        });
    }

    /**
     * Run a pack entrypoint workflow. The entrypoint's default input file is
     * overlaid with the caller's input.
     */
    public ExecutionReport runEntrypoint(String packName, String entrypointId,
                                         Map<String, Object> input, RunOptions options) {
        SkillRegistry registry = packStore.open();
        InstalledPack pack = registry.pack(packName).orElse(null);
        PackEntrypoint entrypoint = pack != null ? pack.entrypoint(entrypointId).orElse(null) : null;
        String metricName = entrypoint != null ? pack.name() + "/" + entrypoint.id() : UNKNOWN;

        return instrumented(metricName, ENTRYPOINT_KIND, () -> {
            if (pack == null) {
                throw new SkillRunException(ErrorCode.PACK_NOT_FOUND,
                        "Pack '" + packName + "' is not installed.", Map.of("pack", packName));
            }
            if (entrypoint == null) {
                throw new SkillRunException(ErrorCode.PACK_ENTRYPOINT_NOT_FOUND,
                        "Pack '" + pack.name() + "' has no entrypoint '" + entrypointId + "'.",
                        Map.of("pack", pack.name(), "entrypoint", entrypointId));
            }

            Map<String, Object> merged = new LinkedHashMap<>();
            if (entrypoint.defaultInput() != null && !entrypoint.defaultInput().isBlank()) {
                merged.putAll(packStore.readJsonObject(pack.root(), entrypoint.defaultInput()));
            }
            if (input != null) {
                merged.putAll(input);
            }

            String workflowId = pack.provisionedEntrypointWorkflow(entrypointId)
                    .orElseGet(() -> createEntrypointWorkflow(pack, entrypoint, options));
            log.info("Running entrypoint '{}' of pack '{}' (workflow {})", entrypointId, pack.name(), workflowId);
            ExecutionResult result = runner.submitAndWait(workflowId, merged, options);
            return EntrypointRunReport.of(pack.name(), entrypointId, result);
        });
    }

    // ------------------------------------------------------------------
    // Discovery
    // ------------------------------------------------------------------

    public List<SkillSummary> listSkills() {
        SkillRegistry registry = packStore.open();
        return registry.skills().stream()
                .map(s -> new SkillSummary(
                        s.name(),
                        s.packName(),
                        s.skill().kind().label(),
                        s.skill().version(),
                        s.skill().description(),
                        registry.provisionedWorkflowId(s).isPresent()))
                .toList();
    }

    public SkillDetail describeSkill(String name) {
        SkillRegistry registry = packStore.open();
        ResolvedSkill skill = registry.get(name);
        return new SkillDetail(skill.packName(),
                registry.provisionedWorkflowId(skill).orElse(null),
                skill.skill());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String createEntrypointWorkflow(InstalledPack pack, PackEntrypoint entrypoint, RunOptions options) {
        if (entrypoint.workflow() == null || entrypoint.workflow().isBlank()) {
            throw new SkillRunException(ErrorCode.SKILL_INVALID_DEFINITION,
                    "Entrypoint '" + entrypoint.id() + "' of pack '" + pack.name() + "' declares no workflow file.",
                    Map.of("pack", pack.name(), "entrypoint", entrypoint.id()));
        }
        Map<String, Object> definition = new LinkedHashMap<>(packStore.readJsonObject(pack.root(), entrypoint.workflow()));
        if (projectId != null && !projectId.isBlank()) {
            definition.putIfAbsent("project_id", projectId);
        }
        return runner.createWorkflow(definition, options, ErrorCode.SKILL_RUN_CREATE_FAILED);
    }

    /** Times and counts one run; anything that is not a {@link SkillRunException} becomes request_failed. */
    private ExecutionReport instrumented(String name, String kind, RunBody body) {
        MDC.put("skill", name);
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            ExecutionReport report = body.run();
            status = report.outcome();
            return report;
        } catch (SkillRunException e) {
            status = e.getCode().code();
            log.warn("Run of '{}' failed [{}]: {}", name, status, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            status = ErrorCode.REQUEST_FAILED.code();
            log.error("Unexpected error running '{}'", name, e);
            throw new SkillRunException(ErrorCode.REQUEST_FAILED,
                    "Unexpected error running '" + name + "': " + e.getMessage(),
                    Map.of("skill", name), e);
        } finally {
            sample.stop(meterRegistry.timer("skillpilot.skill.duration",
                    "skill", name, "kind", kind));
            meterRegistry.counter("skillpilot.skill.runs",
                    "skill", name, "kind", kind, "status", status).increment();
            MDC.remove("skill");
        }
    }

    @FunctionalInterface
    private interface RunBody {
        ExecutionReport run();
    }
}
