package com.skillpilot.engine.executor;

import com.skillpilot.engine.client.WorkflowApiClient;
import com.skillpilot.engine.skill.AtomicSkill;
import com.skillpilot.engine.skill.ComposedSkill;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.LocalStep;
import com.skillpilot.engine.skill.ResolvedSkill;
import com.skillpilot.engine.skill.SkillCallStep;
import com.skillpilot.engine.skill.SkillRunException;
import com.skillpilot.engine.skill.SkillStep;
import com.skillpilot.engine.template.TemplateResolver;
import com.skillpilot.engine.workflow.ConnectionResolver;
import com.skillpilot.engine.workflow.ExecutionResult;
import com.skillpilot.engine.workflow.SkillWorkflowBuilder;
import com.skillpilot.engine.workflow.WorkflowRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a resolved skill.
 *
 * <p>Atomic skills map to one remote run whose outcome is reported as-is.
 * Composed skills run their steps strictly in declared order:
 * <pre>
 *   for each step:
 *     resolve inputs against (invocation input, results of earlier steps)
 *     local  → run script, store {output: trimmed stdout}
 *     skill  → run target atomic skill to a terminal status, store its output
 * </pre>
 * The first failing step aborts the run; earlier results are discarded and
 * only the failing step's diagnostics are raised.
 */
@Component
public class SkillExecutor {

    private static final Logger log = LoggerFactory.getLogger(SkillExecutor.class);

    static final int CONNECTION_LIST_LIMIT = 200;

    private final WorkflowRunner    runner;
    private final WorkflowApiClient client;
    private final LocalScriptRunner scripts;

    public SkillExecutor(WorkflowRunner runner, WorkflowApiClient client, LocalScriptRunner scripts) {
        this.runner  = runner;
        this.client  = client;
        this.scripts = scripts;
    }

    public ExecutionReport run(ResolvedSkill skill, Map<String, Object> input, InvocationContext ctx) {
        Map<String, Object> args = input == null ? Map.of() : input;
        if (skill.skill() instanceof ComposedSkill composed) {
            return runComposed(skill, composed, args, ctx);
        }
        return runAtomic(skill, (AtomicSkill) skill.skill(), args, ctx);
    }

    // ------------------------------------------------------------------
    // Atomic
    // ------------------------------------------------------------------

    AtomicRunReport runAtomic(ResolvedSkill skill, AtomicSkill atomic, Map<String, Object> input,
                              InvocationContext ctx) {
        String workflowId = workflowFor(skill, atomic, ctx, ErrorCode.SKILL_RUN_CREATE_FAILED);
        ExecutionResult result = runner.submitAndWait(workflowId, input, ctx.options());
        if (result.timedOut()) {
            log.warn("Skill '{}' run {} did not finish in time", atomic.name(), result.handle().runId());
        } else if (result.failed()) {
            log.warn("Skill '{}' run {} ended with status '{}'",
                    atomic.name(), result.handle().runId(), result.status().raw());
        }
        return AtomicRunReport.of(atomic.name(), result);
    }

    // ------------------------------------------------------------------
    // Composed
    // ------------------------------------------------------------------

    ComposedRunReport runComposed(ResolvedSkill skill, ComposedSkill composed, Map<String, Object> input,
                                  InvocationContext ctx) {
        List<SkillStep> steps = composed.steps();
        if (steps.isEmpty()) {
            throw new SkillRunException(ErrorCode.SKILL_RUN_NO_STEPS,
                    "Composed skill '" + composed.name() + "' has no steps.",
                    Map.of("skill", composed.name()));
        }

        log.info("Running composed skill '{}' ({} steps)", composed.name(), steps.size());
        Map<String, Object> stepResults = new LinkedHashMap<>();
        for (SkillStep step : steps) {
            MDC.put("step", step.id());
            try {
                Map<String, Object> resolved = TemplateResolver.resolveAll(step.inputs(), input, stepResults);
                Object result;
                if (step instanceof LocalStep local) {
                    result = runLocalStep(skill, local, resolved);
                } else if (step instanceof SkillCallStep call) {
                    result = runSkillStep(call, resolved, ctx);
                } else {
                    throw new IllegalStateException("Unknown step type " + step.getClass().getName());
                }
                stepResults.put(step.id(), result);
                log.info("Step '{}' completed", step.id());
            } finally {
                MDC.remove("step");
            }
        }

        Map<String, Object> outputs = TemplateResolver.resolveAll(composed.composedOutputs(), input, stepResults);
        return new ComposedRunReport(composed.name(), stepResults, outputs);
    }

    private Map<String, Object> runLocalStep(ResolvedSkill owner, LocalStep step, Map<String, Object> resolved) {
        if (step.script() == null || step.script().isBlank()) {
            throw new SkillRunException(ErrorCode.SKILL_RUN_LOCAL_NO_SCRIPT,
                    "Local step '" + step.id() + "' has no script.",
                    Map.of("step", step.id()));
        }

        Path script = owner.path().resolve(step.script()).normalize();
        Map<String, String> env = new LinkedHashMap<>();
        resolved.forEach((name, value) -> env.put(name, TemplateResolver.stringify(value)));

        LocalScriptResult result = scripts.run(script, env);
        if (!result.succeeded()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step",     step.id());
            details.put("script",   step.script());
            details.put("exitCode", result.exitCode());
            details.put("timedOut", result.timedOut());
            details.put("stderr",   result.stderr().strip());
            throw new SkillRunException(ErrorCode.SKILL_RUN_LOCAL_FAILED,
                    result.timedOut()
                            ? "Local step '" + step.id() + "' timed out."
                            : "Local step '" + step.id() + "' exited with code " + result.exitCode() + ".",
                    details);
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("output", result.stdout().strip());
        return output;
    }

    private Object runSkillStep(SkillCallStep step, Map<String, Object> resolved, InvocationContext ctx) {
        ResolvedSkill target = ctx.registry().find(step.skill())
                .orElseThrow(() -> new SkillRunException(ErrorCode.SKILL_RUN_SUB_NOT_FOUND,
                        "Step '" + step.id() + "' references unknown skill '" + step.skill() + "'.",
                        Map.of("step", step.id(), "skill", step.skill())));
        if (!(target.skill() instanceof AtomicSkill atomic)) {
            throw new SkillRunException(ErrorCode.SKILL_RUN_NESTED_COMPOSE,
                    "Step '" + step.id() + "' targets composed skill '" + step.skill()
                    + "'; composed skills cannot be nested.",
                    Map.of("step", step.id(), "skill", step.skill()));
        }

        String workflowId = workflowFor(target, atomic, ctx, ErrorCode.SKILL_RUN_SUB_CREATE_FAILED);
        ExecutionResult result = runner.submitAndWait(workflowId, resolved, ctx.options().withWait(true));

        if (result.timedOut() || result.failed()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step",   step.id());
            details.put("skill",  step.skill());
            details.put("runId",  result.handle().runId());
            details.put("status", result.status().raw());
            details.put("run",    result.run());
            if (result.timedOut()) {
                throw new SkillRunException(ErrorCode.SKILL_RUN_STEP_TIMEOUT,
                        "Step '" + step.id() + "' (" + step.skill() + ") did not finish within "
                        + ctx.options().timeout() + ".", details);
            }
            throw new SkillRunException(ErrorCode.SKILL_RUN_STEP_FAILED,
                    "Step '" + step.id() + "' (" + step.skill() + ") failed with status '"
                    + result.status().raw() + "'.", details);
        }
        return result.output();
    }

    // ------------------------------------------------------------------
    // Workflow resolution
    // ------------------------------------------------------------------

    /** Provisioned workflow of the skill's pack, else one built and created now. */
    private String workflowFor(ResolvedSkill skill, AtomicSkill atomic, InvocationContext ctx, ErrorCode missingIdCode) {
        Optional<String> provisioned = ctx.registry().provisionedWorkflowId(skill);
        if (provisioned.isPresent()) {
            log.debug("Reusing provisioned workflow {} for skill '{}'", provisioned.get(), atomic.name());
            return provisioned.get();
        }
        String connectionId = resolveConnection(atomic, ctx).orElse(null);
        Map<String, Object> definition = SkillWorkflowBuilder.build(atomic, ctx.projectId(), connectionId);
        return runner.createWorkflow(definition, ctx.options(), missingIdCode);
    }

    private Optional<String> resolveConnection(AtomicSkill atomic, InvocationContext ctx) {
        String category = atomic.connectionCategory();
        if (category == null || category.isBlank()) return Optional.empty();
        try {
            List<Map<String, Object>> connections = ctx.connections(() -> listConnections(ctx));
            Optional<String> id = ConnectionResolver.resolve(category, connections);
            if (id.isEmpty()) {
                log.warn("No connection matches category '{}' for skill '{}'", category, atomic.name());
            }
            return id;
        } catch (RuntimeException e) {
            log.warn("Connection resolution for skill '{}' failed: {}", atomic.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<Map<String, Object>> listConnections(InvocationContext ctx) {
        try {
            return client.listConnections(ctx.options().workspaceId(), ctx.projectId(), CONNECTION_LIST_LIMIT);
        } catch (RuntimeException e) {
            log.warn("Could not list connections: {}", e.getMessage());
            return List.of();
        }
    }
}
