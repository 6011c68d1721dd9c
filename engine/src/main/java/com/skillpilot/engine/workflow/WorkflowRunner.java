package com.skillpilot.engine.workflow;

import com.skillpilot.engine.client.WorkflowApiClient;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.SkillRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Submit a workflow run and optionally wait for it to finish.
 *
 * <pre>
 *   definition ──validate──► create ──► workflowId ──► run ──► runId ──► poll … terminal | timeout
 * </pre>
 *
 * Every remote failure aborts immediately; nothing is retried. Polling is a
 * blocking loop on the caller's thread, so two polls of one run never overlap.
 */
@Component
public class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final WorkflowApiClient client;

    public WorkflowRunner(WorkflowApiClient client) {
        this.client = client;
    }

    // ------------------------------------------------------------------
    // Workflow creation
    // ------------------------------------------------------------------

    /**
     * Validate and create a workflow, returning its id.
     *
     * @param missingIdCode code raised when the API answers without an id
     *                      ({@code skill_run_create_failed} or {@code skill_run_sub_create_failed})
     */
    public String createWorkflow(Map<String, Object> definition, RunOptions options, ErrorCode missingIdCode) {
        List<ValidationIssue> issues = WorkflowPayloadValidator.validateCreate(definition);
        if (!issues.isEmpty()) {
            throw new SkillRunException(ErrorCode.LOCAL_VALIDATION_FAILED,
                    "Workflow '" + definition.get("name") + "' failed local validation with "
                    + issues.size() + " issue(s).",
                    Map.of("issues", issues));
        }
        if (options.validateRemotely()) {
            client.validateWorkflow(definition);
        }

        Map<String, Object> created = client.createWorkflow(definition, options.workspaceId());
        String workflowId = firstString(created, "id", "workflow_id");
        if (workflowId == null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("workflow", definition.get("name"));
            details.put("response", created);
            throw new SkillRunException(missingIdCode,
                    "Creating workflow '" + definition.get("name") + "' returned no id.", details);
        }
        log.info("Created workflow {} ('{}')", workflowId, definition.get("name"));
        return workflowId;
    }

    /** Definition path: create, then submit like {@link #submitAndWait(String, Map, RunOptions)}. */
    public ExecutionResult submitAndWait(Map<String, Object> definition, Map<String, Object> input,
                                         RunOptions options, ErrorCode missingIdCode) {
        return submitAndWait(createWorkflow(definition, options, missingIdCode), input, options);
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    public ExecutionResult submitAndWait(String workflowId, Map<String, Object> input, RunOptions options) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflow_id", workflowId);
        payload.put("input",       input);
        List<ValidationIssue> issues = WorkflowPayloadValidator.validateRun(payload);
        if (!issues.isEmpty()) {
            throw new SkillRunException(ErrorCode.LOCAL_VALIDATION_FAILED,
                    "Run request for workflow " + workflowId + " failed local validation.",
                    Map.of("issues", issues));
        }

        Map<String, Object> run = client.runWorkflow(workflowId, input);
        String runId = firstString(run, "id", "workflow_run_id", "run_id");
        if (runId == null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("workflowId", workflowId);
            details.put("response",   run);
            throw new SkillRunException(ErrorCode.SKILL_RUN_MISSING_RUN_ID,
                    "Run of workflow " + workflowId + " returned no run id.", details);
        }

        RunHandle handle = new RunHandle(workflowId, runId, RunStatusClassifier.statusOf(run));
        RunStatus status = RunStatusClassifier.classify(handle.rawStatus());
        log.info("Run {} of workflow {} submitted (status '{}')", runId, workflowId, status.raw());

        if (!options.waitForCompletion() || status.terminal()) {
            return new ExecutionResult(handle, run, status, false);
        }
        return waitForTerminal(handle, run, options.pollInterval(), options.timeout());
    }

    private ExecutionResult waitForTerminal(RunHandle handle, Map<String, Object> initialRun,
                                            Duration pollInterval, Duration timeout) {
        long started = System.nanoTime();
        Map<String, Object> run = initialRun;
        RunStatus status = RunStatusClassifier.classify(run);

        while (true) {
            Duration remaining = timeout.minus(Duration.ofNanos(System.nanoTime() - started));
            sleep(remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
            run    = client.getRun(handle.runId());
            status = RunStatusClassifier.classify(run);
            handle = handle.withStatus(status.raw());
            log.debug("Run {} status '{}'", handle.runId(), status.raw());

            if (status.terminal()) {
                log.info("Run {} finished with status '{}'", handle.runId(), status.raw());
                return new ExecutionResult(handle, run, status, false);
            }
            if (Duration.ofNanos(System.nanoTime() - started).compareTo(timeout) >= 0) {
                log.warn("Run {} still '{}' after {}; giving up", handle.runId(), status.raw(), timeout);
                return new ExecutionResult(handle, run, status, true);
            }
        }
    }

    private static void sleep(Duration interval) {
        try {
            if (!interval.isNegative()) {
                Thread.sleep(interval.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SkillRunException(ErrorCode.REQUEST_FAILED, "Interrupted while waiting for run", e);
        }
    }

    /** Extracted ids may come back as numbers; they are always handled as strings. */
    static String firstString(Map<String, Object> body, String... keys) {
        if (body == null) return null;
        for (String key : keys) {
            Object value = body.get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value);
            }
        }
        return null;
    }
}
