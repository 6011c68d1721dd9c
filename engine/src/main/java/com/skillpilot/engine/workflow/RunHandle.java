package com.skillpilot.engine.workflow;

/** Identifies one remote run; {@code rawStatus} is the last status seen. */
public record RunHandle(String workflowId, String runId, String rawStatus) {

    public RunHandle withStatus(String status) {
        return new RunHandle(workflowId, runId, status);
    }
}
