package com.skillpilot.engine.workflow;

import java.time.Duration;

/**
 * Per-invocation knobs for submitting runs.
 *
 * @param waitForCompletion Poll to a terminal status before returning (skill steps always wait).
 * @param workspaceId       Workspace that owns created workflows and listed connections.
 * @param validateRemotely  Also call the remote validation endpoint before creating a workflow.
 */
public record RunOptions(
        boolean  waitForCompletion,
        Duration pollInterval,
        Duration timeout,
        String   workspaceId,
        boolean  validateRemotely) {

    public RunOptions withWait(boolean value) {
        return new RunOptions(value, pollInterval, timeout, workspaceId, validateRemotely);
    }
}
