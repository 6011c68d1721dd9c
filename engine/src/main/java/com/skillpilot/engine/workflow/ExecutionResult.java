package com.skillpilot.engine.workflow;

import java.util.Map;

/**
 * Outcome of submitting a run and (optionally) waiting for it.
 *
 * {@code timedOut} means the wait budget ran out while the run was still
 * non-terminal; it is never folded into {@link #failed()}.
 */
public record ExecutionResult(RunHandle handle, Map<String, Object> run, RunStatus status, boolean timedOut) {

    public boolean failed() {
        return status.failed();
    }

    public boolean terminal() {
        return status.terminal();
    }

    /** What a successful run produced: {@code output}, else {@code result}, else the whole run. */
    public Object output() {
        if (run.get("output") != null) return run.get("output");
        if (run.get("result") != null) return run.get("result");
        return run;
    }
}
