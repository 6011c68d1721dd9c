package com.skillpilot.engine.executor;

import com.skillpilot.engine.workflow.ExecutionResult;

import java.util.Map;

/** Run of a pack entrypoint workflow; same flags as {@link AtomicRunReport}. */
public record EntrypointRunReport(
        String              pack,
        String              entrypoint,
        String              workflowId,
        String              runId,
        String              status,
        boolean             failed,
        boolean             timedOut,
        Map<String, Object> run) implements ExecutionReport {

    public static EntrypointRunReport of(String pack, String entrypoint, ExecutionResult result) {
        return new EntrypointRunReport(pack, entrypoint,
                result.handle().workflowId(),
                result.handle().runId(),
                result.status().raw(),
                result.failed(),
                result.timedOut(),
                result.run());
    }

    @Override
    public String outcome() {
        return Outcomes.of(status, failed, timedOut);
    }
}
