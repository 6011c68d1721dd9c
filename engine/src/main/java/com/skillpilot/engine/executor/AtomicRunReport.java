package com.skillpilot.engine.executor;

import com.skillpilot.engine.workflow.ExecutionResult;

import java.util.Map;

/**
 * Direct run of an atomic skill. Failure and timeout are reported as flags,
 * not raised, so the caller always sees the raw run.
 */
public record AtomicRunReport(
        String              skill,
        String              workflowId,
        String              runId,
        String              status,
        boolean             failed,
        boolean             timedOut,
        Map<String, Object> run) implements ExecutionReport {

    static AtomicRunReport of(String skill, ExecutionResult result) {
        return new AtomicRunReport(skill,
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
