package com.skillpilot.engine.executor;

import java.util.Map;

/**
 * Completed composed run.
 *
 * @param steps   step id → stored step result, in declared order
 * @param outputs the skill's declared outputs, resolved against the step results
 */
public record ComposedRunReport(
        String              skill,
        Map<String, Object> steps,
        Map<String, Object> outputs) implements ExecutionReport {

    @Override
    public String outcome() {
        return "success";
    }
}
