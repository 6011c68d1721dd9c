package com.skillpilot.engine.skill;

import java.util.Map;

/**
 * Step that runs a script on the local machine.
 *
 * {@code script} is relative to the composed skill's directory and may be
 * null in a malformed definition; the executor reports that at run time.
 */
public record LocalStep(String id, String script, Map<String, String> inputs) implements SkillStep {

    public LocalStep {
        inputs = inputs == null ? Map.of() : inputs;
    }
}
