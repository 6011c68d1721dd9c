package com.skillpilot.engine.skill;

import java.util.Map;

/** Step that invokes another skill by name; the target must be atomic. */
public record SkillCallStep(String id, String skill, Map<String, String> inputs) implements SkillStep {

    public SkillCallStep {
        inputs = inputs == null ? Map.of() : inputs;
    }
}
