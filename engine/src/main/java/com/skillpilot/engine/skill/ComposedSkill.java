package com.skillpilot.engine.skill;

import java.util.List;
import java.util.Map;

/**
 * A skill made of ordered steps.
 *
 * Steps run strictly in list order. An empty step list is allowed here and
 * rejected when the skill is run.
 *
 * @param composedOutputs Output name → template over the step results.
 */
public record ComposedSkill(
        String              name,
        String              version,
        String              description,
        List<SkillStep>     steps,
        Map<String, String> composedOutputs) implements SkillDefinition {

    public ComposedSkill {
        steps           = steps == null ? List.of() : List.copyOf(steps);
        composedOutputs = composedOutputs == null ? Map.of() : composedOutputs;
    }

    @Override
    public SkillKind kind() { return SkillKind.COMPOSED_SKILL; }
}
