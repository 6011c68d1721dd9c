package com.skillpilot.engine.skill;

import java.util.Map;

/**
 * A skill that wraps exactly one remote node type.
 *
 * @param nodeType           Capability identifier ({@code node_type}); the builder refuses a null value.
 * @param connectionCategory Optional connection category used for auto-resolution (e.g. "pixelml").
 * @param defaults           Merged into the node's input_config on every invocation.
 * @param inputs             Argument name → input mapping, in declaration order.
 * @param outputs            Output name → output mapping, in declaration order.
 */
public record AtomicSkill(
        String                   name,
        String                   version,
        String                   description,
        String                   nodeType,
        String                   connectionCategory,
        Map<String, Object>      defaults,
        Map<String, SkillInput>  inputs,
        Map<String, SkillOutput> outputs) implements SkillDefinition {

    public AtomicSkill {
        defaults = defaults == null ? Map.of() : defaults;
        inputs   = inputs   == null ? Map.of() : inputs;
        outputs  = outputs  == null ? Map.of() : outputs;
    }

    @Override
    public SkillKind kind() { return SkillKind.SKILL; }
}
