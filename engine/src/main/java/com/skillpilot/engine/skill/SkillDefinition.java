package com.skillpilot.engine.skill;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A skill as declared on disk.
 *
 * Either an {@link AtomicSkill} bound to one remote node type, or a
 * {@link ComposedSkill} that chains steps. Callers dispatch on the concrete
 * type; there is no third kind.
 */
public sealed interface SkillDefinition permits AtomicSkill, ComposedSkill {

    String name();

    String version();

    String description();

    @JsonProperty("kind")
    SkillKind kind();
}
