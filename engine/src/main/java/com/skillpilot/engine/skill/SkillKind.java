package com.skillpilot.engine.skill;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The {@code kind} discriminator of a skill file.
 *
 * SKILL          : atomic, wraps one remote node type (skill.yaml).
 * COMPOSED_SKILL : ordered steps over atomic skills and local scripts (compose.yaml).
 */
public enum SkillKind {
    SKILL("Skill"),
    COMPOSED_SKILL("ComposedSkill");

    private final String label;

    SkillKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() { return label; }

    /** Parse the YAML {@code kind} value; returns null for anything unrecognised. */
    public static SkillKind fromLabel(String label) {
        for (SkillKind k : values()) {
            if (k.label.equals(label)) return k;
        }
        return null;
    }
}
