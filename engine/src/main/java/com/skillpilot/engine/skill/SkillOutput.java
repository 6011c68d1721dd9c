package com.skillpilot.engine.skill;

/** Declared output of an atomic skill; {@code field} is the node field it reads. */
public record SkillOutput(String field) {

    public String nodeField(String outputName) {
        return field != null ? field : outputName;
    }
}
