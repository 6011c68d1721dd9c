package com.skillpilot.engine.skill;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declared input of an atomic skill.
 *
 * @param field        Node input field this argument feeds; null means "same as the argument name".
 * @param required     Null is treated as required; only an explicit {@code false} makes it optional.
 * @param defaultValue Literal baked into the workflow when the input is optional.
 * @param description  Free text copied into the generated input schema.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkillInput(
        String  field,
        Boolean required,
        @JsonProperty("default")
        Object  defaultValue,
        String  description) {

    public String nodeField(String argName) {
        return field != null ? field : argName;
    }

    public boolean isRequired() {
        return !Boolean.FALSE.equals(required);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
