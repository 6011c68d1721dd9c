package com.skillpilot.engine.api.dto;

import com.skillpilot.engine.skill.SkillRunException;

import java.util.Map;

/** Body of every failed request: a stable code, a human message and optional details. */
public record ErrorResponse(String code, String message, Map<String, Object> details) {

    public static ErrorResponse from(SkillRunException e) {
        return new ErrorResponse(e.getCode().code(), e.getMessage(), e.getDetails());
    }
}
