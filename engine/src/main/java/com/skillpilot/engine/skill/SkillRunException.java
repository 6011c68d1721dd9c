package com.skillpilot.engine.skill;

import java.util.Map;

/**
 * The single failure type of a skill invocation.
 *
 * Unchecked so intermediate layers only catch it when they have something
 * to add; everything else propagates to the caller, which reads
 * {@link #getCode()} and {@link #getDetails()}.
 */
public class SkillRunException extends RuntimeException {

    private final ErrorCode           code;
    private final Map<String, Object> details;

    public SkillRunException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public SkillRunException(ErrorCode code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    public SkillRunException(ErrorCode code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public SkillRunException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code    = code;
        this.details = details == null ? Map.of() : details;
    }

    public ErrorCode getCode() { return code; }

    public Map<String, Object> getDetails() { return details; }
}
