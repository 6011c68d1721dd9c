package com.skillpilot.engine.skill;

/**
 * Stable, machine-readable failure codes surfaced to callers.
 *
 * The wire form is the lower-case enum name ({@link #code()}), e.g.
 * {@code skill_run_step_failed}.
 */
public enum ErrorCode {
    SKILL_NOT_FOUND,
    SKILL_INVALID_DEFINITION,
    SKILL_RUN_NO_STEPS,
    SKILL_RUN_LOCAL_NO_SCRIPT,
    SKILL_RUN_LOCAL_FAILED,
    SKILL_RUN_SUB_NOT_FOUND,
    SKILL_RUN_NESTED_COMPOSE,
    SKILL_RUN_STEP_FAILED,
    SKILL_RUN_STEP_TIMEOUT,
    SKILL_RUN_CREATE_FAILED,
    SKILL_RUN_SUB_CREATE_FAILED,
    SKILL_RUN_MISSING_RUN_ID,
    LOCAL_VALIDATION_FAILED,
    MISSING_API_KEY,
    MISSING_WORKSPACE_ID,
    PACK_NOT_FOUND,
    PACK_ENTRYPOINT_NOT_FOUND,
    REQUEST_FAILED;

    public String code() {
        return name().toLowerCase();
    }
}
