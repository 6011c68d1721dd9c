package com.skillpilot.engine.api;

import com.skillpilot.engine.api.dto.ErrorResponse;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.SkillRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Renders every failure as {@code {code, message, details}}.
 *
 * <pre>
 *   404  skill_not_found, pack_not_found, pack_entrypoint_not_found, skill_run_sub_not_found
 *   400  definition, validation and configuration problems
 *   504  skill_run_step_timeout
 *   502  everything else (remote failures, failed steps)
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SkillRunException.class)
    public ResponseEntity<ErrorResponse> handleSkillRun(SkillRunException e) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.warn("{} -> HTTP {}: {}", e.getCode().code(), status.value(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.from(e));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(
                ErrorCode.LOCAL_VALIDATION_FAILED.code(), "Malformed request body", Map.of()));
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case SKILL_NOT_FOUND, PACK_NOT_FOUND, PACK_ENTRYPOINT_NOT_FOUND, SKILL_RUN_SUB_NOT_FOUND
                    -> HttpStatus.NOT_FOUND;
            case SKILL_INVALID_DEFINITION, SKILL_RUN_NO_STEPS, SKILL_RUN_LOCAL_NO_SCRIPT,
                 SKILL_RUN_NESTED_COMPOSE, LOCAL_VALIDATION_FAILED, MISSING_API_KEY, MISSING_WORKSPACE_ID
                    -> HttpStatus.BAD_REQUEST;
            case SKILL_RUN_STEP_TIMEOUT
                    -> HttpStatus.GATEWAY_TIMEOUT;
            case SKILL_RUN_LOCAL_FAILED, SKILL_RUN_STEP_FAILED, SKILL_RUN_CREATE_FAILED,
                 SKILL_RUN_SUB_CREATE_FAILED, SKILL_RUN_MISSING_RUN_ID, REQUEST_FAILED
                    -> HttpStatus.BAD_GATEWAY;
        };
    }
}
