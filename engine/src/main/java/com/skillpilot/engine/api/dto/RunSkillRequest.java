package com.skillpilot.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Map;

/**
 * Request body for POST /skills/{name}/runs and POST /packs/{pack}/entrypoints/{id}/runs.
 *
 * Every field is optional; omitted run options fall back to the configured
 * defaults ({@code skillpilot.run.*}, {@code skillpilot.api.workspace-id}).
 */
public record RunSkillRequest(
        Map<String, Object> input,
        @JsonProperty("wait")
        Boolean             waitForCompletion,
        Long                pollIntervalMs,
        Long                timeoutMs,
        String              workspaceId,
        Boolean             validateRemotely) {

    public RunSkillRequest {
        if (input == null) input = Map.of();
    }

    public static RunSkillRequest empty() {
        return new RunSkillRequest(null, null, null, null, null, null);
    }

    public Duration pollInterval() {
        return pollIntervalMs == null ? null : Duration.ofMillis(pollIntervalMs);
    }

    public Duration timeout() {
        return timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
    }
}
