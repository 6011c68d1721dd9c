package com.skillpilot.engine.pack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A runnable workflow shipped with a pack.
 *
 * @param workflow     Pack-relative path to the workflow JSON body.
 * @param defaultInput Pack-relative path to a JSON object used as base input (optional).
 * @param mode         "local", "cloud" or "hybrid"; informational only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PackEntrypoint(
        String id,
        String workflow,
        @JsonProperty("default_input") String defaultInput,
        String mode) {}
