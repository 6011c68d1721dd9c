package com.skillpilot.engine.pack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A connection category the pack's skills expect to find in the workspace. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PackConnection(String category, String name, Boolean required) {}
