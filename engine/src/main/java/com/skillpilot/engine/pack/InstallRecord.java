package com.skillpilot.engine.pack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * The installer's {@code .install.json} for one pack.
 *
 * Only the provisioned workflow ids matter to the engine: a skill or
 * entrypoint listed here already has a remote workflow and is never
 * recreated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstallRecord(
        String schema,
        String name,
        String version,
        @JsonProperty("installed_at")            String              installedAt,
        @JsonProperty("provisioned_skills")      Map<String, String> provisionedSkills,
        @JsonProperty("provisioned_entrypoints") Map<String, String> provisionedEntrypoints,
        @JsonProperty("skill_count")             Integer             skillCount,
        @JsonProperty("skill_names")             List<String>        skillNames) {

    public static final String SCHEMA = "agenticflow.pack.install.v1";

    public InstallRecord {
        provisionedSkills      = provisionedSkills      == null ? Map.of() : provisionedSkills;
        provisionedEntrypoints = provisionedEntrypoints == null ? Map.of() : provisionedEntrypoints;
        skillNames             = skillNames             == null ? List.of() : skillNames;
    }
}
