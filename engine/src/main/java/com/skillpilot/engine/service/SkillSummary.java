package com.skillpilot.engine.service;

/** One row of the installed-skills listing. */
public record SkillSummary(
        String  name,
        String  pack,
        String  kind,
        String  version,
        String  description,
        boolean provisioned) {
}
