package com.skillpilot.engine.service;

import com.skillpilot.engine.skill.SkillDefinition;

/** A skill definition plus the pack it was found in and its provisioned workflow, if any. */
public record SkillDetail(String pack, String provisionedWorkflowId, SkillDefinition definition) {
}
