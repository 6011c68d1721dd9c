package com.skillpilot.engine.skill;

import java.util.Map;

/**
 * One step of a {@link ComposedSkill}.
 *
 * Input values are templates resolved against the invocation input and the
 * results of earlier steps.
 */
public sealed interface SkillStep permits SkillCallStep, LocalStep {

    String id();

    Map<String, String> inputs();
}
