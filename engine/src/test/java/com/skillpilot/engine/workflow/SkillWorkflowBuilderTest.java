package com.skillpilot.engine.workflow;

import com.skillpilot.engine.skill.AtomicSkill;
import com.skillpilot.engine.skill.ComposedSkill;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.SkillInput;
import com.skillpilot.engine.skill.SkillOutput;
import com.skillpilot.engine.skill.SkillRunException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SkillWorkflowBuilderTest {

    static AtomicSkill llmSkill() {
        Map<String, SkillInput> inputs = new LinkedHashMap<>();
        inputs.put("prompt",      new SkillInput("human_message", null, null, "What to write about"));
        inputs.put("temperature", new SkillInput(null, false, 0.7, null));
        return new AtomicSkill("llm-generate", "1.0.0", null, "llm", "openai",
                Map.of("model", "gpt-4o-mini"),
                inputs,
                Map.of("text", new SkillOutput("generated_text")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void build_atomicSkill_mapsInputsToConfigAndSchema() {
        Map<String, Object> workflow = SkillWorkflowBuilder.build(llmSkill(), "proj-1", null);

        Map<String, Object> node = ((List<Map<String, Object>>) workflow.get("nodes")).get(0);
        assertThat(node).containsEntry("name", "main").containsEntry("node_type_name", "llm");
        assertThat(node).doesNotContainKey("connection");
        assertThat((Map<String, Object>) node.get("input_config")).containsExactly(
                Map.entry("model", "gpt-4o-mini"),
                Map.entry("human_message", "{{prompt}}"),
                Map.entry("temperature", 0.7));

        Map<String, Object> schema = (Map<String, Object>) workflow.get("input_schema");
        assertThat(schema).containsEntry("type", "object").containsEntry("title", "llm-generate Input");
        assertThat((List<String>) schema.get("required")).containsExactly("prompt");

        Map<String, Object> properties = (Map<String, Object>) schema.get("properties");
        assertThat((Map<String, Object>) properties.get("prompt"))
                .containsEntry("type", "string")
                .containsEntry("title", "Prompt")
                .containsEntry("description", "What to write about")
                .doesNotContainKey("default");
        assertThat((Map<String, Object>) properties.get("temperature")).containsEntry("default", 0.7);

        assertThat(workflow.get("output_mapping")).isEqualTo(Map.of("text", "${main.generated_text}"));
        assertThat(workflow).containsEntry("name", "skill-llm-generate-run")
                .containsEntry("description", "Auto-generated workflow for skill 'llm-generate'.")
                .containsEntry("project_id", "proj-1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void build_withConnection_setOnMainNode() {
        Map<String, Object> workflow = SkillWorkflowBuilder.build(llmSkill(), null, "conn-9");

        Map<String, Object> node = ((List<Map<String, Object>>) workflow.get("nodes")).get(0);
        assertThat(node).containsEntry("connection", "conn-9");
        assertThat(workflow).doesNotContainKey("project_id");
    }

    @Test
    void build_producesLocallyValidPayload() {
        Map<String, Object> workflow = SkillWorkflowBuilder.build(llmSkill(), "proj-1", "conn-9");
        assertThat(WorkflowPayloadValidator.validateCreate(workflow)).isEmpty();
    }

    @Test
    void build_composedSkill_rejected() {
        ComposedSkill composed = new ComposedSkill("pipeline", "1.0.0", null, List.of(), Map.of());

        assertThatThrownBy(() -> SkillWorkflowBuilder.build(composed, null, null))
                .isInstanceOf(SkillRunException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.SKILL_INVALID_DEFINITION);
    }

    @Test
    void build_missingNodeType_rejected() {
        AtomicSkill skill = new AtomicSkill("broken", "1.0.0", null, null, null, null, null, null);

        assertThatThrownBy(() -> SkillWorkflowBuilder.build(skill, null, null))
                .isInstanceOf(SkillRunException.class)
                .hasMessageContaining("missing node_type");
    }

    @Test
    void title_underscoresBecomeCapitalisedWords() {
        assertThat(SkillWorkflowBuilder.title("human_message")).isEqualTo("Human Message");
        assertThat(SkillWorkflowBuilder.title("url")).isEqualTo("Url");
    }
}
