package com.skillpilot.engine.workflow;

import com.skillpilot.engine.skill.AtomicSkill;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.SkillDefinition;
import com.skillpilot.engine.skill.SkillRunException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns an atomic skill into a single-node workflow create payload.
 *
 * <pre>
 *   nodes:          [ {name: main, node_type_name: &lt;node_type&gt;, input_config, connection?} ]
 *   input_config:   defaults + one entry per input ("{{arg}}", or the literal default when optional)
 *   input_schema:   object, one string property per input
 *   output_mapping: output name → "${main.&lt;field&gt;}"
 * </pre>
 */
public class SkillWorkflowBuilder {

    static final String MAIN_NODE = "main";

    private static final Pattern WORD_START = Pattern.compile("\\b\\w");

    private SkillWorkflowBuilder() {}

    public static Map<String, Object> build(SkillDefinition definition, String projectId, String connectionId) {
        if (!(definition instanceof AtomicSkill skill)) {
            throw new SkillRunException(ErrorCode.SKILL_INVALID_DEFINITION,
                    "Only atomic skills (kind: Skill) can become a workflow, got '"
                    + definition.kind().label() + "' for '" + definition.name() + "'.",
                    Map.of("skill", definition.name()));
        }
        if (skill.nodeType() == null || skill.nodeType().isBlank()) {
            throw new SkillRunException(ErrorCode.SKILL_INVALID_DEFINITION,
                    "Atomic skill '" + skill.name() + "' is missing node_type.",
                    Map.of("skill", skill.name()));
        }

        Map<String, Object> inputConfig = new LinkedHashMap<>(skill.defaults());
        Map<String, Object> properties  = new LinkedHashMap<>();
        List<String>        required    = new ArrayList<>();

        skill.inputs().forEach((argName, input) -> {
            String nodeField = input.nodeField(argName);
            if (!input.isRequired() && input.hasDefault()) {
                inputConfig.put(nodeField, input.defaultValue());
            } else {
                inputConfig.put(nodeField, "{{" + argName + "}}");
            }

            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type",  "string");
            property.put("title", title(argName));
            if (input.description() != null && !input.description().isEmpty()) {
                property.put("description", input.description());
            }
            if (input.hasDefault()) {
                property.put("default", input.defaultValue());
            }
            properties.put(argName, property);

            if (input.isRequired()) {
                required.add(argName);
            }
        });

        Map<String, String> outputMapping = new LinkedHashMap<>();
        skill.outputs().forEach((outputName, output) ->
                outputMapping.put(outputName, "${" + MAIN_NODE + "." + output.nodeField(outputName) + "}"));

        Map<String, Object> mainNode = new LinkedHashMap<>();
        mainNode.put("name",           MAIN_NODE);
        mainNode.put("node_type_name", skill.nodeType());
        mainNode.put("input_config",   inputConfig);
        if (connectionId != null && !connectionId.isEmpty()) {
            mainNode.put("connection", connectionId);
        }

        Map<String, Object> inputSchema = new LinkedHashMap<>();
        inputSchema.put("type",       "object");
        inputSchema.put("title",      skill.name() + " Input");
        inputSchema.put("required",   required);
        inputSchema.put("properties", properties);

        Map<String, Object> workflow = new LinkedHashMap<>();
        workflow.put("name",           "skill-" + skill.name() + "-run");
        workflow.put("description",    skill.description() != null
                ? skill.description()
                : "Auto-generated workflow for skill '" + skill.name() + "'.");
        workflow.put("nodes",          List.of(mainNode));
        workflow.put("output_mapping", outputMapping);
        workflow.put("input_schema",   inputSchema);
        if (projectId != null && !projectId.isEmpty()) {
            workflow.put("project_id", projectId);
        }
        return workflow;
    }

    /** {@code human_message} → {@code Human Message}. */
    static String title(String argName) {
        return WORD_START.matcher(argName.replace('_', ' '))
                .replaceAll(m -> m.group().toUpperCase());
    }
}
