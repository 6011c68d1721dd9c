package com.skillpilot.engine.skill;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads skill definitions from a skill directory.
 *
 * The first file found among {@code skill.yaml}, {@code skill.yml},
 * {@code compose.yaml}, {@code compose.yml} is parsed; its {@code kind}
 * field (not the file name) decides between atomic and composed.
 *
 * Every problem is reported as {@link ErrorCode#SKILL_INVALID_DEFINITION}.
 */
public final class SkillDefinitionLoader {

    static final List<String> SKILL_FILES = List.of(
            "skill.yaml", "skill.yml", "compose.yaml", "compose.yml");

    private static final String DEFAULT_VERSION = "0.0.0";

    private SkillDefinitionLoader() {}

    public static SkillDefinition load(Path skillDir) {
        for (String candidate : SKILL_FILES) {
            Path file = skillDir.resolve(candidate);
            if (Files.isRegularFile(file)) {
                return parse(readYamlObject(file), file);
            }
        }
        throw invalid("No skill.yaml or compose.yaml found in " + skillDir, skillDir);
    }

    /** True when the directory holds one of the recognised skill files. */
    public static boolean isSkillDirectory(Path dir) {
        return SKILL_FILES.stream().anyMatch(f -> Files.isRegularFile(dir.resolve(f)));
    }

    /**
     * Parse a YAML document that must be a mapping at the top level.
     * Shared with the pack manifest reader.
     */
    public static Map<String, Object> readYamlObject(Path file) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        try (Reader reader = Files.newBufferedReader(file)) {
            Object loaded = yaml.load(reader);
            if (!(loaded instanceof Map<?, ?> map)) {
                throw invalid("File " + file + " must be a YAML object.", file);
            }
            return asStringMap(map);
        } catch (IOException | YAMLException e) {
            throw new SkillRunException(ErrorCode.SKILL_INVALID_DEFINITION,
                    "Could not read " + file + ": " + e.getMessage(),
                    Map.of("path", file.toString()), e);
        }
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    static SkillDefinition parse(Map<String, Object> raw, Path file) {
        Object kindValue = raw.get("kind");
        SkillKind kind = kindValue instanceof String s ? SkillKind.fromLabel(s) : null;
        if (kind == null) {
            throw invalid("Invalid skill kind '" + (kindValue == null ? "(missing)" : kindValue)
                    + "' in " + file + ". Must be 'Skill' or 'ComposedSkill'.", file);
        }
        String name = string(raw.get("name"));
        if (name == null || name.isBlank()) {
            throw invalid("Skill name is required in " + file + ".", file);
        }
        String version = raw.get("version") == null ? DEFAULT_VERSION : string(raw.get("version"));
        String description = string(raw.get("description"));

        if (kind == SkillKind.SKILL) {
            return new AtomicSkill(
                    name, version, description,
                    string(raw.get("node_type")),
                    string(raw.get("connection_category")),
                    raw.get("defaults") instanceof Map<?, ?> d ? asStringMap(d) : Map.of(),
                    parseInputs(raw.get("inputs")),
                    parseOutputs(raw.get("outputs")));
        }

        Map<String, String> composedOutputs = new LinkedHashMap<>();
        if (raw.get("outputs") instanceof Map<?, ?> outs) {
            outs.forEach((k, v) -> composedOutputs.put(String.valueOf(k), String.valueOf(v)));
        }
        return new ComposedSkill(name, version, description, parseSteps(raw.get("steps"), file), composedOutputs);
    }

    private static Map<String, SkillInput> parseInputs(Object raw) {
        Map<String, SkillInput> result = new LinkedHashMap<>();
        if (!(raw instanceof Map<?, ?> map)) return result;
        map.forEach((key, value) -> {
            if (value instanceof Map<?, ?> input) {
                result.put(String.valueOf(key), new SkillInput(
                        string(input.get("field")),
                        input.get("required") instanceof Boolean b ? b : null,
                        input.get("default"),
                        string(input.get("description"))));
            }
        });
        return result;
    }

    private static Map<String, SkillOutput> parseOutputs(Object raw) {
        Map<String, SkillOutput> result = new LinkedHashMap<>();
        if (!(raw instanceof Map<?, ?> map)) return result;
        map.forEach((key, value) -> {
            if (value instanceof Map<?, ?> output) {
                result.put(String.valueOf(key), new SkillOutput(string(output.get("field"))));
            }
        });
        return result;
    }

    private static List<SkillStep> parseSteps(Object raw, Path file) {
        List<SkillStep> steps = new ArrayList<>();
        if (!(raw instanceof List<?> list)) return steps;

        Set<String> seenIds = new HashSet<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> step)) continue;

            String id = string(step.get("id"));
            if (id == null || id.isBlank()) {
                throw invalid("Every step needs an id in " + file + ".", file);
            }
            if (!seenIds.add(id)) {
                throw invalid("Duplicate step id '" + id + "' in " + file + ".", file);
            }

            Map<String, String> inputs = new LinkedHashMap<>();
            if (step.get("inputs") instanceof Map<?, ?> in) {
                in.forEach((k, v) -> inputs.put(String.valueOf(k), String.valueOf(v)));
            }

            String skill = string(step.get("skill"));
            boolean local = Boolean.TRUE.equals(step.get("local"));
            if (local && skill != null) {
                throw invalid("Step '" + id + "' in " + file + " declares both 'skill' and 'local'.", file);
            }
            if (local) {
                steps.add(new LocalStep(id, string(step.get("script")), inputs));
            } else if (skill != null && !skill.isBlank()) {
                steps.add(new SkillCallStep(id, skill, inputs));
            } else {
                throw invalid("Step '" + id + "' in " + file + " must declare 'skill' or 'local: true'.", file);
            }
        }
        return steps;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String string(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Map<String, Object> asStringMap(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static SkillRunException invalid(String message, Path path) {
        return new SkillRunException(ErrorCode.SKILL_INVALID_DEFINITION, message,
                Map.of("path", path.toString()));
    }
}
