package com.skillpilot.engine.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{expr}}} placeholders in step inputs.
 *
 * <pre>
 *   {{topic}}                  → input["topic"]
 *   {{step1.generated_text}}   → stepResults["step1"]["generated_text"]
 *   {{step1.data.items.0}}     → first element of stepResults["step1"]["data"]["items"]
 * </pre>
 *
 * A template that is exactly one placeholder yields the referenced value with
 * its own type; anything else is rendered as a string. Placeholders that do
 * not resolve (missing key or null value) are left as written.
 */
public class TemplateResolver {

    // Matches {{ expr }}; the expression itself is trimmed after matching
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^{}]*?)}}");

    private static final ObjectMapper JSON = new ObjectMapper();

    private TemplateResolver() {}

    public static Object resolve(String template,
                                 Map<String, ?> input,
                                 Map<String, ?> stepResults) {
        if (template == null || !template.contains("{{")) {
            return template;
        }

        Matcher whole = PLACEHOLDER.matcher(template);
        if (whole.matches()) {
            Object value = lookup(whole.group(1).strip(), input, stepResults);
            return value != null ? value : template;
        }

        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Object value = lookup(m.group(1).strip(), input, stepResults);
            String replacement = value != null ? stringify(value) : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Resolve every value of {@code templates}, keeping keys and their order. */
    public static Map<String, Object> resolveAll(Map<String, String> templates,
                                                 Map<String, ?> input,
                                                 Map<String, ?> stepResults) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (templates == null) return resolved;
        templates.forEach((key, template) -> resolved.put(key, resolve(template, input, stepResults)));
        return resolved;
    }

    /** Render a resolved value the way it is inlined into a larger string. */
    public static String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    private static Object lookup(String expr, Map<String, ?> input, Map<String, ?> stepResults) {
        if (expr.isEmpty()) return null;

        int dot = expr.indexOf('.');
        if (dot < 0) {
            return input == null ? null : input.get(expr);
        }

        String stepId = expr.substring(0, dot);
        Object current = stepResults == null ? null : stepResults.get(stepId);
        for (String segment : expr.substring(dot + 1).split("\\.", -1)) {
            current = child(current, segment);
            if (current == null) return null;
        }
        return current;
    }

    private static Object child(Object parent, String segment) {
        if (parent instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (parent instanceof List<?> list) {
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
