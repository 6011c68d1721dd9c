package com.skillpilot.engine.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shape checks for workflow payloads, run before any network call so a bad
 * skill definition fails fast with every problem listed at once.
 *
 * Mirrors the constraints the remote API enforces on create and run
 * requests; it does not know anything about node types.
 */
public class WorkflowPayloadValidator {

    private WorkflowPayloadValidator() {}

    public static List<ValidationIssue> validateCreate(Object payload) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (!checkObject(payload, issues, "$", true)) return issues;
        Map<?, ?> body = (Map<?, ?>) payload;

        checkString(body.get("name"),        issues, "$.name",        true, 1, 100);
        checkString(body.get("description"), issues, "$.description", false, 0, 400);
        checkNodes(body.get("nodes"), issues, "$.nodes");
        checkStringMap(body.get("output_mapping"), issues, "$.output_mapping", true);
        checkObject(body.get("input_schema"), issues, "$.input_schema", true);
        checkString(body.get("project_id"),  issues, "$.project_id",  true, 1, null);

        if (body.get("workflow_metadata") != null) {
            checkObject(body.get("workflow_metadata"), issues, "$.workflow_metadata", false);
        }
        return issues;
    }

    public static List<ValidationIssue> validateRun(Object payload) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (!checkObject(payload, issues, "$", true)) return issues;
        Map<?, ?> body = (Map<?, ?>) payload;

        checkString(body.get("workflow_id"), issues, "$.workflow_id", true, 1, null);
        if (body.get("input") != null && !(body.get("input") instanceof Map<?, ?>)) {
            issues.add(new ValidationIssue("$.input", "must be an object when provided"));
        }
        return issues;
    }

    // ------------------------------------------------------------------
    // Nodes
    // ------------------------------------------------------------------

    private static void checkNodes(Object value, List<ValidationIssue> issues, String path) {
        if (!(value instanceof List<?> nodes)) {
            issues.add(new ValidationIssue(path, "must be an array"));
            return;
        }
        if (nodes.isEmpty()) {
            issues.add(new ValidationIssue(path, "must contain at least one node"));
        }
        if (nodes.size() > 100) {
            issues.add(new ValidationIssue(path, "must contain at most 100 nodes"));
        }
        for (int i = 0; i < nodes.size(); i++) {
            checkNode(nodes.get(i), issues, path + "[" + i + "]");
        }
    }

    private static void checkNode(Object value, List<ValidationIssue> issues, String path) {
        if (!checkObject(value, issues, path, true)) return;
        Map<?, ?> node = (Map<?, ?>) value;

        checkString(node.get("name"),           issues, path + ".name",           true,  1, 100);
        checkString(node.get("title"),          issues, path + ".title",          false, 0, 100);
        checkString(node.get("description"),    issues, path + ".description",    false, 0, 400);
        checkString(node.get("node_type_name"), issues, path + ".node_type_name", true,  1, 100);
        checkObject(node.get("input_config"),   issues, path + ".input_config",   true);

        if (node.get("output_mapping") != null) {
            checkStringMap(node.get("output_mapping"), issues, path + ".output_mapping", false);
        }
        if (node.get("connection") != null && !(node.get("connection") instanceof String)) {
            issues.add(new ValidationIssue(path + ".connection", "must be a string or null"));
        }
    }

    // ------------------------------------------------------------------
    // Primitive checks
    // ------------------------------------------------------------------

    private static void checkString(Object value, List<ValidationIssue> issues, String path,
                                    boolean required, int minLength, Integer maxLength) {
        if (value == null) {
            if (required) issues.add(new ValidationIssue(path, "is required"));
            return;
        }
        if (!(value instanceof String s)) {
            issues.add(new ValidationIssue(path, "must be a string"));
            return;
        }
        if (s.length() < minLength) {
            issues.add(new ValidationIssue(path, "must be at least " + minLength + " characters"));
        }
        if (maxLength != null && s.length() > maxLength) {
            issues.add(new ValidationIssue(path, "must be <= " + maxLength + " characters"));
        }
    }

    private static boolean checkObject(Object value, List<ValidationIssue> issues, String path, boolean required) {
        if (value == null) {
            if (required) issues.add(new ValidationIssue(path, "is required"));
            return false;
        }
        if (!(value instanceof Map<?, ?>)) {
            issues.add(new ValidationIssue(path, "must be an object"));
            return false;
        }
        return true;
    }

    private static void checkStringMap(Object value, List<ValidationIssue> issues, String path, boolean required) {
        if (!checkObject(value, issues, path, required)) return;
        ((Map<?, ?>) value).forEach((key, raw) -> {
            if (!(raw instanceof String)) {
                issues.add(new ValidationIssue(path + "." + key, "must be a string"));
            }
        });
    }
}
