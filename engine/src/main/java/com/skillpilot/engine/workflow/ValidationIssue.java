package com.skillpilot.engine.workflow;

/** One problem with a workflow payload, located by a dotted path such as {@code nodes[0].name}. */
public record ValidationIssue(String path, String message) {
}
