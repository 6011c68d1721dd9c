package com.skillpilot.engine.workflow;

/**
 * Classification of a remote run status string.
 *
 * @param raw        Status exactly as the API reported it (empty when absent).
 * @param normalized Lower-cased, with whitespace and hyphen runs collapsed to {@code _}.
 */
public record RunStatus(String raw, String normalized, boolean terminal, boolean failed) {

    public boolean succeeded() {
        return terminal && !failed;
    }
}
