package com.skillpilot.engine.executor;

/**
 * Outcome of one local script execution.
 *
 * @param exitCode -1 when the script was killed on timeout
 */
public record LocalScriptResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }
}
