package com.skillpilot.engine.workflow;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides when to stop polling a remote run.
 *
 * <pre>
 *   terminal: completed complete success succeeded failed error cancelled canceled timed_out timeout
 *   failed:   failed error cancelled canceled timed_out timeout
 * </pre>
 * Anything else, including an empty or missing status, is still running.
 */
public class RunStatusClassifier {

    private static final Set<String> SUCCESS = Set.of("completed", "complete", "success", "succeeded");
    private static final Set<String> FAILURE = Set.of("failed", "error", "cancelled", "canceled", "timed_out", "timeout");

    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]+");

    private RunStatusClassifier() {}

    public static RunStatus classify(String rawStatus) {
        String raw        = rawStatus == null ? "" : rawStatus;
        String normalized = SEPARATORS.matcher(raw.strip().toLowerCase()).replaceAll("_");
        boolean failed    = FAILURE.contains(normalized);
        boolean terminal  = failed || SUCCESS.contains(normalized);
        return new RunStatus(raw, normalized, terminal, failed);
    }

    /** Status of a run object: {@code status}, else {@code state}, else {@code execution.status}. */
    public static String statusOf(Map<String, Object> run) {
        if (run == null) return "";
        for (String key : new String[]{"status", "state"}) {
            if (run.get(key) instanceof String s && !s.isBlank()) return s;
        }
        if (run.get("execution") instanceof Map<?, ?> execution
                && execution.get("status") instanceof String s) {
            return s;
        }
        return "";
    }

    public static RunStatus classify(Map<String, Object> run) {
        return classify(statusOf(run));
    }
}
