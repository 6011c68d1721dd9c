package com.skillpilot.engine.executor;

import com.skillpilot.engine.workflow.RunStatusClassifier;

final class Outcomes {

    private Outcomes() {}

    static String of(String status, boolean failed, boolean timedOut) {
        if (timedOut) return "timed_out";
        if (failed)   return "failed";
        return RunStatusClassifier.classify(status).terminal() ? "success" : "submitted";
    }
}
