package com.skillpilot.engine.executor;

/** What a caller gets back from one skill or entrypoint invocation. */
public sealed interface ExecutionReport permits AtomicRunReport, ComposedRunReport, EntrypointRunReport {

    /** Short outcome used as a metric tag: success, failed, timed_out or submitted. */
    String outcome();
}
