package com.skillpilot.engine.executor;

import com.skillpilot.engine.pack.SkillRegistry;
import com.skillpilot.engine.workflow.RunOptions;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Everything one invocation shares across its steps: the pack snapshot,
 * run options, project scope and the connection listing (fetched at most once).
 *
 * Not thread-safe; an invocation runs on a single thread.
 */
public class InvocationContext {

    private final SkillRegistry registry;
    private final RunOptions    options;
    private final String        projectId;

    private List<Map<String, Object>> connections;

    public InvocationContext(SkillRegistry registry, RunOptions options, String projectId) {
        this.registry  = registry;
        this.options   = options;
        this.projectId = projectId;
    }

    public SkillRegistry registry() { return registry; }

    public RunOptions options() { return options; }

    public String projectId() { return projectId; }

    /** The workspace connections, listed through {@code lister} on first use only. */
    public List<Map<String, Object>> connections(Supplier<List<Map<String, Object>>> lister) {
        if (connections == null) {
            connections = List.copyOf(lister.get());
        }
        return connections;
    }
}
