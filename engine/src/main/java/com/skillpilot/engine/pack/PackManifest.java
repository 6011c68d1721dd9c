package com.skillpilot.engine.pack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

/**
 * Contents of {@code pack.yaml}. Read-only to the engine; only used to find
 * the pack's name and its entrypoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PackManifest(
        String               apiVersion,
        String               kind,
        String               name,
        String               version,
        String               description,
        List<PackEntrypoint> entrypoints,
        List<String>         skills,
        List<PackConnection> connections) {

    public PackManifest {
        entrypoints = entrypoints == null ? List.of() : List.copyOf(entrypoints);
        skills      = skills      == null ? List.of() : List.copyOf(skills);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    public Optional<PackEntrypoint> entrypoint(String id) {
        return entrypoints.stream().filter(e -> id.equals(e.id())).findFirst();
    }
}
