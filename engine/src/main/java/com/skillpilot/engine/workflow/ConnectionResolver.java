package com.skillpilot.engine.workflow;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Picks an app connection for a skill's {@code connection_category}.
 *
 * Matching is case-insensitive on the connection's {@code category}: an
 * exact match wins over a substring match (in either direction), and within
 * each tier the first connection in listing order wins.
 */
public class ConnectionResolver {

    private ConnectionResolver() {}

    public static Optional<String> resolve(String category, List<Map<String, Object>> connections) {
        if (category == null || category.isBlank() || connections == null || connections.isEmpty()) {
            return Optional.empty();
        }
        String wanted = category.strip().toLowerCase(Locale.ROOT);

        Optional<String> exact = connections.stream()
                .filter(c -> categoryOf(c).equals(wanted))
                .map(ConnectionResolver::idOf)
                .filter(id -> !id.isEmpty())
                .findFirst();
        if (exact.isPresent()) return exact;

        return connections.stream()
                .filter(c -> {
                    String cat = categoryOf(c);
                    return !cat.isEmpty() && (cat.contains(wanted) || wanted.contains(cat));
                })
                .map(ConnectionResolver::idOf)
                .filter(id -> !id.isEmpty())
                .findFirst();
    }

    private static String categoryOf(Map<String, Object> connection) {
        return connection.get("category") instanceof String s ? s.strip().toLowerCase(Locale.ROOT) : "";
    }

    private static String idOf(Map<String, Object> connection) {
        Object id = connection.get("id");
        return id == null ? "" : String.valueOf(id);
    }
}
