package com.skillpilot.engine.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.SkillRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the remote workflow API.
 *
 * Wraps the five endpoints the engine needs with typed Java methods.
 * Responses are returned as plain JSON maps because the remote schema is
 * open-ended and the engine only reads a handful of well-known keys.
 *
 * Calls block the invoking thread; the engine never has two requests in
 * flight for the same invocation.
 */
@Component
public class WorkflowApiClient {

    private static final Logger log = LoggerFactory.getLogger(WorkflowApiClient.class);

    private static final TypeReference<Object> ANY_JSON = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final Duration     requestTimeout;

    public WorkflowApiClient(
            @Value("${skillpilot.api.base-url}") String baseUrl,
            @Value("${skillpilot.api.api-key:}") String apiKey,
            @Value("${skillpilot.api.request-timeout:60s}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey         = apiKey;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Workflows
    // ------------------------------------------------------------------

    /**
     * Create a workflow in the given workspace.
     *
     * @return the created workflow as returned by the API (id under {@code id} or {@code workflow_id})
     */
    public Map<String, Object> createWorkflow(Map<String, Object> definition, String workspaceId) {
        requireApiKey();
        requireWorkspace(workspaceId);
        log.info("Creating workflow '{}' in workspace {}", definition.get("name"), workspaceId);
        return asObject(send("POST", "/v1/workspaces/" + encode(workspaceId) + "/workflows", definition),
                "createWorkflow");
    }

    /** Ask the API whether a create payload is acceptable, without creating anything. */
    public Map<String, Object> validateWorkflow(Map<String, Object> definition) {
        log.debug("Validating workflow '{}' remotely", definition.get("name"));
        return asObject(send("POST", "/v1/workflows/utils/validate_create_workflow_model", definition),
                "validateWorkflow");
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    public Map<String, Object> runWorkflow(String workflowId, Map<String, Object> input) {
        log.info("Starting run of workflow {}", workflowId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workflow_id", workflowId);
        body.put("input", input == null ? Map.of() : input);
        return asObject(send("POST", "/v1/workflow_runs/", body), "runWorkflow");
    }

    public Map<String, Object> getRun(String runId) {
        return asObject(send("GET", "/v1/workflow_runs/" + encode(runId), null), "getRun");
    }

    // ------------------------------------------------------------------
    // Connections
    // ------------------------------------------------------------------

    /**
     * List app connections of a workspace.
     *
     * The endpoint answers either with a bare array or with an object
     * wrapping it under {@code items}, {@code data} or {@code results}.
     */
    public List<Map<String, Object>> listConnections(String workspaceId, String projectId, int limit) {
        requireApiKey();
        requireWorkspace(workspaceId);
        StringBuilder path = new StringBuilder("/v1/workspaces/")
                .append(encode(workspaceId))
                .append("/app_connections/?limit=").append(limit);
        if (projectId != null && !projectId.isBlank()) {
            path.append("&project_id=").append(encode(projectId));
        }
        Object body = send("GET", path.toString(), null);

        Object items = body;
        if (body instanceof Map<?, ?> wrapper) {
            items = firstPresent(wrapper, "items", "data", "results");
        }
        List<Map<String, Object>> connections = new ArrayList<>();
        if (items instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    connections.add(copyOf(map));
                }
            }
        }
        return connections;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Object send(String method, String path, Object body) {
        requireApiKey();
        String opName = method + " " + path;
        HttpResponse<String> resp;
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(requestTimeout)
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Accept",        "application/json");
            if (body != null) {
                req.header("Content-Type", "application/json")
                   .method(method, HttpRequest.BodyPublishers.ofString(toJson(body)));
            } else {
                req.method(method, HttpRequest.BodyPublishers.noBody());
            }
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SkillRunException(ErrorCode.REQUEST_FAILED,
                    opName + " failed: " + e.getMessage(), Map.of("path", path), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SkillRunException(ErrorCode.REQUEST_FAILED, opName + " interrupted", e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("statusCode", resp.statusCode());
            details.put("path",       path);
            details.put("body",       parseLenient(resp.body()));
            throw new SkillRunException(ErrorCode.REQUEST_FAILED,
                    opName + " failed with HTTP " + resp.statusCode(), details);
        }
        String text = resp.body();
        if (text == null || text.isBlank()) return Map.of();
        try {
            return json.readValue(text, ANY_JSON);
        } catch (JsonProcessingException e) {
            throw new SkillRunException(ErrorCode.REQUEST_FAILED,
                    "Failed to parse " + opName + " response", Map.of("path", path), e);
        }
    }

    /** Error bodies are kept as JSON when possible, else as the raw text. */
    private Object parseLenient(String text) {
        if (text == null || text.isBlank()) return "";
        try {
            return json.readValue(text, ANY_JSON);
        } catch (JsonProcessingException e) {
            return text;
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new SkillRunException(ErrorCode.REQUEST_FAILED, "JSON serialization failed", e);
        }
    }

    private static Map<String, Object> asObject(Object body, String opName) {
        if (body instanceof Map<?, ?> map) {
            return copyOf(map);
        }
        throw new SkillRunException(ErrorCode.REQUEST_FAILED,
                opName + " returned a non-object response");
    }

    private static Map<String, Object> copyOf(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static Object firstPresent(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            if (map.get(key) instanceof List<?> list) return list;
        }
        return null;
    }

    private void requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new SkillRunException(ErrorCode.MISSING_API_KEY,
                    "No API key configured. Set skillpilot.api.api-key or SKILLPILOT_API_KEY.");
        }
    }

    private static void requireWorkspace(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new SkillRunException(ErrorCode.MISSING_WORKSPACE_ID,
                    "No workspace id. Pass workspaceId or set skillpilot.api.workspace-id.");
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
