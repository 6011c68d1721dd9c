package com.skillpilot.engine.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillpilot.engine.skill.ErrorCode;
import com.skillpilot.engine.skill.SkillRunException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wire-level tests for WorkflowApiClient against a local MockWebServer.
 */
class WorkflowApiClientTest {

    MockWebServer     server;
    WorkflowApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = clientWithKey("sk-test");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    WorkflowApiClient clientWithKey(String apiKey) {
        return new WorkflowApiClient(server.url("/").toString(), apiKey, Duration.ofSeconds(5), new ObjectMapper());
    }

    static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    // ------------------------------------------------------------------
    // Requests
    // ------------------------------------------------------------------

    @Test
    void createWorkflow_postsToWorkspaceWithBearerToken() throws Exception {
        server.enqueue(json(200, "{\"id\":\"wf-1\"}"));

        Map<String, Object> created = client.createWorkflow(Map.of("name", "skill-x-run"), "ws-1");

        assertThat(created).containsEntry("id", "wf-1");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v1/workspaces/ws-1/workflows");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
        assertThat(request.getBody().readUtf8()).contains("\"name\":\"skill-x-run\"");
    }

    @Test
    void validateWorkflow_postsToValidationEndpoint() throws Exception {
        server.enqueue(json(200, "{\"valid\":true}"));

        client.validateWorkflow(Map.of("name", "w"));

        assertThat(server.takeRequest().getPath())
                .isEqualTo("/v1/workflows/utils/validate_create_workflow_model");
    }

    @Test
    void runWorkflow_sendsWorkflowIdAndInput() throws Exception {
        server.enqueue(json(200, "{\"id\":\"run-1\",\"status\":\"queued\"}"));

        Map<String, Object> run = client.runWorkflow("wf-1", Map.of("topic", "cats"));

        assertThat(run).containsEntry("status", "queued");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/workflow_runs/");
        assertThat(request.getBody().readUtf8())
                .isEqualTo("{\"workflow_id\":\"wf-1\",\"input\":{\"topic\":\"cats\"}}");
    }

    @Test
    void getRun_getsRunById() throws Exception {
        server.enqueue(json(200, "{\"id\":\"run-1\",\"status\":\"success\",\"output\":{\"text\":\"hi\"}}"));

        Map<String, Object> run = client.getRun("run-1");

        assertThat(run).containsEntry("output", Map.of("text", "hi"));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/v1/workflow_runs/run-1");
    }

    // ------------------------------------------------------------------
    // Connections
    // ------------------------------------------------------------------

    @Test
    void listConnections_bareArray() throws Exception {
        server.enqueue(json(200, "[{\"id\":\"c1\",\"category\":\"openai\"}]"));

        List<Map<String, Object>> connections = client.listConnections("ws-1", "proj-1", 200);

        assertThat(connections).extracting(c -> c.get("id")).containsExactly("c1");
        assertThat(server.takeRequest().getPath())
                .isEqualTo("/v1/workspaces/ws-1/app_connections/?limit=200&project_id=proj-1");
    }

    @Test
    void listConnections_wrappedUnderItems() {
        server.enqueue(json(200, "{\"items\":[{\"id\":\"c1\"},{\"id\":\"c2\"}],\"total\":2}"));

        assertThat(client.listConnections("ws-1", null, 200)).hasSize(2);
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void httpError_raisesRequestFailedWithStatusAndBody() {
        server.enqueue(json(422, "{\"detail\":\"bad node\"}"));

        assertThatThrownBy(() -> client.getRun("run-1"))
                .isInstanceOf(SkillRunException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.REQUEST_FAILED)
                .satisfies(e -> {
                    Map<String, Object> details = ((SkillRunException) e).getDetails();
                    assertThat(details).containsEntry("statusCode", 422);
                    assertThat(details).containsEntry("body", Map.of("detail", "bad node"));
                });
    }

    @Test
    void missingApiKey_failsBeforeAnyRequest() {
        WorkflowApiClient anonymous = clientWithKey("");

        assertThatThrownBy(() -> anonymous.getRun("run-1"))
                .hasFieldOrPropertyWithValue("code", ErrorCode.MISSING_API_KEY);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void missingWorkspace_failsBeforeAnyRequest() {
        assertThatThrownBy(() -> client.createWorkflow(Map.of("name", "w"), " "))
                .hasFieldOrPropertyWithValue("code", ErrorCode.MISSING_WORKSPACE_ID);
        assertThat(server.getRequestCount()).isZero();
    }
}
