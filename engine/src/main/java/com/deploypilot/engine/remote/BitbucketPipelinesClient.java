package com.deploypilot.engine.remote;

import com.deploypilot.engine.remote.dto.RemoteRunRef;
import com.deploypilot.engine.remote.dto.RemoteRunStatus;
import com.deploypilot.engine.remote.dto.RemoteStepStatus;
import com.deploypilot.engine.remote.dto.TriggerRequest;
import com.deploypilot.engine.remote.dto.TriggerResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for Bitbucket Cloud Pipelines (REST API 2.0).
 *
 * Uses java.net.http.HttpClient + Jackson, like the rest of the engine's
 * outbound clients, so every header and status code is visible here.
 *
 * Remote states are flattened into one string per run/step:
 * <pre>
 *   PENDING | IN_PROGRESS | PAUSED | HALTED ...   (non-terminal, passed through)
 *   COMPLETED + SUCCESSFUL  → COMPLETED
 *   COMPLETED + FAILED      → FAILED
 *   COMPLETED + STOPPED     → STOPPED
 *   COMPLETED + ERROR       → ERROR
 * </pre>
 */
@Component
public class BitbucketPipelinesClient implements RemoteCiClient {

    private static final Logger log = LoggerFactory.getLogger(BitbucketPipelinesClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       accessToken;
    private final Duration     requestTimeout;

    public BitbucketPipelinesClient(
            @Value("${deploypilot.remote.base-url:https://api.bitbucket.org/2.0}") String baseUrl,
            @Value("${deploypilot.remote.access-token:}") String accessToken,
            @Value("${deploypilot.remote.request-timeout:PT30S}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.accessToken    = accessToken;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)   // step logs redirect to storage
                .build();
    }

    // ------------------------------------------------------------------
    // RemoteCiClient
    // ------------------------------------------------------------------

    @Override
    public TriggerResult trigger(TriggerRequest request) {
        log.info("Triggering pipeline on {}/{} branch {}{}", request.workspace(), request.repoSlug(),
                request.branch(), request.commitHash() != null ? " @ " + request.commitHash() : "");
        String body = toJson(triggerBody(request));
        String response = send(HttpRequest.newBuilder()
                .uri(URI.create(pipelinesUrl(request.workspace(), request.repoSlug())))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body)),
                "trigger pipeline on " + request.repoSlug());
        return toTriggerResult(readTree(response));
    }

    @Override
    public RemoteRunStatus fetchStatus(RemoteRunRef run) {
        String runUrl = pipelinesUrl(run.workspace(), run.repoSlug()) + encode(run.runUuid());
        JsonNode pipeline = readTree(send(HttpRequest.newBuilder().uri(URI.create(runUrl)).GET(),
                "fetch pipeline " + run.runUuid()));
        JsonNode steps = readTree(send(HttpRequest.newBuilder().uri(URI.create(runUrl + "/steps/")).GET(),
                "fetch steps of " + run.runUuid()));

        List<RemoteStepStatus> stepStatuses = new ArrayList<>();
        for (JsonNode step : steps.path("values")) {
            String stepUuid = step.path("uuid").asText(null);
            stepStatuses.add(new RemoteStepStatus(
                    stepUuid,
                    step.path("name").asText("Unnamed step"),
                    flattenState(step.path("state")),
                    longOrNull(step.path("duration_in_seconds")),
                    fetchStepLog(runUrl, stepUuid)));
        }
        return toRunStatus(pipeline, stepStatuses);
    }

    // ------------------------------------------------------------------
    // Response mapping (package-private for tests)
    // ------------------------------------------------------------------

    static TriggerResult toTriggerResult(JsonNode pipeline) {
        String uuid = pipeline.path("uuid").asText(null);
        if (uuid == null) {
            throw new RemoteCiException("Trigger response carries no pipeline uuid");
        }
        return new TriggerResult(
                uuid,
                longOrNull(pipeline.path("build_number")),
                flattenState(pipeline.path("state")),
                pipeline.path("target").path("commit").path("hash").asText(null));
    }

    static RemoteRunStatus toRunStatus(JsonNode pipeline, List<RemoteStepStatus> steps) {
        return new RemoteRunStatus(
                flattenState(pipeline.path("state")),
                steps,
                instantOrNull(pipeline.path("completed_on")),
                longOrNull(pipeline.path("duration_in_seconds")));
    }

    static String flattenState(JsonNode state) {
        String name = state.path("name").asText("UNKNOWN");
        if (!"COMPLETED".equals(name)) {
            return name;
        }
        String result = state.path("result").path("name").asText("SUCCESSFUL");
        return "SUCCESSFUL".equals(result) ? "COMPLETED" : result;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ObjectNode triggerBody(TriggerRequest request) {
        ObjectNode target = json.createObjectNode()
                .put("type", "pipeline_ref_target")
                .put("ref_type", "branch")
                .put("ref_name", request.branch());
        if (request.commitHash() != null) {
            target.putObject("commit")
                    .put("type", "commit")
                    .put("hash", request.commitHash());
        }
        ObjectNode body = json.createObjectNode();
        body.set("target", target);
        return body;
    }

    /** Step logs are optional: a step that has not started has none yet. */
    private String fetchStepLog(String runUrl, String stepUuid) {
        if (stepUuid == null) return null;
        try {
            HttpRequest req = authorized(HttpRequest.newBuilder()
                    .uri(URI.create(runUrl + "/steps/" + encode(stepUuid) + "/log"))
                    .header("Accept", "application/octet-stream")
                    .GET());
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() == 404) return null;
            check(resp, "fetch log of step " + stepUuid);
            return resp.body();
        } catch (IOException e) {
            throw new TransientRemoteException("fetch log of step " + stepUuid + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientRemoteException("fetch log of step " + stepUuid + " interrupted", e);
        }
    }

    private String send(HttpRequest.Builder builder, String opName) {
        try {
            HttpRequest req = authorized(builder.header("Accept", "application/json"));
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            check(resp, opName);
            return resp.body();
        } catch (IOException e) {
            throw new TransientRemoteException(opName + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientRemoteException(opName + " interrupted", e);
        }
    }

    private HttpRequest authorized(HttpRequest.Builder builder) {
        builder.timeout(requestTimeout);
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder.build();
    }

    private static void check(HttpResponse<String> resp, String opName) {
        int status = resp.statusCode();
        if (status >= 200 && status < 300) return;
        String message = opName + " failed, HTTP " + status + ": " + resp.body();
        if (status == 429 || status >= 500) {
            throw new TransientRemoteException(message, status);
        }
        throw new RemoteCiException(message, status, null);
    }

    private String pipelinesUrl(String workspace, String repoSlug) {
        return baseUrl + "/repositories/" + encode(workspace) + "/" + encode(repoSlug) + "/pipelines/";
    }

    // Pipeline and step uuids are wrapped in braces, which must be escaped in a path.
    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private JsonNode readTree(String body) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteCiException("Malformed response from Bitbucket", e);
        }
    }

    private String toJson(Object body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RemoteCiException("JSON serialization failed", e);
        }
    }

    private static Long longOrNull(JsonNode node) {
        return node.isNumber() ? node.asLong() : null;
    }

    private static Instant instantOrNull(JsonNode node) {
        if (!node.isTextual()) return null;
        try {
            return OffsetDateTime.parse(node.asText()).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp '{}'", node.asText());
            return null;
        }
    }
}
