package com.archivum.orchestrator.executor;

import com.archivum.orchestrator.config.ArchivumProperties;
import com.archivum.orchestrator.executor.dto.ExecutionResult;
import com.archivum.orchestrator.executor.dto.RunTaskRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

/**
 * HTTP client for a separate executor service that owns the tools.
 *
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit. Called from the task worker pool, so blocking I/O is fine here.
 *
 * A non-2xx answer or an unreachable service is an infrastructure error
 * ({@link ExecutorException}); a tool the service could not start comes back
 * as a normal 200 with {@code launch_failure=true}.
 */
@Component
@ConditionalOnProperty(prefix = "archivum.executor", name = "mode", havingValue = "remote")
public class RemoteTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(RemoteTaskExecutor.class);

    // Extra wall-clock time on top of the tool deadline for the round trip.
    private static final Duration HTTP_SLACK = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     defaultTimeout;

    public RemoteTaskExecutor(ArchivumProperties properties, ObjectMapper objectMapper) {
        if (properties.executor().baseUrl() == null || properties.executor().baseUrl().isBlank()) {
            throw new IllegalStateException("archivum.executor.base-url is required in remote mode");
        }
        this.baseUrl        = stripTrailingSlash(properties.executor().baseUrl());
        this.defaultTimeout = properties.executor().timeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public TaskResult execute(TaskSpec spec) {
        Duration timeout = spec.timeout() != null ? spec.timeout() : defaultTimeout;
        String body = toJson(new RunTaskRequest(
                spec.transferId().toString(),
                spec.fileId(),
                spec.tool(),
                spec.arguments(),
                spec.workingDirectory().toString(),
                timeout.toSeconds()));

        Instant start = Instant.now();
        String respBody = post("/tasks/run", body, "run " + spec.tool(), timeout.plus(HTTP_SLACK));
        Instant end = Instant.now();

        ExecutionResult result;
        try {
            result = json.readValue(respBody, ExecutionResult.class);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse run response for " + spec.tool(), e);
        }
        if (result.launch_failure()) {
            log.warn("Executor service could not launch '{}': {}", spec.tool(), result.stderr());
            return new TaskResult(TaskResult.LAUNCH_FAILURE_CODE, nullToEmpty(result.stdout()),
                    nullToEmpty(result.stderr()), true, start, end);
        }
        return new TaskResult(result.exit_code(), nullToEmpty(result.stdout()),
                nullToEmpty(result.stderr()), false, start, end);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
