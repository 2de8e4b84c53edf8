package com.arknoa.orchestrator.worker;

import com.arknoa.orchestrator.stage.StageDescriptor;
import com.arknoa.orchestrator.worker.dto.StageWorkRequest;
import com.arknoa.orchestrator.worker.dto.StageWorkResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * HTTP client for the stage workers.
 *
 * Every worker exposes the same two endpoints:
 *   POST {endpoint}/process   run one attempt
 *   GET  {endpoint}/health    liveness
 *
 * Uses java.net.http.HttpClient so the request timeout is exactly the stage
 * timeout. Called from the invoker pool, so blocking here is fine.
 *
 * Failure mapping: HTTP 4xx or retryable=false → permanent; 5xx, I/O errors
 * and unreadable bodies → transient; request timeout → timeout.
 */
@Component
public class HttpStageWorkerClient implements StageWorkerClient {

    private static final Logger log = LoggerFactory.getLogger(HttpStageWorkerClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final Duration     healthTimeout;

    public HttpStageWorkerClient(
            ObjectMapper objectMapper,
            @Value("${pipeline.worker.connect-timeout:10s}") Duration connectTimeout,
            @Value("${pipeline.worker.health-timeout:5s}") Duration healthTimeout) {
        this.json          = objectMapper;
        this.healthTimeout = healthTimeout;
        this.http          = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // uvicorn doesn't support h2c upgrade
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public String invoke(StageDescriptor stage, StageWorkRequest request) {
        String op = stage.name() + " attempt " + request.attempt() + " for " + request.request_id();
        String body = toJson(request);

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(stage.endpoint() + "/process"))
                    .timeout(stage.timeout())
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new StageTimeoutException(stage.name(), stage.timeout(), e);
        } catch (IOException e) {
            throw new TransientStageException(op + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStageException(op + " interrupted", e);
        }

        int code = resp.statusCode();
        if (code >= 400 && code < 500) {
            throw new PermanentStageException(op + " rejected, HTTP " + code + ": " + resp.body());
        }
        if (code < 200 || code >= 300) {
            throw new TransientStageException(op + " failed, HTTP " + code + ": " + resp.body());
        }

        StageWorkResponse result;
        try {
            result = json.readValue(resp.body(), StageWorkResponse.class);
        } catch (JsonProcessingException e) {
            throw new TransientStageException("Failed to parse response of " + op, e);
        }

        if (!result.succeeded()) {
            String error = result.error() != null ? result.error() : "worker reported failure";
            if (Boolean.FALSE.equals(result.retryable())) {
                throw new PermanentStageException(op + ": " + error);
            }
            throw new TransientStageException(op + ": " + error);
        }
        if (result.output_ref() == null || result.output_ref().isBlank()) {
            throw new PermanentStageException(op + " succeeded without an output_ref");
        }
        log.debug("{} produced {}", op, result.output_ref());
        return result.output_ref();
    }

    @Override
    public boolean ping(StageDescriptor stage) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(stage.endpoint() + "/health"))
                    .timeout(healthTimeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            int code = http.send(req, HttpResponse.BodyHandlers.discarding()).statusCode();
            return code >= 200 && code < 300;
        } catch (IOException e) {
            log.debug("Health check of '{}' failed: {}", stage.name(), e.getMessage());
            return false;
        } catch (IllegalArgumentException e) {
            log.warn("Stage '{}' has an unusable endpoint '{}': {}", stage.name(), stage.endpoint(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new PermanentStageException("JSON serialization failed", e);
        }
    }
}
