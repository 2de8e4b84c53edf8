package com.arknoa.orchestrator.worker;

import com.arknoa.orchestrator.stage.BackoffPolicy;
import com.arknoa.orchestrator.stage.StageDescriptor;
import com.arknoa.orchestrator.worker.dto.StageWorkRequest;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises HttpStageWorkerClient against a throwaway JDK HttpServer standing
 * in for a stage worker.
 */
class HttpStageWorkerClientTest {

    HttpServer server;
    ExecutorService serverThreads;
    HttpStageWorkerClient client;

    final AtomicReference<Integer> status      = new AtomicReference<>(200);
    final AtomicReference<String>  responseBody = new AtomicReference<>("{}");
    final AtomicReference<String>  requestBody  = new AtomicReference<>();
    final AtomicReference<Long>    delayMs      = new AtomicReference<>(0L);

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverThreads = Executors.newCachedThreadPool();
        server.setExecutor(serverThreads);
        server.createContext("/process", this::process);
        server.createContext("/health", ex -> respond(ex, 200, "{\"status\":\"healthy\"}"));
        server.start();

        ObjectMapper json = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        client = new HttpStageWorkerClient(json, Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverThreads.shutdownNow();
    }

    // ------------------------------------------------------------------
    // invoke()
    // ------------------------------------------------------------------

    @Test
    void success_returnsOutputRef_andSendsSnakeCaseBody() {
        responseBody.set("{\"status\":\"success\",\"output_ref\":\"blob://classifier/out-1\"}");

        String ref = client.invoke(stage(Duration.ofSeconds(5)), request());

        assertThat(ref).isEqualTo("blob://classifier/out-1");
        assertThat(requestBody.get())
                .contains("\"request_id\":\"req-1\"")
                .contains("\"payload_ref\":\"blob://in\"")
                .contains("\"stage_config\"");
    }

    @Test
    void http4xx_isPermanent() {
        status.set(422);
        responseBody.set("{\"detail\":\"unsupported archive\"}");

        assertThatThrownBy(() -> client.invoke(stage(Duration.ofSeconds(5)), request()))
                .isInstanceOf(PermanentStageException.class)
                .hasMessageContaining("422");
    }

    @Test
    void http5xx_isTransient() {
        status.set(503);

        assertThatThrownBy(() -> client.invoke(stage(Duration.ofSeconds(5)), request()))
                .isInstanceOf(TransientStageException.class)
                .hasMessageContaining("503");
    }

    @Test
    void reportedFailure_usesRetryableFlag() {
        responseBody.set("{\"status\":\"failure\",\"error\":\"bad input\",\"retryable\":false}");
        assertThatThrownBy(() -> client.invoke(stage(Duration.ofSeconds(5)), request()))
                .isInstanceOf(PermanentStageException.class)
                .hasMessageContaining("bad input");

        responseBody.set("{\"status\":\"failure\",\"error\":\"model busy\",\"retryable\":true}");
        assertThatThrownBy(() -> client.invoke(stage(Duration.ofSeconds(5)), request()))
                .isInstanceOf(TransientStageException.class);
    }

    @Test
    void slowWorker_isATimeout() {
        delayMs.set(2_000L);

        assertThatThrownBy(() -> client.invoke(stage(Duration.ofMillis(200)), request()))
                .isInstanceOf(StageTimeoutException.class)
                .satisfies(e -> assertThat(((StageException) e).getKind()).isEqualTo(StageException.Kind.TIMEOUT));
    }

    // ------------------------------------------------------------------
    // ping()
    // ------------------------------------------------------------------

    @Test
    void ping_healthyWorker_isUp_unreachableWorker_isDown() {
        assertThat(client.ping(stage(Duration.ofSeconds(5)))).isTrue();

        StageDescriptor gone = new StageDescriptor("classifier", 20, "http://127.0.0.1:1",
                Duration.ofSeconds(5), 2, BackoffPolicy.fixed(Duration.ZERO), true);
        assertThat(client.ping(gone)).isFalse();
    }

    @Test
    void ping_malformedEndpoint_isDown() {
        StageDescriptor malformed = new StageDescriptor("classifier", 20, "http://bad host:8000",
                Duration.ofSeconds(5), 2, BackoffPolicy.fixed(Duration.ZERO), true);

        assertThat(client.ping(malformed)).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void process(HttpExchange ex) throws IOException {
        requestBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        if (delayMs.get() > 0) {
            try {
                Thread.sleep(delayMs.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        respond(ex, status.get(), responseBody.get());
    }

    private static void respond(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream out = ex.getResponseBody()) {
            out.write(bytes);
        }
    }

    private StageDescriptor stage(Duration timeout) {
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort();
        return new StageDescriptor("classifier", 20, endpoint, timeout, 2,
                BackoffPolicy.fixed(Duration.ZERO), true);
    }

    private static StageWorkRequest request() {
        return new StageWorkRequest("req-1", "blob://in", "classifier", 1,
                Map.of("timeout_ms", 5000, "inputs", Map.of()));
    }
}
