package com.verityngn.orchestrator.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.verityngn.orchestrator.provider.EvidenceQuery;
import com.verityngn.orchestrator.provider.EvidenceResult;
import com.verityngn.orchestrator.provider.ProviderException;
import com.verityngn.orchestrator.provider.ProviderException.Kind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Status and error classification against a throwaway local HTTP server.
 */
class HttpProviderClientTest {

    final ObjectMapper json = new ObjectMapper();
    final AtomicReference<String> lastBody = new AtomicReference<>();

    HttpServer server;
    String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    void respond(String path, int status, String body, Map<String, String> headers) {
        server.createContext(path, exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            headers.forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            if (bytes.length > 0) {
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(bytes);
                }
            }
            exchange.close();
        });
    }

    HttpProviderClient client(Duration timeout) {
        return new HttpProviderClient("remote", baseUrl + "/", timeout, json);
    }

    Kind kindOf(Runnable call) {
        try {
            call.run();
        } catch (ProviderException e) {
            return e.getKind();
        }
        throw new AssertionError("expected a ProviderException");
    }

    // ------------------------------------------------------------------
    // post
    // ------------------------------------------------------------------

    @Test
    void post_2xx_returnsParsedJson() {
        respond("/execute", 200, "{\"claims\":[\"a\"]}", Map.of());

        JsonNode out = client(Duration.ofSeconds(5)).post("/execute", Map.of("job_id", "1"));

        assertThat(out.path("claims").get(0).asText()).isEqualTo("a");
        assertThat(lastBody.get()).contains("\"job_id\":\"1\"");
    }

    @Test
    void post_429_isRateLimitedWithRetryAfter() {
        respond("/execute", 429, "", Map.of("Retry-After", "7"));

        assertThatThrownBy(() -> client(Duration.ofSeconds(5)).post("/execute", Map.of()))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> {
                    ProviderException pe = (ProviderException) e;
                    assertThat(pe.getKind()).isEqualTo(Kind.RATE_LIMITED);
                    assertThat(pe.getRetryAfter()).isEqualTo(Duration.ofSeconds(7));
                });
    }

    @Test
    void post_statusCodes_areClassified() {
        respond("/missing", 404, "", Map.of());
        respond("/gateway", 504, "", Map.of());
        respond("/broken", 500, "oops", Map.of());
        HttpProviderClient c = client(Duration.ofSeconds(5));

        assertThat(kindOf(() -> c.post("/missing", Map.of()))).isEqualTo(Kind.UNAVAILABLE);
        assertThat(kindOf(() -> c.post("/gateway", Map.of()))).isEqualTo(Kind.TIMEOUT);
        assertThat(kindOf(() -> c.post("/broken", Map.of()))).isEqualTo(Kind.TRANSIENT);
    }

    @Test
    void post_malformedJson_isTransient() {
        respond("/execute", 200, "not json{", Map.of());

        assertThat(kindOf(() -> client(Duration.ofSeconds(5)).post("/execute", Map.of())))
                .isEqualTo(Kind.TRANSIENT);
    }

    @Test
    void post_slowServer_isTimeout() {
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });

        assertThat(kindOf(() -> client(Duration.ofMillis(200)).post("/slow", Map.of())))
                .isEqualTo(Kind.TIMEOUT);
    }

    @Test
    void post_connectionRefused_isUnavailable() {
        server.stop(0);

        assertThat(kindOf(() -> client(Duration.ofSeconds(2)).post("/execute", Map.of())))
                .isEqualTo(Kind.UNAVAILABLE);
    }

    @Test
    void post_withoutBaseUrl_isUnavailable() {
        HttpProviderClient c = new HttpProviderClient("remote", "", Duration.ofSeconds(1), json);

        assertThat(c.isConfigured()).isFalse();
        assertThat(kindOf(() -> c.post("/execute", Map.of()))).isEqualTo(Kind.UNAVAILABLE);
    }

    // ------------------------------------------------------------------
    // health / providers
    // ------------------------------------------------------------------

    @Test
    void health_2xxIsUp_otherwiseDown() {
        respond("/health", 200, "{}", Map.of());
        respond("/sick", 503, "", Map.of());
        HttpProviderClient c = client(Duration.ofSeconds(5));

        assertThat(c.health("/health").available()).isTrue();
        assertThat(c.health("/sick").available()).isFalse();
        assertThat(c.health("/sick").reason()).contains("503");
    }

    @Test
    void disabledProvider_probesDownWithoutCallingServer() {
        HttpStageProvider p = new HttpStageProvider("remote", false, "/health", client(Duration.ofSeconds(1)));

        assertThat(p.probe().available()).isFalse();
        assertThat(p.probe().reason()).isEqualTo("disabled");
    }

    @Test
    void evidenceProvider_mapsResponseItems() {
        respond("/query", 200, """
                {"results":[{"source":"https://a.example","content":"text","relevance":0.9}]}
                """, Map.of());
        HttpEvidenceProvider p = new HttpEvidenceProvider("search", true, "/health", client(Duration.ofSeconds(5)));

        EvidenceResult result = p.query(new EvidenceQuery("the sky is green", "https://video.example/v"));

        assertThat(result.items()).hasSize(1);
        assertThat(result.items().get(0).relevance()).isEqualTo(0.9);
        assertThat(lastBody.get()).contains("the sky is green");
    }
}
