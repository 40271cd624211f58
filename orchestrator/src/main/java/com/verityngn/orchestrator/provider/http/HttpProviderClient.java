package com.verityngn.orchestrator.provider.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verityngn.orchestrator.provider.ProviderAvailability;
import com.verityngn.orchestrator.provider.ProviderException;
import com.verityngn.orchestrator.provider.ProviderException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * JSON-over-HTTP transport shared by the remote provider implementations.
 *
 * Uses java.net.http.HttpClient so every header and status code is visible.
 * HTTP failures are translated into provider error kinds:
 * <pre>
 *   429                         → RATE_LIMITED (Retry-After honoured when numeric)
 *   404, 501, connection refused → UNAVAILABLE
 *   request timeout             → TIMEOUT
 *   anything else non-2xx / I/O → TRANSIENT
 * </pre>
 * Called from worker threads, so blocking I/O here is acceptable.
 */
public class HttpProviderClient {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderClient.class);

    private final String       providerName;
    private final String       baseUrl;
    private final Duration     requestTimeout;
    private final ObjectMapper json;
    private final HttpClient   http;

    public HttpProviderClient(String providerName, String baseUrl, Duration requestTimeout,
                              ObjectMapper objectMapper) {
        this.providerName   = providerName;
        this.baseUrl        = stripTrailingSlash(baseUrl);
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    /**
     * GET the health endpoint; any 2xx counts as available.
     */
    public ProviderAvailability health(String healthPath) {
        if (!isConfigured()) {
            return ProviderAvailability.down("no base-url configured");
        }
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + healthPath))
                    .timeout(Duration.ofSeconds(5))
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
                return ProviderAvailability.up();
            }
            return ProviderAvailability.down("health check returned HTTP " + resp.statusCode());
        } catch (IOException e) {
            return ProviderAvailability.down("health check failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderAvailability.down("health check interrupted");
        }
    }

    /**
     * POST a JSON body and parse the JSON response.
     *
     * @throws ProviderException classified as described on the class
     */
    public JsonNode post(String path, Object body) {
        if (!isConfigured()) {
            throw new ProviderException(Kind.UNAVAILABLE, providerName + ": no base-url configured");
        }
        String op = providerName + " POST " + path;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            int status = resp.statusCode();
            if (status >= 200 && status < 300) {
                return json.readTree(resp.body());
            }
            throw classify(op, status, resp);
        } catch (ProviderException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new ProviderException(Kind.TRANSIENT, op + ": malformed JSON", e);
        } catch (HttpConnectTimeoutException | ConnectException e) {
            throw new ProviderException(Kind.UNAVAILABLE, op + ": cannot connect to " + baseUrl, e);
        } catch (HttpTimeoutException e) {
            throw new ProviderException(Kind.TIMEOUT, op + ": no response within " + requestTimeout, e);
        } catch (IOException e) {
            throw new ProviderException(Kind.TRANSIENT, op + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(Kind.TIMEOUT, op + ": interrupted", e);
        }
    }

    private ProviderException classify(String op, int status, HttpResponse<String> resp) {
        String msg = op + " → HTTP " + status;
        log.debug("{}: {}", msg, resp.body());
        if (status == 429) {
            return ProviderException.rateLimited(msg, retryAfter(resp));
        }
        if (status == 404 || status == 501) {
            return new ProviderException(Kind.UNAVAILABLE, msg);
        }
        if (status == 408 || status == 504) {
            return new ProviderException(Kind.TIMEOUT, msg);
        }
        return new ProviderException(Kind.TRANSIENT, msg);
    }

    private static Duration retryAfter(HttpResponse<String> resp) {
        return resp.headers().firstValue("Retry-After")
                .map(v -> {
                    try {
                        return Duration.ofSeconds(Long.parseLong(v.trim()));
                    } catch (NumberFormatException e) {
                        return null;   // HTTP-date form, fall back to normal backoff
                    }
                })
                .orElse(null);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return null;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
