package net.spookly.shunt.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import net.spookly.shunt.config.ConfigDefaults;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Asks a remote HTTP endpoint where each client should go. The endpoint answers with
 * {@code {"address": "...", "port": 25565}}; the port is optional. Any failure routes to the fallback.
 */
@Slf4j
public final class HttpServerSelector implements ServerSelector {
    static final int PROBE_WINDOW = 8;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI endpoint;
    private final String method;
    private final Map<String, String> headers;
    private final BackendServer fallback;
    private final HttpClient httpClient;
    private final Duration timeout;
    private final ProbeFanOut fanOut;

    public HttpServerSelector(URI endpoint,
                              String method,
                              Map<String, String> headers,
                              BackendServer fallback,
                              BackendProbe probe,
                              int timeoutMs) {
        this(endpoint, method, headers, fallback, probe, timeoutMs, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build());
    }

    HttpServerSelector(URI endpoint,
                       String method,
                       Map<String, String> headers,
                       BackendServer fallback,
                       BackendProbe probe,
                       int timeoutMs,
                       HttpClient httpClient) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.method = method == null ? "GET" : method.trim().toUpperCase();
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.timeout = Duration.ofMillis(timeoutMs);
        this.fanOut = new ProbeFanOut(probe, PROBE_WINDOW, timeoutMs);
    }

    @Override
    public CompletableFuture<BackendServer> findServer(SelectionRequest request) {
        InetAddress client = request == null ? null : request.clientAddress();
        if (client == null) {
            return CompletableFuture.completedFuture(fallback);
        }
        String ip = client.getHostAddress();
        HttpRequest httpRequest;
        try {
            httpRequest = buildRequest(ip);
        } catch (RuntimeException e) {
            log.warn("Could not build selection request for {}: {}", ip, e.getMessage());
            return CompletableFuture.completedFuture(fallback);
        }
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(this::parse)
                .exceptionally(error -> {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    log.warn("HTTP selection for {} failed, using fallback {}: {}", ip, fallback, cause.getMessage());
                    return fallback;
                });
    }

    HttpRequest buildRequest(String ip) {
        HttpRequest.Builder builder;
        if ("POST".equals(method)) {
            ObjectNode body = MAPPER.createObjectNode();
            body.put("ip", ip);
            builder = HttpRequest.newBuilder(endpoint)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        } else {
            builder = HttpRequest.newBuilder(withIpQuery(endpoint, ip)).GET();
        }
        builder.header("Accept", "application/json").timeout(timeout);
        for (Map.Entry<String, String> header : headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    static URI withIpQuery(URI endpoint, String ip) {
        String raw = endpoint.toString();
        String separator = endpoint.getRawQuery() == null ? "?" : "&";
        return URI.create(raw + separator + "ip=" + URLEncoder.encode(ip, StandardCharsets.UTF_8));
    }

    private BackendServer parse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new SelectionException("selection endpoint answered with status " + status);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(response.body());
        } catch (IOException e) {
            throw new SelectionException("selection endpoint returned malformed JSON", e);
        }
        JsonNode address = root == null ? null : root.get("address");
        if (address == null || !address.isTextual() || address.asText().trim().isEmpty()) {
            throw new SelectionException("selection endpoint response has no address");
        }
        int port = ConfigDefaults.DEFAULT_BACKEND_PORT;
        JsonNode portNode = root.get("port");
        if (portNode != null && !portNode.isNull()) {
            if (!portNode.canConvertToInt() || !portNode.isIntegralNumber()
                    || portNode.intValue() < 1 || portNode.intValue() > 65535) {
                throw new SelectionException("selection endpoint response has an invalid port: " + portNode);
            }
            port = portNode.intValue();
        }
        BackendServer chosen = new BackendServer(null, address.asText().trim(), port);
        log.debug("HTTP selection chose {}", chosen);
        return chosen;
    }

    @Override
    public CompletableFuture<Long> playerCount() {
        return fanOut.sumPlayers(List.of(fallback));
    }
}
