package net.spookly.shunt.routing;

import static net.spookly.shunt.routing.StubProbe.server;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpServerSelectorTest {
    private HttpServer server;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String body = "{\"address\":\"eu.example.com\",\"port\":25570}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/select", exchange -> {
            String requestBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getRawQuery() + " "
                    + exchange.getRequestHeaders().getFirst("X-Api-Key") + " " + requestBody);
            byte[] response = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, response.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void getRequestRoutesToAnsweredBackend() throws Exception {
        HttpServerSelector selector = selector("GET");

        BackendServer chosen = selector.findServer(request()).get(5, TimeUnit.SECONDS);

        assertEquals("eu.example.com", chosen.address());
        assertEquals(25570, chosen.port());
        assertEquals(1, requests.size());
        assertTrue(requests.get(0).startsWith("GET ip=81.2.69.160 key-1"));
    }

    @Test
    void postRequestSendsJsonBody() throws Exception {
        body = "{\"address\":\"na.example.com\"}";
        HttpServerSelector selector = selector("POST");

        BackendServer chosen = selector.findServer(request()).get(5, TimeUnit.SECONDS);

        assertEquals("na.example.com", chosen.address());
        assertEquals(25565, chosen.port());
        assertEquals("POST null key-1 {\"ip\":\"81.2.69.160\"}", requests.get(0));
    }

    @Test
    void errorStatusUsesFallback() throws Exception {
        status = 503;
        HttpServerSelector selector = selector("GET");

        assertEquals("fallback", selector.findServer(request()).get(5, TimeUnit.SECONDS).address());
    }

    @Test
    void malformedBodyUsesFallback() throws Exception {
        body = "{\"port\": 25565}";
        HttpServerSelector selector = selector("GET");

        assertEquals("fallback", selector.findServer(request()).get(5, TimeUnit.SECONDS).address());
    }

    @Test
    void invalidPortUsesFallback() throws Exception {
        body = "{\"address\":\"eu.example.com\",\"port\":70000}";
        HttpServerSelector selector = selector("GET");

        assertEquals("fallback", selector.findServer(request()).get(5, TimeUnit.SECONDS).address());
    }

    @Test
    void unreachableEndpointUsesFallback() throws Exception {
        HttpServerSelector selector = selector("GET");
        server.stop(0);

        assertEquals("fallback", selector.findServer(request()).get(10, TimeUnit.SECONDS).address());
    }

    @Test
    void playerCountProbesFallbackOnly() throws Exception {
        StubProbe probe = new StubProbe().count("fallback", 12);
        HttpServerSelector selector = new HttpServerSelector(endpoint(), "GET", Map.of(), server("fallback"), probe, 1000);

        assertEquals(12L, selector.playerCount().get());
        assertEquals(List.of("fallback"), probe.probed);
    }

    @Test
    void appendsIpToExistingQuery() {
        URI uri = HttpServerSelector.withIpQuery(URI.create("https://example.com/select?region=eu"), "::1");

        assertEquals("https://example.com/select?region=eu&ip=%3A%3A1", uri.toString());
    }

    private HttpServerSelector selector(String method) {
        return new HttpServerSelector(endpoint(), method, Map.of("X-Api-Key", "key-1"), server("fallback"),
                new StubProbe(), 2000);
    }

    private URI endpoint() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/select");
    }

    private static SelectionRequest request() throws Exception {
        return new SelectionRequest(InetAddress.getByName("81.2.69.160"));
    }
}
