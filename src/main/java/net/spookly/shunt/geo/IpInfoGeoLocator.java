package net.spookly.shunt.geo;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Looks addresses up in the geo store first and asks {@code GET {endpoint}/{ip}?token=} on a miss, persisting
 * the answer.
 */
@Slf4j
public final class IpInfoGeoLocator implements GeoLocator {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String endpoint;
    private final String token;
    private final GeoStore store;
    private final HttpClient httpClient;
    private final Duration timeout;

    public IpInfoGeoLocator(String endpoint, String token, GeoStore store, int timeoutMs) {
        this(endpoint, token, store, timeoutMs, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build());
    }

    IpInfoGeoLocator(String endpoint, String token, GeoStore store, int timeoutMs, HttpClient httpClient) {
        Objects.requireNonNull(endpoint, "endpoint");
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.token = Objects.requireNonNull(token, "token");
        this.store = Objects.requireNonNull(store, "store");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public CompletableFuture<GeoRecord> locate(InetAddress address) {
        Objects.requireNonNull(address, "address");
        String ip = address.getHostAddress();
        GeoRecord cached = store.get(ip);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        HttpRequest request = HttpRequest.newBuilder(requestUri(ip))
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        throw new GeoLookupException("Geo lookup for " + ip + " failed with status "
                                + response.statusCode());
                    }
                    GeoRecord record;
                    try {
                        record = MAPPER.readValue(response.body(), GeoRecord.class);
                    } catch (IOException e) {
                        throw new GeoLookupException("Geo lookup for " + ip + " returned malformed JSON", e);
                    }
                    if (record == null) {
                        throw new GeoLookupException("Geo lookup for " + ip + " returned an empty body");
                    }
                    try {
                        store.put(ip, record);
                    } catch (GeoLookupException e) {
                        log.warn("Could not persist geo record for {}: {}", ip, e.getMessage());
                    }
                    log.debug("Located {} in {}/{}", ip, record.continentCode(), record.countryCode());
                    return record;
                });
    }

    URI requestUri(String ip) {
        return URI.create(endpoint + "/" + URLEncoder.encode(ip, StandardCharsets.UTF_8)
                + "?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8));
    }
}
