package net.spookly.shunt.routing;

import lombok.extern.slf4j.Slf4j;
import net.spookly.shunt.geo.GeoLocator;
import net.spookly.shunt.geo.GeoRecord;

import java.net.InetAddress;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Routes by client location: a continent code match wins over a country code match, anything else goes to the
 * fallback. Region keys are matched case-insensitively.
 */
@Slf4j
public final class GeoServerSelector implements ServerSelector {
    static final int PROBE_WINDOW = 8;

    private final Map<String, BackendServer> regions;
    private final BackendServer fallback;
    private final GeoLocator locator;
    private final ProbeFanOut fanOut;

    public GeoServerSelector(Map<String, BackendServer> regions,
                             BackendServer fallback,
                             GeoLocator locator,
                             BackendProbe probe,
                             int timeoutMs) {
        this.regions = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        this.regions.putAll(Objects.requireNonNull(regions, "regions"));
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.fanOut = new ProbeFanOut(probe, PROBE_WINDOW, timeoutMs);
    }

    @Override
    public CompletableFuture<BackendServer> findServer(SelectionRequest request) {
        InetAddress client = request == null ? null : request.clientAddress();
        if (client == null) {
            return CompletableFuture.completedFuture(fallback);
        }
        CompletableFuture<GeoRecord> lookup;
        try {
            lookup = locator.locate(client);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        return lookup.handle((record, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                log.warn("Geo lookup for {} failed, using fallback {}: {}",
                        client.getHostAddress(), fallback, cause.getMessage());
                return fallback;
            }
            return match(record);
        });
    }

    BackendServer match(GeoRecord record) {
        if (record == null) {
            return fallback;
        }
        BackendServer byContinent = lookup(record.continentCode());
        if (byContinent != null) {
            return byContinent;
        }
        BackendServer byCountry = lookup(record.countryCode());
        if (byCountry != null) {
            return byCountry;
        }
        return fallback;
    }

    private BackendServer lookup(String code) {
        if (code == null || code.trim().isEmpty()) {
            return null;
        }
        return regions.get(code.trim());
    }

    @Override
    public CompletableFuture<Long> playerCount() {
        LinkedHashSet<BackendServer> all = new LinkedHashSet<>(regions.values());
        all.add(fallback);
        return fanOut.sumPlayers(List.copyOf(all));
    }

    @Override
    public void close() {
        locator.close();
    }
}
