package net.spookly.shunt.routing;

import net.spookly.shunt.config.ConfigDefaults;
import net.spookly.shunt.config.ShuntConfig;
import net.spookly.shunt.geo.GeoLocator;
import net.spookly.shunt.geo.IpInfoGeoLocator;
import net.spookly.shunt.geo.JsonFileGeoStore;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the process-wide selector from validated configuration.
 */
public final class ServerSelectors {
    private ServerSelectors() {
    }

    public static ServerSelector fromConfig(ShuntConfig config, BackendProbe probe) {
        return fromConfig(config, probe, null);
    }

    /**
     * Build the selector for the configured mode. A null geo locator is replaced by the ipinfo locator backed by
     * the configured JSON store.
     */
    static ServerSelector fromConfig(ShuntConfig config, BackendProbe probe, GeoLocator geoLocator) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(probe, "probe");
        int timeoutMs = timeoutMs(config);
        SelectionMode mode = SelectionMode.fromConfig(config.mode);
        switch (mode) {
            case GEO:
                return geo(config.geo, probe, geoLocator, timeoutMs);
            case HTTP:
                return http(config.http, probe, timeoutMs);
            case STATIC:
            default:
                return fromStatic(config.staticMode, probe, timeoutMs);
        }
    }

    public static int timeoutMs(ShuntConfig config) {
        int seconds = config.timeoutSeconds == null ? ConfigDefaults.DEFAULT_TIMEOUT_SECONDS : config.timeoutSeconds;
        return seconds * 1000;
    }

    private static ServerSelector fromStatic(ShuntConfig.StaticConfig staticMode, BackendProbe probe, int timeoutMs) {
        List<BackendServer> servers = new ArrayList<>();
        if (staticMode != null && staticMode.servers != null) {
            for (ShuntConfig.ServerConfig server : staticMode.servers) {
                servers.add(BackendServer.fromConfig(server));
            }
        }
        SelectionAlgorithm algorithm = SelectionAlgorithm.fromConfig(staticMode == null ? null : staticMode.algorithm);
        if (algorithm == SelectionAlgorithm.LOWEST_PLAYER_COUNT) {
            return new LowestLoadServerSelector(servers, probe, timeoutMs);
        }
        return new RoundRobinServerSelector(servers, probe, timeoutMs);
    }

    private static ServerSelector geo(ShuntConfig.GeoConfig geo,
                                      BackendProbe probe,
                                      GeoLocator geoLocator,
                                      int timeoutMs) {
        Map<String, BackendServer> regions = new LinkedHashMap<>();
        for (Map.Entry<String, ShuntConfig.ServerConfig> entry : geo.regions.entrySet()) {
            regions.put(entry.getKey().trim(), BackendServer.fromConfig(entry.getValue()));
        }
        GeoLocator locator = geoLocator;
        if (locator == null) {
            String endpoint = isBlank(geo.endpoint) ? ConfigDefaults.DEFAULT_GEO_ENDPOINT : geo.endpoint.trim();
            String cachePath = isBlank(geo.cachePath) ? ConfigDefaults.DEFAULT_GEO_CACHE_PATH : geo.cachePath;
            locator = new IpInfoGeoLocator(endpoint, geo.token, new JsonFileGeoStore(Path.of(cachePath)), timeoutMs);
        }
        return new GeoServerSelector(regions, BackendServer.fromConfig(geo.fallback), locator, probe, timeoutMs);
    }

    private static ServerSelector http(ShuntConfig.HttpConfig http, BackendProbe probe, int timeoutMs) {
        return new HttpServerSelector(
                URI.create(http.endpoint.trim()),
                http.requestMethod,
                http.headers,
                BackendServer.fromConfig(http.fallback),
                probe,
                timeoutMs
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
