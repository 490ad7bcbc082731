package net.spookly.shunt.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(ShuntConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateListen(config, errors);
        validateMode(config, errors);
        validateTimeouts(config, errors);
        validateLogging(config, errors);

        throwIfErrors(errors);
    }

    private static void validateListen(ShuntConfig config, List<String> errors) {
        ShuntConfig.ListenConfig listen = config.listen;
        if (listen == null) {
            return;
        }
        if (listen.host != null && listen.host.trim().isEmpty()) {
            errors.add("listen.host must not be blank");
        }
        if (listen.port != null) {
            requirePort(errors, listen.port, "listen.port");
        }
    }

    private static void validateMode(ShuntConfig config, List<String> errors) {
        requireNonBlank(errors, config.mode, "mode");
        if (isBlank(config.mode)) {
            return;
        }
        if (!isOneOf(config.mode, "static", "geo", "http")) {
            errors.add("mode must be one of: static, geo, http");
            return;
        }
        if (isOneOf(config.mode, "static")) {
            validateStatic(config.staticMode, errors);
        } else if (isOneOf(config.mode, "geo")) {
            validateGeo(config.geo, errors);
        } else {
            validateHttp(config.http, errors);
        }
    }

    private static void validateStatic(ShuntConfig.StaticConfig staticMode, List<String> errors) {
        if (staticMode == null) {
            errors.add("mode 'static' requires a 'static' section");
            return;
        }
        requireNonBlank(errors, staticMode.algorithm, "static.algorithm");
        if (!isBlank(staticMode.algorithm) && !isOneOf(staticMode.algorithm, "round_robin", "lowest_player_count")) {
            errors.add("static.algorithm must be round_robin or lowest_player_count");
        }
        if (staticMode.servers == null || staticMode.servers.isEmpty()) {
            errors.add("static.servers must contain at least one server");
            return;
        }
        for (ShuntConfig.ServerConfig server : staticMode.servers) {
            validateServer(server, "static.servers", errors);
        }
    }

    private static void validateGeo(ShuntConfig.GeoConfig geo, List<String> errors) {
        if (geo == null) {
            errors.add("mode 'geo' requires a 'geo' section");
            return;
        }
        requireNonBlank(errors, geo.token, "geo.token");
        if (!isBlank(geo.endpoint)) {
            requireHttpUri(errors, geo.endpoint, "geo.endpoint");
        }
        if (geo.regions == null || geo.regions.isEmpty()) {
            errors.add("geo.regions must contain at least one region entry");
        } else {
            for (Map.Entry<String, ShuntConfig.ServerConfig> entry : geo.regions.entrySet()) {
                if (isBlank(entry.getKey())) {
                    errors.add("geo.regions keys must not be blank");
                }
                validateServer(entry.getValue(), "geo.regions." + entry.getKey(), errors);
            }
        }
        if (geo.fallback == null) {
            errors.add("geo.fallback is required");
        } else {
            validateServer(geo.fallback, "geo.fallback", errors);
        }
    }

    private static void validateHttp(ShuntConfig.HttpConfig http, List<String> errors) {
        if (http == null) {
            errors.add("mode 'http' requires an 'http' section");
            return;
        }
        requireNonBlank(errors, http.endpoint, "http.endpoint");
        if (!isBlank(http.endpoint)) {
            requireHttpUri(errors, http.endpoint, "http.endpoint");
        }
        if (!isBlank(http.requestMethod) && !isOneOf(http.requestMethod, "GET", "POST")) {
            errors.add("http.requestMethod must be GET or POST");
        }
        if (http.headers != null) {
            for (Map.Entry<String, String> header : http.headers.entrySet()) {
                if (isBlank(header.getKey()) || header.getValue() == null) {
                    errors.add("http.headers entries must have a name and a value");
                }
            }
        }
        if (http.fallback == null) {
            errors.add("http.fallback is required");
        } else {
            validateServer(http.fallback, "http.fallback", errors);
        }
    }

    private static void validateServer(ShuntConfig.ServerConfig server, String field, List<String> errors) {
        if (server == null) {
            errors.add(field + " entries must not be empty");
            return;
        }
        requireNonBlank(errors, server.address, field + ".address");
        if (server.port != null) {
            requirePort(errors, server.port, field + ".port");
        }
    }

    private static void validateTimeouts(ShuntConfig config, List<String> errors) {
        if (config.timeoutSeconds != null) {
            requirePositive(errors, config.timeoutSeconds, "timeoutSeconds");
        }
        if (config.handshakeTimeoutMs != null) {
            requirePositive(errors, config.handshakeTimeoutMs, "handshakeTimeoutMs");
        }
    }

    private static void validateLogging(ShuntConfig config, List<String> errors) {
        if (config.logging == null || config.logging.level == null) {
            return;
        }
        if (!isOneOf(config.logging.level, "trace", "debug", "info", "warn", "error")) {
            errors.add("logging.level must be one of: trace, debug, info, warn, error");
        }
    }

    private static void requireHttpUri(List<String> errors, String value, String field) {
        try {
            URI uri = new URI(value.trim());
            if (!uri.isAbsolute() || !isOneOf(uri.getScheme(), "http", "https") || isBlank(uri.getHost())) {
                errors.add(field + " must be an absolute http or https URI");
            }
        } catch (URISyntaxException e) {
            errors.add(field + " is not a valid URI: " + e.getMessage());
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer value, String field) {
        if (value == null || value < 1 || value > 65535) {
            errors.add(field + " must be between 1 and 65535");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
