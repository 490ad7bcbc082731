package net.spookly.shunt.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigValidatorTest {
    @Test
    void acceptsStaticConfig() {
        assertDoesNotThrow(() -> ConfigValidator.validate(staticConfig()));
    }

    @Test
    void requiresMode() {
        ShuntConfig config = staticConfig();
        config.mode = null;

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));
        assertTrue(exception.getMessage().contains("mode is required"));
    }

    @Test
    void requiresSectionForMode() {
        ShuntConfig config = staticConfig();
        config.mode = "geo";

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));
        assertTrue(exception.getMessage().contains("requires a 'geo' section"));
    }

    @Test
    void collectsEveryViolation() {
        ShuntConfig config = staticConfig();
        config.listen = new ShuntConfig.ListenConfig();
        config.listen.port = 70000;
        config.staticMode.servers.get(0).port = 0;
        config.timeoutSeconds = 0;
        config.logging = new ShuntConfig.LoggingConfig();
        config.logging.level = "verbose";

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));
        String message = exception.getMessage();
        assertTrue(message.contains("listen.port"));
        assertTrue(message.contains("static.servers.port"));
        assertTrue(message.contains("timeoutSeconds"));
        assertTrue(message.contains("logging.level"));
    }

    @Test
    void validatesGeoSection() {
        ShuntConfig config = new ShuntConfig();
        config.mode = "geo";
        config.geo = new ShuntConfig.GeoConfig();
        config.geo.endpoint = "ftp://example.com";
        config.geo.regions = new LinkedHashMap<>();

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));
        String message = exception.getMessage();
        assertTrue(message.contains("geo.token is required"));
        assertTrue(message.contains("geo.endpoint"));
        assertTrue(message.contains("geo.regions"));
        assertTrue(message.contains("geo.fallback is required"));
    }

    @Test
    void validatesHttpSection() {
        ShuntConfig config = new ShuntConfig();
        config.mode = "http";
        config.http = new ShuntConfig.HttpConfig();
        config.http.endpoint = "/relative";
        config.http.requestMethod = "PUT";
        config.http.fallback = server("fallback.example.com", null);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));
        String message = exception.getMessage();
        assertTrue(message.contains("http.endpoint"));
        assertTrue(message.contains("http.requestMethod"));
    }

    @Test
    void acceptsHttpConfig() {
        ShuntConfig config = new ShuntConfig();
        config.mode = "http";
        config.http = new ShuntConfig.HttpConfig();
        config.http.endpoint = "https://selector.example.com/server";
        config.http.requestMethod = "post";
        config.http.headers = Map.of("Authorization", "Bearer abc");
        config.http.fallback = server("fallback.example.com", 25570);

        assertDoesNotThrow(() -> ConfigValidator.validate(config));
    }

    private static ShuntConfig staticConfig() {
        ShuntConfig config = new ShuntConfig();
        config.mode = "static";
        config.staticMode = new ShuntConfig.StaticConfig();
        config.staticMode.algorithm = "round_robin";
        config.staticMode.servers = List.of(server("lobby1.example.com", 25565));
        return config;
    }

    private static ShuntConfig.ServerConfig server(String address, Integer port) {
        ShuntConfig.ServerConfig server = new ShuntConfig.ServerConfig();
        server.address = address;
        server.port = port;
        return server;
    }
}
