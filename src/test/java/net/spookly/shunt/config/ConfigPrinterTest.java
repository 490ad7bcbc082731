package net.spookly.shunt.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigPrinterTest {
    @Test
    void redactsSensitiveValues() {
        ShuntConfig config = new ShuntConfig();
        config.mode = "geo";
        config.geo = new ShuntConfig.GeoConfig();
        config.geo.token = "ipinfo-secret";
        config.http = new ShuntConfig.HttpConfig();
        config.http.endpoint = "https://selector.example.com/server";
        config.http.headers = Map.of("Authorization", "Bearer selector-secret");

        String yaml = ConfigPrinter.toYaml(config);
        assertFalse(yaml.contains("ipinfo-secret"));
        assertFalse(yaml.contains("selector-secret"));
        assertTrue(yaml.contains("<redacted>"));
        assertTrue(yaml.contains("Authorization"));
        assertTrue(yaml.contains("https://selector.example.com/server"));
    }

    @Test
    void writesStaticSectionUnderItsYamlName() {
        ShuntConfig config = new ShuntConfig();
        config.mode = "static";
        config.staticMode = new ShuntConfig.StaticConfig();
        config.staticMode.algorithm = "round_robin";

        String yaml = ConfigPrinter.toYaml(config);
        assertTrue(yaml.contains("static:"));
        assertFalse(yaml.contains("staticMode"));
    }
}
