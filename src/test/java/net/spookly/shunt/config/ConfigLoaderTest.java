package net.spookly.shunt.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigWhenMissing(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("config").resolve("shunt.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(Files.exists(configPath));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("mode: static"));
        assertTrue(exception.getMessage().contains("generated default"));
    }

    @Test
    void generatedDefaultLoads(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("shunt.yaml");
        Files.writeString(configPath, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8);

        ShuntConfig config = ConfigLoader.load(configPath);

        assertEquals("static", config.mode);
        assertEquals("round_robin", config.staticMode.algorithm);
        assertEquals(1, config.staticMode.servers.size());
        assertEquals("127.0.0.1", config.staticMode.servers.get(0).address);
        assertEquals(25566, config.staticMode.servers.get(0).port);
        assertEquals(5, config.timeoutSeconds);
    }

    @Test
    void expandsPathTokenAndResolvesCachePathRelativeToConfig(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("shunt.yaml");
        Path tokenPath = tempDir.resolve("secret").resolve("ipinfo");
        Files.createDirectories(tokenPath.getParent());
        Files.writeString(tokenPath, "token-from-file\n", StandardCharsets.UTF_8);
        Files.writeString(configPath, String.join("\n",
                "mode: geo",
                "geo:",
                "  token: path:secret/ipinfo",
                "  cachePath: cache/geo.json",
                "  regions:",
                "    EU:",
                "      address: eu.example.com",
                "  fallback:",
                "    address: fallback.example.com",
                ""), StandardCharsets.UTF_8);

        ShuntConfig config = ConfigLoader.load(configPath);

        assertEquals("token-from-file", config.geo.token);
        assertEquals(tempDir.resolve("cache").resolve("geo.json").toString(), config.geo.cachePath);
        assertEquals("eu.example.com", config.geo.regions.get("EU").address);
    }

    @Test
    void rejectsUnknownProperties(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("shunt.yaml");
        Files.writeString(configPath, String.join("\n",
                "mode: static",
                "relay: true",
                "static:",
                "  algorithm: round_robin",
                "  servers:",
                "    - address: 127.0.0.1",
                ""), StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));
        assertTrue(exception.getMessage().contains("Failed to parse config"));
    }

    @Test
    void reportsValidationErrors(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("shunt.yaml");
        Files.writeString(configPath, String.join("\n",
                "mode: static",
                "static:",
                "  algorithm: fastest",
                "  servers: []",
                ""), StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));
        assertTrue(exception.getMessage().startsWith("Invalid config:"));
        assertTrue(exception.getMessage().contains("static.algorithm"));
        assertTrue(exception.getMessage().contains("static.servers"));
    }
}
