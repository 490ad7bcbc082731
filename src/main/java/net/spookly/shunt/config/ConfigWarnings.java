package net.spookly.shunt.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;

/**
 * Collects non-fatal configuration warnings (for example, sections that the active mode ignores).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(ShuntConfig config, Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (config == null || config.mode == null) {
            return warnings;
        }
        String mode = config.mode.trim().toLowerCase(Locale.ROOT);
        if (config.staticMode != null && !"static".equals(mode)) {
            warnings.add("static section is ignored in mode " + mode);
        }
        if (config.geo != null && !"geo".equals(mode)) {
            warnings.add("geo section is ignored in mode " + mode);
        }
        if (config.http != null && !"http".equals(mode)) {
            warnings.add("http section is ignored in mode " + mode);
        }
        if (config.motd == null) {
            warnings.add("motd is not set, using default: " + ConfigDefaults.DEFAULT_MOTD);
        }
        if ("geo".equals(mode)) {
            String rawToken = readRawGeoToken(configPath);
            if (rawToken != null && !rawToken.startsWith("env:") && !rawToken.startsWith("path:")) {
                warnings.add("geo.token is stored inline; prefer an env: or path: reference");
            }
        }
        return warnings;
    }

    private static String readRawGeoToken(Path configPath) {
        if (configPath == null || !Files.isRegularFile(configPath)) {
            return null;
        }
        Object raw;
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            raw = new Yaml().load(reader);
        } catch (IOException | RuntimeException ignored) {
            // The loader already reported unreadable files.
            return null;
        }
        if (!(raw instanceof Map)) {
            return null;
        }
        Object geo = ((Map<?, ?>) raw).get("geo");
        if (!(geo instanceof Map)) {
            return null;
        }
        Object token = ((Map<?, ?>) geo).get("token");
        return token instanceof String ? (String) token : null;
    }
}
