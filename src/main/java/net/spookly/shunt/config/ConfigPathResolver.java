package net.spookly.shunt.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves relative file path settings against the config directory.
 */
final class ConfigPathResolver {
    private ConfigPathResolver() {
    }

    static void resolve(ShuntConfig config, Path baseDir) {
        if (config == null || baseDir == null) {
            return;
        }
        if (config.geo != null) {
            config.geo.cachePath = resolvePath(baseDir, config.geo.cachePath);
        }
    }

    static Path resolvePath(Path baseDir, Path path) {
        if (baseDir != null && !path.isAbsolute()) {
            return baseDir.resolve(path).normalize();
        }
        return path;
    }

    private static String resolvePath(Path baseDir, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return rawValue;
        }
        try {
            return resolvePath(baseDir, Paths.get(rawValue)).toString();
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }
}
