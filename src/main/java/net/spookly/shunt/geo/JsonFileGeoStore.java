package net.spookly.shunt.geo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Geo store kept in memory and mirrored to a JSON object on disk, one entry per IP.
 */
@Slf4j
public final class JsonFileGeoStore implements GeoStore {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<Map<String, GeoRecord>> TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final Map<String, GeoRecord> records = new ConcurrentHashMap<>();

    /**
     * Open the store, loading existing entries. An unreadable file is reported and replaced on the next write.
     */
    public JsonFileGeoStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            Map<String, GeoRecord> loaded = MAPPER.readValue(file.toFile(), TYPE);
            if (loaded != null) {
                loaded.forEach((ip, record) -> {
                    if (ip != null && record != null) {
                        records.put(ip, record);
                    }
                });
            }
            log.debug("Loaded {} geo entries from {}", records.size(), file);
        } catch (IOException e) {
            log.warn("Could not read geo store {}, starting empty: {}", file, e.getMessage());
        }
    }

    @Override
    public GeoRecord get(String ip) {
        return ip == null ? null : records.get(ip);
    }

    @Override
    public void put(String ip, GeoRecord record) {
        Objects.requireNonNull(ip, "ip");
        Objects.requireNonNull(record, "record");
        records.put(ip, record);
        persist();
    }

    private synchronized void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            MAPPER.writeValue(temp.toFile(), new TreeMap<>(records));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new GeoLookupException("Failed to write geo store " + file, e);
        }
    }

    Path file() {
        return file;
    }
}
