package net.spookly.shunt.geo;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryGeoStore implements GeoStore {
    private final Map<String, GeoRecord> records = new ConcurrentHashMap<>();

    @Override
    public GeoRecord get(String ip) {
        return ip == null ? null : records.get(ip);
    }

    @Override
    public void put(String ip, GeoRecord record) {
        records.put(ip, record);
    }

    public int size() {
        return records.size();
    }
}
