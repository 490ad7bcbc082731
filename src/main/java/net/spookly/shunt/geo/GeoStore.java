package net.spookly.shunt.geo;

/**
 * Persistent lookup table of geolocation records keyed by IP.
 */
public interface GeoStore {
    /**
     * Return the stored record for the IP, or null.
     */
    GeoRecord get(String ip);

    void put(String ip, GeoRecord record);
}
