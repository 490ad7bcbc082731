package net.spookly.shunt.geo;

import java.net.InetAddress;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves a client address to its geolocation.
 */
public interface GeoLocator extends AutoCloseable {
    /**
     * Complete with the record for the address, or exceptionally with {@link GeoLookupException}.
     */
    CompletableFuture<GeoRecord> locate(InetAddress address);

    @Override
    default void close() {
    }
}
