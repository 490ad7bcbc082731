package net.spookly.shunt.resolve;

import java.net.InetAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous DNS queries used by {@link EndpointResolver}.
 */
public interface DnsLookup extends AutoCloseable {
    /**
     * A/AAAA lookup. Completes with an empty list when the name has no addresses.
     */
    CompletableFuture<List<InetAddress>> lookupHost(String host);

    /**
     * SRV lookup for a fully built service name such as {@code _minecraft._tcp.example.com}.
     */
    CompletableFuture<List<SrvRecord>> lookupSrv(String name);

    @Override
    default void close() {
    }
}
