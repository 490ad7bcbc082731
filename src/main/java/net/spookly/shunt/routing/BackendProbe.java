package net.spookly.shunt.routing;

import java.util.concurrent.CompletableFuture;

/**
 * Asks a backend for its current online player count.
 */
public interface BackendProbe {
    /**
     * Probe the backend and complete with its online player count, or complete exceptionally
     * (usually with {@link ProbeException}) on any failure or when the timeout elapses.
     */
    CompletableFuture<Integer> probe(BackendServer server, int timeoutMs);
}
