package net.spookly.shunt.routing;

import java.util.concurrent.CompletableFuture;

/**
 * Chooses the backend a new client is transferred to and reports the aggregate player count.
 */
public interface ServerSelector extends AutoCloseable {
    /**
     * Pick a backend for the request. Completes exceptionally with {@link SelectionException} only when
     * no backend can be chosen at all.
     */
    CompletableFuture<BackendServer> findServer(SelectionRequest request);

    /**
     * Sum of the online players across every backend this selector routes to. Unreachable backends count as 0.
     */
    CompletableFuture<Long> playerCount();

    @Override
    default void close() {
    }
}
