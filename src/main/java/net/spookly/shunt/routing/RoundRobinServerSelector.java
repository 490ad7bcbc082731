package net.spookly.shunt.routing;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through a fixed server list. The first call returns the first server.
 */
public final class RoundRobinServerSelector implements ServerSelector {
    static final int PROBE_WINDOW = 5;

    private final List<BackendServer> servers;
    private final ProbeFanOut fanOut;
    private final AtomicInteger cursor;

    public RoundRobinServerSelector(List<BackendServer> servers, BackendProbe probe, int timeoutMs) {
        this(servers, probe, timeoutMs, 0);
    }

    RoundRobinServerSelector(List<BackendServer> servers, BackendProbe probe, int timeoutMs, int start) {
        this.servers = List.copyOf(Objects.requireNonNull(servers, "servers"));
        this.fanOut = new ProbeFanOut(probe, PROBE_WINDOW, timeoutMs);
        this.cursor = new AtomicInteger(this.servers.isEmpty() ? 0 : Math.floorMod(start, this.servers.size()));
    }

    @Override
    public CompletableFuture<BackendServer> findServer(SelectionRequest request) {
        if (servers.isEmpty()) {
            return CompletableFuture.failedFuture(new SelectionException("no servers available"));
        }
        // Cursor stays within [0, size) so it never overflows.
        int size = servers.size();
        int index = cursor.getAndUpdate(i -> (i + 1) % size);
        return CompletableFuture.completedFuture(servers.get(index));
    }

    @Override
    public CompletableFuture<Long> playerCount() {
        return fanOut.sumPlayers(servers);
    }
}
