package net.spookly.shunt.routing;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Probes every server for each selection and picks the one with the fewest players. Unreachable servers score
 * {@link Long#MAX_VALUE}; ties go to the earlier server in the list.
 */
@Slf4j
public final class LowestLoadServerSelector implements ServerSelector {
    static final int PROBE_WINDOW = 5;

    private final List<BackendServer> servers;
    private final ProbeFanOut fanOut;

    public LowestLoadServerSelector(List<BackendServer> servers, BackendProbe probe, int timeoutMs) {
        this.servers = List.copyOf(Objects.requireNonNull(servers, "servers"));
        this.fanOut = new ProbeFanOut(probe, PROBE_WINDOW, timeoutMs);
    }

    @Override
    public CompletableFuture<BackendServer> findServer(SelectionRequest request) {
        if (servers.isEmpty()) {
            return CompletableFuture.failedFuture(new SelectionException("no servers available"));
        }
        return fanOut.probeAll(servers, Long.MAX_VALUE).thenApply(scores -> {
            int best = 0;
            for (int i = 1; i < scores.size(); i++) {
                if (scores.get(i) < scores.get(best)) {
                    best = i;
                }
            }
            BackendServer chosen = servers.get(best);
            log.debug("Lowest load backend is {} with score {}", chosen, scores.get(best));
            return chosen;
        });
    }

    @Override
    public CompletableFuture<Long> playerCount() {
        return fanOut.sumPlayers(servers);
    }
}
