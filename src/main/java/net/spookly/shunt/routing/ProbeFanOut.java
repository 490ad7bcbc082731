package net.spookly.shunt.routing;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Probes a list of backends with a bounded number of probes in flight. Results keep list order; a failed or
 * timed out probe yields the caller's failure score.
 */
@Slf4j
public final class ProbeFanOut {
    private final BackendProbe probe;
    private final int window;
    private final int timeoutMs;

    public ProbeFanOut(BackendProbe probe, int window, int timeoutMs) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be greater than 0");
        }
        this.probe = Objects.requireNonNull(probe, "probe");
        this.window = window;
        this.timeoutMs = timeoutMs;
    }

    public CompletableFuture<List<Long>> probeAll(List<BackendServer> servers, long failureScore) {
        if (servers == null || servers.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        Run run = new Run(servers, failureScore);
        int initial = Math.min(window, servers.size());
        for (int i = 0; i < initial; i++) {
            run.launchNext();
        }
        return run.done;
    }

    /**
     * Sum of all successful counts; failures contribute 0.
     */
    public CompletableFuture<Long> sumPlayers(List<BackendServer> servers) {
        return probeAll(servers, 0L).thenApply(counts -> {
            long total = 0;
            for (Long count : counts) {
                total += count;
            }
            return total;
        });
    }

    int window() {
        return window;
    }

    private final class Run {
        private final List<BackendServer> servers;
        private final long failureScore;
        private final AtomicLongArray results;
        private final AtomicInteger next = new AtomicInteger();
        private final AtomicInteger remaining;
        private final CompletableFuture<List<Long>> done = new CompletableFuture<>();

        private Run(List<BackendServer> servers, long failureScore) {
            this.servers = servers;
            this.failureScore = failureScore;
            this.results = new AtomicLongArray(servers.size());
            this.remaining = new AtomicInteger(servers.size());
        }

        private void launchNext() {
            int index = next.getAndIncrement();
            if (index >= servers.size()) {
                return;
            }
            BackendServer server = servers.get(index);
            CompletableFuture<Integer> attempt;
            try {
                attempt = probe.probe(server, timeoutMs);
            } catch (RuntimeException e) {
                attempt = CompletableFuture.failedFuture(e);
            }
            if (timeoutMs > 0) {
                attempt = attempt.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
            }
            attempt.whenComplete((count, error) -> {
                if (error == null && count != null && count >= 0) {
                    results.set(index, count);
                } else {
                    if (error != null) {
                        log.warn("Probe of {} failed: {}", server, describe(error));
                    } else {
                        log.warn("Probe of {} returned an invalid player count: {}", server, count);
                    }
                    results.set(index, failureScore);
                }
                if (remaining.decrementAndGet() == 0) {
                    List<Long> ordered = new ArrayList<>(servers.size());
                    for (int i = 0; i < servers.size(); i++) {
                        ordered.add(results.get(i));
                    }
                    done.complete(ordered);
                } else {
                    launchNext();
                }
            });
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
