package net.spookly.shunt.routing;

import static net.spookly.shunt.routing.StubProbe.server;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class ProbeFanOutTest {
    @Test
    void keepsAtMostWindowProbesInFlight() throws Exception {
        List<CompletableFuture<Integer>> pending = new ArrayList<>();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        BackendProbe probe = (server, timeoutMs) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            CompletableFuture<Integer> future = new CompletableFuture<>();
            pending.add(future);
            return future;
        };
        List<BackendServer> servers = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            servers.add(server("s" + i));
        }
        ProbeFanOut fanOut = new ProbeFanOut(probe, 5, 0);

        CompletableFuture<List<Long>> result = fanOut.probeAll(servers, -1L);
        assertEquals(5, pending.size());

        for (int i = 0; i < 12; i++) {
            inFlight.decrementAndGet();
            pending.get(i).complete(i);
        }

        assertTrue(result.isDone());
        assertEquals(5, maxInFlight.get());
        List<Long> expected = new ArrayList<>();
        for (long i = 0; i < 12; i++) {
            expected.add(i);
        }
        assertEquals(expected, result.get());
    }

    @Test
    void resultsFollowListOrderRegardlessOfCompletionOrder() throws Exception {
        List<CompletableFuture<Integer>> pending = new ArrayList<>();
        BackendProbe probe = (server, timeoutMs) -> {
            CompletableFuture<Integer> future = new CompletableFuture<>();
            pending.add(future);
            return future;
        };
        ProbeFanOut fanOut = new ProbeFanOut(probe, 3, 0);

        CompletableFuture<List<Long>> result = fanOut.probeAll(List.of(server("a"), server("b"), server("c")), -1L);
        pending.get(2).complete(30);
        pending.get(0).complete(10);
        assertFalse(result.isDone());
        pending.get(1).complete(20);

        assertEquals(List.of(10L, 20L, 30L), result.get());
    }

    @Test
    void failuresAndInvalidCountsUseFailureScore() throws Exception {
        BackendProbe probe = (server, timeoutMs) -> {
            switch (server.address()) {
                case "thrower":
                    throw new IllegalStateException("boom");
                case "negative":
                    return CompletableFuture.completedFuture(-4);
                case "failed":
                    return CompletableFuture.failedFuture(new ProbeException("down"));
                default:
                    return CompletableFuture.completedFuture(7);
            }
        };
        ProbeFanOut fanOut = new ProbeFanOut(probe, 2, 0);

        List<Long> scores = fanOut.probeAll(
                List.of(server("thrower"), server("negative"), server("failed"), server("ok")), Long.MAX_VALUE).get();

        assertEquals(List.of(Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE, 7L), scores);
    }

    @Test
    void emptyListCompletesImmediately() throws Exception {
        ProbeFanOut fanOut = new ProbeFanOut(new StubProbe(), 5, 100);

        assertEquals(List.of(), fanOut.probeAll(List.of(), 0L).get());
        assertEquals(0L, fanOut.sumPlayers(List.of()).get());
    }

    @Test
    void rejectsNonPositiveWindow() {
        assertThrows(IllegalArgumentException.class, () -> new ProbeFanOut(new StubProbe(), 0, 100));
    }
}
