package net.spookly.shunt.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import net.spookly.shunt.routing.ServerSelector;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves server list payloads. The aggregate player count is refreshed from the selector at most once per
 * {@link #REFRESH_INTERVAL}; concurrent callers share a single in-flight refresh. Rendered payloads are kept
 * per motd, protocol version and player count.
 */
@Slf4j
public final class StatusCache {
    public static final Duration REFRESH_INTERVAL = Duration.ofSeconds(15);
    public static final String VERSION_NAME = "Shunt";
    public static final int MAX_PLAYERS = 1000;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ServerSelector selector;
    private final Clock clock;
    private final Map<StatusKey, String> entries = new ConcurrentHashMap<>();
    private final Object refreshLock = new Object();
    private CompletableFuture<Long> inFlight;
    private Instant lastRefresh;
    private volatile long playerCount;

    public StatusCache(ServerSelector selector) {
        this(selector, Clock.systemUTC());
    }

    StatusCache(ServerSelector selector, Clock clock) {
        this.selector = Objects.requireNonNull(selector, "selector");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Payload for the given motd and protocol version, refreshing the player count first when it is stale.
     */
    public CompletableFuture<String> status(String motd, int protocolVersion) {
        return currentPlayerCount().thenApply(count ->
                entries.computeIfAbsent(new StatusKey(motd, protocolVersion, count), StatusCache::render));
    }

    CompletableFuture<Long> currentPlayerCount() {
        CompletableFuture<Long> refresh;
        synchronized (refreshLock) {
            if (inFlight != null) {
                return inFlight;
            }
            if (lastRefresh != null && Duration.between(lastRefresh, clock.instant()).compareTo(REFRESH_INTERVAL) <= 0) {
                return CompletableFuture.completedFuture(playerCount);
            }
            refresh = new CompletableFuture<>();
            inFlight = refresh;
        }
        startRefresh(refresh);
        return refresh;
    }

    private void startRefresh(CompletableFuture<Long> refresh) {
        CompletableFuture<Long> count;
        try {
            count = selector.playerCount();
        } catch (RuntimeException e) {
            count = CompletableFuture.failedFuture(e);
        }
        count.whenComplete((value, error) -> {
            long current;
            synchronized (refreshLock) {
                if (error == null && value != null) {
                    playerCount = value;
                } else {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    log.warn("Player count refresh failed, keeping {}: {}", playerCount,
                            cause == null ? "no count returned" : cause.getMessage());
                }
                lastRefresh = clock.instant();
                inFlight = null;
                current = playerCount;
            }
            log.debug("Player count is now {}", current);
            refresh.complete(current);
        });
    }

    int size() {
        return entries.size();
    }

    static String render(StatusKey key) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode version = root.putObject("version");
        version.put("name", VERSION_NAME);
        version.put("protocol", key.protocolVersion());
        ObjectNode players = root.putObject("players");
        players.put("max", MAX_PLAYERS);
        players.put("online", key.playerCount());
        players.putArray("sample");
        root.put("description", key.motd());
        root.put("enforceSecureChat", false);
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render status payload", e);
        }
    }
}
