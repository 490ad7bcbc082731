package net.spookly.shunt.resolve;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadLocalRandom;

import io.netty.util.NetUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns user supplied addresses ({@code host}, {@code host:port}, {@code [v6]:port}, bare IPv6) into a concrete
 * IP and port, using literal parsing, host lookups and RFC 2782 weighted SRV selection.
 */
@Slf4j
public final class EndpointResolver {
    private final DnsLookup dnsLookup;
    private final RandomIndex random;

    public EndpointResolver(DnsLookup dnsLookup) {
        this(dnsLookup, bound -> ThreadLocalRandom.current().nextInt(bound));
    }

    EndpointResolver(DnsLookup dnsLookup, RandomIndex random) {
        this.dnsLookup = Objects.requireNonNull(dnsLookup, "dnsLookup");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Resolve {@code input}. An explicit port always wins; otherwise the SRV record
     * {@code _service._protocol.host} is consulted and {@code fallbackPort} applies only to plain host lookups.
     */
    public CompletableFuture<ResolvedEndpoint> resolve(String input, String service, String protocol, int fallbackPort) {
        if (input == null) {
            return CompletableFuture.failedFuture(
                    new EndpointException(EndpointException.Kind.INVALID_HOST_PORT, "address is required"));
        }
        HostPort split;
        try {
            split = splitHostPort(input);
        } catch (EndpointException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (split != null && split.port >= 0) {
            if (NetUtil.isValidIpV4Address(split.host) || NetUtil.isValidIpV6Address(split.host)) {
                return CompletableFuture.completedFuture(literal(split.host, split.port, input));
            }
            return lookupFirst(split.host, split.port, input);
        }

        String host = split != null ? split.host : normalizeHost(input);
        if (NetUtil.isValidIpV4Address(host) || NetUtil.isValidIpV6Address(host)) {
            return CompletableFuture.completedFuture(literal(host, fallbackPort, input));
        }
        if (!hasAsciiLetter(host)) {
            return CompletableFuture.failedFuture(new EndpointException(
                    EndpointException.Kind.NO_SRV_AND_NO_FALLBACK,
                    "SRV lookup failed and no fallback available for " + input));
        }

        String srvName = srvName(service, protocol, host);
        return dnsLookup.lookupSrv(srvName)
                .handle((records, error) -> {
                    if (error != null) {
                        log.debug("SRV lookup for {} failed: {}", srvName, unwrap(error).toString());
                        return null;
                    }
                    return pickSrv(records, random);
                })
                .thenCompose(chosen -> {
                    if (chosen == null) {
                        return lookupFirst(host, fallbackPort, input);
                    }
                    String target = stripRootDot(chosen.target());
                    log.debug("SRV {} selected {}:{}", srvName, target, chosen.port());
                    return resolveTarget(target, chosen.port(), input);
                });
    }

    private CompletableFuture<ResolvedEndpoint> resolveTarget(String target, int port, String input) {
        if (NetUtil.isValidIpV4Address(target) || NetUtil.isValidIpV6Address(target)) {
            return CompletableFuture.completedFuture(literal(target, port, input));
        }
        return lookupFirst(target, port, input);
    }

    private CompletableFuture<ResolvedEndpoint> lookupFirst(String host, int port, String input) {
        CompletableFuture<ResolvedEndpoint> result = new CompletableFuture<>();
        dnsLookup.lookupHost(host).whenComplete((addresses, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                result.completeExceptionally(new EndpointException(
                        EndpointException.Kind.LOOKUP_FAILED,
                        "DNS resolve error for " + host + ": " + cause.getMessage(),
                        cause));
                return;
            }
            if (addresses == null || addresses.isEmpty()) {
                result.completeExceptionally(new EndpointException(
                        EndpointException.Kind.NO_ADDRESS, "No A/AAAA records found for " + host));
                return;
            }
            InetAddress first = addresses.get(0);
            result.complete(new ResolvedEndpoint(NetUtil.toAddressString(first), port, input, host));
        });
        return result;
    }

    private static ResolvedEndpoint literal(String host, int port, String input) {
        InetAddress address = NetUtil.createInetAddressFromIpAddressString(host);
        String ip = address == null ? host : NetUtil.toAddressString(address);
        return new ResolvedEndpoint(ip, port, input, host);
    }

    /**
     * RFC 2782 choice: lowest priority wins, then a weighted draw among that priority.
     */
    static SrvRecord pickSrv(List<SrvRecord> records, RandomIndex random) {
        if (records == null || records.isEmpty()) {
            return null;
        }
        int minPriority = Integer.MAX_VALUE;
        for (SrvRecord record : records) {
            minPriority = Math.min(minPriority, record.priority());
        }
        List<SrvRecord> candidates = new ArrayList<>();
        int totalWeight = 0;
        for (SrvRecord record : records) {
            if (record.priority() == minPriority) {
                candidates.add(record);
                totalWeight += record.weight();
            }
        }
        if (totalWeight == 0) {
            return candidates.get(random.nextInt(candidates.size()));
        }
        int pick = random.nextInt(totalWeight);
        for (SrvRecord candidate : candidates) {
            if (pick < candidate.weight()) {
                return candidate;
            }
            pick -= candidate.weight();
        }
        return null;
    }

    /**
     * Split an explicit port off the input. Returns null when the input has no port and no brackets;
     * a bracketed literal without a port comes back with port -1.
     */
    static HostPort splitHostPort(String input) {
        if (input.startsWith("[")) {
            int end = input.indexOf(']');
            if (end < 0 || input.indexOf('[', 1) >= 0 || input.indexOf(']', end + 1) >= 0) {
                throw invalid(input);
            }
            String host = input.substring(1, end);
            if (host.isEmpty()) {
                throw invalid(input);
            }
            if (end + 1 == input.length()) {
                return new HostPort(host, -1);
            }
            if (input.charAt(end + 1) != ':') {
                throw invalid(input);
            }
            return new HostPort(host, parsePort(input.substring(end + 2), input));
        }
        if (input.indexOf('[') >= 0 || input.indexOf(']') >= 0) {
            throw invalid(input);
        }

        int colons = 0;
        for (int i = 0; i < input.length(); i++) {
            if (input.charAt(i) == ':') {
                colons++;
            }
        }
        if (colons == 0) {
            return null;
        }
        if (colons > 1 && NetUtil.isValidIpV6Address(input)) {
            return null;
        }
        int idx = input.lastIndexOf(':');
        String host = input.substring(0, idx);
        String portRaw = input.substring(idx + 1);
        if (host.isEmpty() || portRaw.isEmpty()) {
            throw invalid(input);
        }
        return new HostPort(host, parsePort(portRaw, input));
    }

    private static int parsePort(String raw, String input) {
        if (raw.isEmpty() || raw.length() > 5) {
            throw invalid(input);
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                throw invalid(input);
            }
        }
        int port = Integer.parseInt(raw);
        if (port > 65535) {
            throw invalid(input);
        }
        return port;
    }

    static String srvName(String service, String protocol, String host) {
        return "_" + stripLeadingUnderscore(service) + "._" + stripLeadingUnderscore(protocol) + "." + host;
    }

    private static String stripLeadingUnderscore(String value) {
        String trimmed = value == null ? "" : value;
        while (trimmed.startsWith("_")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed;
    }

    private static String normalizeHost(String input) {
        return stripRootDot(input.trim());
    }

    private static String stripRootDot(String host) {
        return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }

    private static boolean hasAsciiLetter(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                return true;
            }
        }
        return false;
    }

    private static EndpointException invalid(String input) {
        return new EndpointException(EndpointException.Kind.INVALID_HOST_PORT, "Invalid host:port format: " + input);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Source of uniform random indexes in {@code [0, bound)}.
     */
    public interface RandomIndex {
        int nextInt(int bound);
    }

    static final class HostPort {
        final String host;
        final int port;

        HostPort(String host, int port) {
            this.host = host;
            this.port = port;
        }
    }
}
