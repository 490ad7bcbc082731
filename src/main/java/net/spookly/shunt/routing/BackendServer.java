package net.spookly.shunt.routing;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.shunt.config.ConfigDefaults;
import net.spookly.shunt.config.ShuntConfig;

import java.util.Objects;

/**
 * Immutable backend a client can be transferred to. Identity is address text plus port, since several
 * backends may share one host and differ only by port; the name is display-only.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode(of = {"address", "port"})
public final class BackendServer {
    private final String name;
    private final String address;
    private final int port;

    public static BackendServer fromConfig(ShuntConfig.ServerConfig server) {
        Objects.requireNonNull(server, "server");
        int port = server.port == null ? ConfigDefaults.DEFAULT_BACKEND_PORT : server.port;
        return new BackendServer(server.name, server.address.trim(), port);
    }

    /**
     * Display label, the configured name when present.
     */
    public String label() {
        return name == null || name.trim().isEmpty() ? address + ":" + port : name;
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}
