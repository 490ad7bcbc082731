package net.spookly.shunt.routing;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.net.InetAddress;

/**
 * Routing context for one connection.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class SelectionRequest {
    /**
     * Remote address of the client, or null when the transport has none.
     */
    private final InetAddress clientAddress;
}
