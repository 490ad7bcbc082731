package net.spookly.shunt.protocol;

import java.util.EnumSet;
import java.util.Set;

/**
 * Connection states of the Java edition protocol that the router takes part in.
 */
public enum ProtocolState {
    /** Initial state; only the handshake packet is understood. */
    HANDSHAKE,
    /** Server list ping: status request and ping. */
    STATUS,
    /** Login start and login acknowledged. */
    LOGIN,
    /** Configuration phase; the router only sends the transfer packet here. */
    CONFIG;

    /**
     * Legal next states. Transitions only move forward.
     */
    public Set<ProtocolState> successors() {
        switch (this) {
            case HANDSHAKE:
                return EnumSet.of(STATUS, LOGIN);
            case LOGIN:
                return EnumSet.of(CONFIG);
            default:
                return EnumSet.noneOf(ProtocolState.class);
        }
    }

    public boolean canTransitionTo(ProtocolState next) {
        return next != null && successors().contains(next);
    }

    /**
     * Map the handshake intent (1 status, 2 login, 3 transfer) to a state. Transfers log in like a fresh join.
     */
    public static ProtocolState fromIntent(int intent) {
        switch (intent) {
            case 1:
                return STATUS;
            case 2:
            case 3:
                return LOGIN;
            default:
                throw new ProtocolException("Unknown handshake intent: " + intent);
        }
    }
}
