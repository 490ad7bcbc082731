package net.spookly.shunt.resolve;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Failure to turn an address into a concrete endpoint.
 */
@Getter
@Accessors(fluent = true)
public class EndpointException extends RuntimeException {
    private final Kind kind;

    public EndpointException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EndpointException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public enum Kind {
        /** Malformed brackets, empty host or port, or an unparsable port number. */
        INVALID_HOST_PORT,
        /** The name exists but yielded no usable address. */
        NO_ADDRESS,
        /** The host has no alphabetic characters, so it cannot name an SRV record. */
        NO_SRV_AND_NO_FALLBACK,
        /** The underlying DNS lookup failed. */
        LOOKUP_FAILED
    }
}
