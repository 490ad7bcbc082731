package net.spookly.shunt.protocol;

/**
 * Malformed packet or a packet that is not legal in the current connection state.
 */
public class ProtocolException extends RuntimeException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
