package net.spookly.shunt.geo;

public class GeoLookupException extends RuntimeException {
    public GeoLookupException(String message) {
        super(message);
    }

    public GeoLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
