package net.spookly.shunt.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ShuntConfig {
    public ListenConfig listen;
    public String motd;
    public String mode;
    @JsonProperty("static")
    public StaticConfig staticMode;
    public GeoConfig geo;
    public HttpConfig http;
    /**
     * Timeout for backend probes and outbound lookups.
     */
    public Integer timeoutSeconds;
    public Integer handshakeTimeoutMs;
    public LoggingConfig logging;

    public static class ListenConfig {
        public String host;
        public Integer port;
    }

    public static class StaticConfig {
        public String algorithm;
        public List<ServerConfig> servers;
    }

    public static class GeoConfig {
        public String token;
        public String endpoint;
        public String cachePath;
        /**
         * Continent or country code to backend, for example {@code NA} or {@code DE}.
         */
        public Map<String, ServerConfig> regions;
        public ServerConfig fallback;
    }

    public static class HttpConfig {
        public String endpoint;
        public String requestMethod;
        public Map<String, String> headers;
        public ServerConfig fallback;
    }

    public static class ServerConfig {
        public String name;
        public String address;
        public Integer port;
    }

    public static class LoggingConfig {
        public String level;
    }
}
