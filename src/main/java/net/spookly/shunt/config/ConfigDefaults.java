package net.spookly.shunt.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final int DEFAULT_LISTEN_PORT = 25565;
    public static final int DEFAULT_BACKEND_PORT = 25565;
    public static final int DEFAULT_TIMEOUT_SECONDS = 5;
    public static final String DEFAULT_MOTD = "A Shunt router";
    public static final String DEFAULT_GEO_ENDPOINT = "https://api.ipinfo.io/lite";
    public static final String DEFAULT_GEO_CACHE_PATH = "cache/geo.json";

    private static final String DEFAULT_YAML = """
            # Generated default Shunt config.
            # Pick one mode: static, geo or http. Only the matching section is required.
            listen:
              host: 0.0.0.0
              port: 25565
            motd: "A Shunt router"
            mode: static

            static:
              algorithm: round_robin   # round_robin or lowest_player_count
              servers:
                - name: lobby-1
                  address: 127.0.0.1
                  port: 25566

            # geo:
            #   token: env:IPINFO_TOKEN
            #   regions:
            #     NA:
            #       address: us.example.com
            #     EU:
            #       address: eu.example.com
            #   fallback:
            #     address: fallback.example.com

            # http:
            #   endpoint: https://selector.example.com/server
            #   requestMethod: GET
            #   headers:
            #     Authorization: env:SELECTOR_TOKEN
            #   fallback:
            #     address: fallback.example.com

            timeoutSeconds: 5
            handshakeTimeoutMs: 10000
            logging:
              level: info
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML;
    }
}
