package net.spookly.shunt.config;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with sensitive values redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigPrinter() {
    }

    public static String toYaml(ShuntConfig config) {
        @SuppressWarnings("unchecked")
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redactSensitiveValues(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redactSensitiveValues(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object geo = data.get("geo");
        if (geo instanceof Map) {
            Map<String, Object> geoMap = (Map<String, Object>) geo;
            if (geoMap.containsKey("token")) {
                geoMap.put("token", REDACTED);
            }
        }
        Object http = data.get("http");
        if (http instanceof Map) {
            Object headers = ((Map<String, Object>) http).get("headers");
            if (headers instanceof Map) {
                ((Map<String, Object>) headers).replaceAll((name, value) -> REDACTED);
            }
        }
    }
}
