package net.spookly.shunt.routing;

/**
 * How the router picks a backend.
 */
public enum SelectionMode {
    STATIC("static"),
    GEO("geo"),
    HTTP("http");

    private final String configValue;

    SelectionMode(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static SelectionMode fromConfig(String value) {
        if (value == null) {
            return STATIC;
        }
        for (SelectionMode mode : values()) {
            if (mode.configValue.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        return STATIC;
    }
}
