package net.spookly.shunt.routing;

/**
 * Selection algorithm for a static server list.
 */
public enum SelectionAlgorithm {
    ROUND_ROBIN("round_robin"),
    LOWEST_PLAYER_COUNT("lowest_player_count");

    private final String configValue;

    SelectionAlgorithm(String configValue) {
        this.configValue = configValue;
    }

    public static SelectionAlgorithm fromConfig(String value) {
        if (value == null) {
            return ROUND_ROBIN;
        }
        for (SelectionAlgorithm algorithm : values()) {
            if (algorithm.configValue.equalsIgnoreCase(value.trim())) {
                return algorithm;
            }
        }
        return ROUND_ROBIN;
    }
}
