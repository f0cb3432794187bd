package fr.lapetina.rpcpool.domain.strategy;

import com.fasterxml.jackson.annotation.JsonValue;
import fr.lapetina.rpcpool.exception.ConfigurationException;

import java.util.Locale;

/**
 * Closed set of execution strategies.
 */
public enum StrategyType {
    /** Sequential, stops at the first endpoint that answers */
    FALLBACK("fallback"),

    /** Concurrent, waits for every endpoint and compares responses */
    PARALLEL("parallel");

    private final String name;

    StrategyType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    /**
     * Parses a strategy name from configuration, case-insensitively.
     *
     * @throws ConfigurationException if the name is missing or unknown
     */
    public static StrategyType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (StrategyType type : values()) {
                if (type.name.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ConfigurationException("Unknown strategy type: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
