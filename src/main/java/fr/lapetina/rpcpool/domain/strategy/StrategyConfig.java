package fr.lapetina.rpcpool.domain.strategy;

import java.util.List;

/**
 * Strategy selection plus the ordered endpoint URLs it runs against.
 * Duplicate URLs are kept.
 */
public record StrategyConfig(StrategyType type, List<String> rpcUrls) {

    public StrategyConfig {
        rpcUrls = rpcUrls != null ? List.copyOf(rpcUrls) : List.of();
    }

    /**
     * Creates a configuration from a strategy name.
     *
     * @throws fr.lapetina.rpcpool.exception.ConfigurationException if the name is unknown
     */
    public static StrategyConfig of(String type, List<String> rpcUrls) {
        return new StrategyConfig(StrategyType.fromName(type), rpcUrls);
    }

    public static StrategyConfig fallback(List<String> rpcUrls) {
        return new StrategyConfig(StrategyType.FALLBACK, rpcUrls);
    }

    public static StrategyConfig parallel(List<String> rpcUrls) {
        return new StrategyConfig(StrategyType.PARALLEL, rpcUrls);
    }
}
