package fr.lapetina.rpcpool.domain.strategy;

import fr.lapetina.rpcpool.exception.ConfigurationException;
import fr.lapetina.rpcpool.infrastructure.http.JsonRpcTransport;
import fr.lapetina.rpcpool.infrastructure.http.TransportFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Factory for building request strategies from configuration.
 *
 * Creates one fresh transport per configured URL, in order, duplicates included.
 */
public final class StrategyFactory {

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Creates a strategy using default transports.
     *
     * @param config Strategy type and endpoint URLs
     * @return Strategy instance
     * @throws ConfigurationException if no URL is configured or the type is missing
     */
    public static RequestStrategy create(StrategyConfig config) {
        return create(config, TransportFactory.defaults());
    }

    /**
     * Creates a strategy using transports from the given factory.
     *
     * @param config Strategy type and endpoint URLs
     * @param transportFactory Builds one transport per URL
     * @return Strategy instance
     * @throws ConfigurationException if no URL is configured or the type is missing
     */
    public static RequestStrategy create(StrategyConfig config, TransportFactory transportFactory) {
        Objects.requireNonNull(config, "Strategy config is required");
        Objects.requireNonNull(transportFactory, "Transport factory is required");

        if (config.rpcUrls().isEmpty()) {
            throw new ConfigurationException("At least one RPC URL must be provided");
        }

        List<JsonRpcTransport> transports = new ArrayList<>(config.rpcUrls().size());
        for (String url : config.rpcUrls()) {
            transports.add(transportFactory.create(url));
        }

        return create(config.type(), transports);
    }

    /**
     * Creates a strategy over existing transports.
     *
     * @throws ConfigurationException if the type is missing or the transport list is empty
     */
    public static RequestStrategy create(StrategyType type, List<JsonRpcTransport> transports) {
        if (type == null) {
            throw new ConfigurationException("Unknown strategy type: null");
        }
        return switch (type) {
            case FALLBACK -> new FallbackStrategy(transports);
            case PARALLEL -> new ParallelStrategy(transports);
        };
    }
}
