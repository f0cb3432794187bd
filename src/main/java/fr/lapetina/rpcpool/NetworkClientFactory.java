package fr.lapetina.rpcpool;

import fr.lapetina.rpcpool.domain.strategy.StrategyType;
import fr.lapetina.rpcpool.infrastructure.config.ConfigLoader;
import fr.lapetina.rpcpool.infrastructure.config.RpcPoolConfig;
import fr.lapetina.rpcpool.infrastructure.http.TransportFactory;
import fr.lapetina.rpcpool.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Factory for creating fully-wired clients from configuration.
 * This is the primary entry point for obtaining a configured NetworkClient.
 *
 * <p>Usage:
 * <pre>{@code
 * try (NetworkClientFactory factory = NetworkClientFactory.create("rpc-pool.yaml").start()) {
 *     NetworkClient client = factory.getClient();
 *     // use client...
 * }
 * }</pre>
 */
public class NetworkClientFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NetworkClientFactory.class);

    private final ConfigLoader configLoader;
    private final RpcPoolConfig initialConfig;
    private final MetricsRegistry metricsRegistry;
    private final TransportFactory transportFactory;
    private final NetworkClient client;

    protected NetworkClientFactory(String configPath, TransportFactory transportFactoryOverride) {
        log.info("Initializing NetworkClientFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.initialConfig = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = initialConfig.getMetrics().isEnabled()
                ? new MetricsRegistry(initialConfig.getMetrics().getPrefix())
                : null;

        // Initialize transports (allow override for testing)
        this.transportFactory = transportFactoryOverride != null
                ? transportFactoryOverride
                : createTransportFactory();

        this.client = new NetworkClient(initialConfig.toStrategyConfig(), transportFactory, metricsRegistry);

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("NetworkClientFactory initialized: strategy={}, endpoints={}",
                client.getStrategyName(), client.getRpcUrls().size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static NetworkClientFactory create(String configPath) {
        return new NetworkClientFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (rpc-pool.yaml).
     */
    public static NetworkClientFactory create() {
        return create("rpc-pool.yaml");
    }

    /**
     * Starts watching the configuration file.
     */
    public NetworkClientFactory start() {
        configLoader.startWatching();
        return this;
    }

    public NetworkClient getClient() {
        return client;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * Returns the current configuration, reflecting reloads.
     */
    public RpcPoolConfig getConfig() {
        return configLoader.getCurrentConfig();
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private TransportFactory createTransportFactory() {
        long requestTimeoutMs = initialConfig.getTimeouts().getRequestTimeoutMs();
        return TransportFactory.withTimeouts(
                Duration.ofMillis(initialConfig.getTimeouts().getConnectTimeoutMs()),
                requestTimeoutMs > 0 ? Duration.ofMillis(requestTimeoutMs) : null
        );
    }

    private void onConfigChanged(RpcPoolConfig oldConfig, RpcPoolConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        // Endpoints are fixed for the lifetime of a client
        if (!newConfig.getRpcUrls().equals(client.getRpcUrls())) {
            log.warn("RPC URL changes require a new client, ignoring: configured={}, active={}",
                    newConfig.getRpcUrls().size(), client.getRpcUrls().size());
        }

        RpcPoolConfig.TimeoutsConfig active = initialConfig.getTimeouts();
        RpcPoolConfig.TimeoutsConfig configured = newConfig.getTimeouts();
        if (active.getConnectTimeoutMs() != configured.getConnectTimeoutMs()
                || active.getRequestTimeoutMs() != configured.getRequestTimeoutMs()) {
            log.warn("Timeout changes require a new client, ignoring: configuredConnectMs={}, configuredRequestMs={}, activeConnectMs={}, activeRequestMs={}",
                    configured.getConnectTimeoutMs(), configured.getRequestTimeoutMs(),
                    active.getConnectTimeoutMs(), active.getRequestTimeoutMs());
        }

        RpcPoolConfig.MetricsConfig activeMetrics = initialConfig.getMetrics();
        RpcPoolConfig.MetricsConfig configuredMetrics = newConfig.getMetrics();
        if (activeMetrics.isEnabled() != configuredMetrics.isEnabled()
                || !Objects.equals(activeMetrics.getPrefix(), configuredMetrics.getPrefix())) {
            log.warn("Metrics changes require a new client, ignoring: configuredEnabled={}, configuredPrefix={}, activeEnabled={}, activePrefix={}",
                    configuredMetrics.isEnabled(), configuredMetrics.getPrefix(),
                    activeMetrics.isEnabled(), activeMetrics.getPrefix());
        }

        StrategyType newType = StrategyType.fromName(newConfig.getStrategy());
        if (newType != client.getStrategyType()) {
            client.updateStrategy(newType);
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down NetworkClientFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("NetworkClientFactory shut down");
    }
}
