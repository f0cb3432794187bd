package fr.lapetina.rpcpool.infrastructure.config;

import fr.lapetina.rpcpool.domain.strategy.StrategyConfig;
import fr.lapetina.rpcpool.infrastructure.http.TransportFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the client.
 * Designed to be populated from YAML.
 */
public class RpcPoolConfig {

    private String strategy = "fallback";
    private List<String> rpcUrls = new ArrayList<>();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public List<String> getRpcUrls() { return rpcUrls; }
    public void setRpcUrls(List<String> rpcUrls) { this.rpcUrls = rpcUrls; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Converts the strategy section into a {@link StrategyConfig}.
     *
     * @throws fr.lapetina.rpcpool.exception.ConfigurationException if the strategy name is unknown
     */
    public StrategyConfig toStrategyConfig() {
        return StrategyConfig.of(strategy, rpcUrls);
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = TransportFactory.DEFAULT_CONNECT_TIMEOUT.toMillis();
        private long requestTimeoutMs = TransportFactory.DEFAULT_REQUEST_TIMEOUT.toMillis();

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "rpc_pool";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
