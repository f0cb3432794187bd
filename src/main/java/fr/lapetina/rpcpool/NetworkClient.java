package fr.lapetina.rpcpool;

import fr.lapetina.rpcpool.domain.model.ExecutionResult;
import fr.lapetina.rpcpool.domain.strategy.RequestStrategy;
import fr.lapetina.rpcpool.domain.strategy.StrategyConfig;
import fr.lapetina.rpcpool.domain.strategy.StrategyFactory;
import fr.lapetina.rpcpool.domain.strategy.StrategyType;
import fr.lapetina.rpcpool.infrastructure.http.TransportFactory;
import fr.lapetina.rpcpool.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Objects;

/**
 * Client facade over one active request strategy.
 *
 * Network-specific clients extend this class and forward fixed method names
 * through {@link #execute(String, List)}. The URL list is fixed for the lifetime
 * of the client; {@link #updateStrategy(StrategyType)} replaces the whole strategy,
 * transports included.
 *
 * <p>Usage:
 * <pre>{@code
 * NetworkClient client = new NetworkClient(StrategyConfig.fallback(List.of(primary, backup)));
 * ExecutionResult<JsonNode> chainId = client.execute("eth_chainId");
 * if (chainId.success()) {
 *     System.out.println(chainId.data().asText());
 * }
 * }</pre>
 */
public class NetworkClient {

    private static final Logger log = LoggerFactory.getLogger(NetworkClient.class);

    static final String MDC_METHOD = "rpcMethod";
    static final String MDC_STRATEGY = "rpcStrategy";

    private final List<String> rpcUrls;
    private final TransportFactory transportFactory;
    private final MetricsRegistry metricsRegistry;

    private volatile RequestStrategy strategy;

    public NetworkClient(StrategyConfig config) {
        this(config, TransportFactory.defaults(), null);
    }

    /**
     * @param config           Strategy type and endpoint URLs
     * @param transportFactory Builds transports, also used on strategy updates
     * @param metricsRegistry  Metrics sink, or null to disable metrics
     * @throws fr.lapetina.rpcpool.exception.ConfigurationException if no URL is configured
     */
    public NetworkClient(StrategyConfig config, TransportFactory transportFactory, MetricsRegistry metricsRegistry) {
        Objects.requireNonNull(config, "Strategy config is required");
        this.transportFactory = Objects.requireNonNull(transportFactory, "Transport factory is required");
        this.metricsRegistry = metricsRegistry;
        this.strategy = StrategyFactory.create(config, transportFactory);
        this.rpcUrls = config.rpcUrls();

        log.info("NetworkClient created: strategy={}, endpoints={}", strategy.getName(), rpcUrls.size());
    }

    /**
     * Executes an RPC method with the current strategy.
     *
     * @param method RPC method name (e.g. "eth_blockNumber")
     * @param params positional parameters
     * @return result, never null; callers must check {@code success()}
     */
    public <T> ExecutionResult<T> execute(String method, List<?> params) {
        RequestStrategy current = strategy;

        MDC.put(MDC_METHOD, method);
        MDC.put(MDC_STRATEGY, current.getName());
        try {
            ExecutionResult<T> result = current.execute(method, params != null ? params : List.of());

            if (metricsRegistry != null) {
                metricsRegistry.recordExecution(method, result);
            }
            log.debug("Execution completed: method={}, strategy={}, success={}, attempts={}",
                    method, current.getName(), result.success(),
                    result.metadata() != null ? result.metadata().responses().size() : 0);
            return result;
        } finally {
            MDC.remove(MDC_METHOD);
            MDC.remove(MDC_STRATEGY);
        }
    }

    /**
     * Executes an RPC method without parameters.
     */
    public <T> ExecutionResult<T> execute(String method) {
        return execute(method, List.of());
    }

    public RequestStrategy getStrategy() {
        return strategy;
    }

    public String getStrategyName() {
        return strategy.getName();
    }

    public StrategyType getStrategyType() {
        return strategy.getType();
    }

    /**
     * Returns the configured URLs in order, as given at construction.
     */
    public List<String> getRpcUrls() {
        return rpcUrls;
    }

    /**
     * Replaces the current strategy with a fresh one of the given type,
     * built with fresh transports over the same URLs. Executions already
     * running finish on the previous strategy.
     */
    public void updateStrategy(StrategyType type) {
        RequestStrategy replacement = StrategyFactory.create(new StrategyConfig(type, rpcUrls), transportFactory);
        RequestStrategy previous = strategy;
        strategy = replacement;
        log.info("Strategy updated: from={}, to={}", previous.getName(), replacement.getName());
    }

    /**
     * Replaces the current strategy by name.
     *
     * @throws fr.lapetina.rpcpool.exception.ConfigurationException if the name is unknown
     */
    public void updateStrategy(String type) {
        updateStrategy(StrategyType.fromName(type));
    }
}
