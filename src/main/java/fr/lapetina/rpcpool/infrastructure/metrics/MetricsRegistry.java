package fr.lapetina.rpcpool.infrastructure.metrics;

import fr.lapetina.rpcpool.domain.model.CallAttempt;
import fr.lapetina.rpcpool.domain.model.ErrorType;
import fr.lapetina.rpcpool.domain.model.ExecutionMetadata;
import fr.lapetina.rpcpool.domain.model.ExecutionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Call counters and latency timers per endpoint
 * - Error counters by endpoint and error type
 * - Execution counters by strategy and outcome
 * - Inconsistency counters per method
 * - Prometheus exposition
 *
 * Endpoints are tagged by host and port only, so API keys embedded in
 * endpoint paths are not exported.
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> executionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> inconsistencyCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
        log.info("MetricsRegistry initialized: prefix={}, registry={}", prefix, registry.getClass().getSimpleName());
    }

    public MetricsRegistry(String prefix) {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), prefix);
    }

    public MetricsRegistry() {
        this("rpc_pool");
    }

    /**
     * Records every attempt of an execution plus its overall outcome.
     */
    public void recordExecution(String method, ExecutionResult<?> result) {
        ExecutionMetadata metadata = result.metadata();
        String strategy = metadata != null ? metadata.strategy().getName() : "unknown";
        incrementExecutionCount(strategy, result.success() ? "success" : "failure");

        if (metadata == null) {
            return;
        }
        for (CallAttempt attempt : metadata.responses()) {
            recordAttempt(attempt);
        }
        if (metadata.hasInconsistencies()) {
            incrementInconsistencyCount(method);
        }
    }

    /**
     * Records one call attempt against an endpoint.
     */
    public void recordAttempt(CallAttempt attempt) {
        String endpoint = endpointTag(attempt.url());
        incrementCallCount(endpoint, attempt.status().getName());
        recordLatency(endpoint, Duration.ofMillis(attempt.responseTimeMs()));
        if (attempt.isError()) {
            incrementErrorCount(endpoint, attempt.errorType());
        }
    }

    /**
     * Increments the call counter for an endpoint/status combination.
     */
    public void incrementCallCount(String endpoint, String status) {
        String key = endpoint + ":" + status;
        callCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_calls_total")
                        .description("Total number of endpoint calls")
                        .tag("endpoint", endpoint)
                        .tag("status", status)
                        .register(registry)
        ).increment();
    }

    /**
     * Records endpoint call latency.
     */
    public void recordLatency(String endpoint, Duration latency) {
        latencyTimers.computeIfAbsent(endpoint, k ->
                Timer.builder(prefix + "_call_latency")
                        .description("Endpoint call latency")
                        .tag("endpoint", endpoint)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String endpoint, ErrorType errorType) {
        String key = endpoint + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of endpoint errors")
                        .tag("endpoint", endpoint)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the execution counter for a strategy/outcome combination.
     */
    public void incrementExecutionCount(String strategy, String outcome) {
        String key = strategy + ":" + outcome;
        executionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_executions_total")
                        .description("Total number of executions")
                        .tag("strategy", strategy)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the inconsistency counter for a method.
     */
    public void incrementInconsistencyCount(String method) {
        inconsistencyCounters.computeIfAbsent(method, k ->
                Counter.builder(prefix + "_inconsistencies_total")
                        .description("Executions whose endpoints returned differing responses")
                        .tag("method", method)
                        .register(registry)
        ).increment();
    }

    /**
     * Reduces an endpoint URL to {@code host[:port]}.
     */
    static String endpointTag(String url) {
        try {
            URI uri = URI.create(url);
            if (uri.getHost() == null) {
                return "invalid";
            }
            return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
        } catch (IllegalArgumentException e) {
            return "invalid";
        }
    }

    /**
     * Returns the Prometheus scrape output, empty for non-Prometheus registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
