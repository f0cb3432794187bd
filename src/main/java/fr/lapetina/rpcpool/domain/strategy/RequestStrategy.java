package fr.lapetina.rpcpool.domain.strategy;

import fr.lapetina.rpcpool.domain.model.ExecutionResult;
import fr.lapetina.rpcpool.infrastructure.http.JsonRpcTransport;

import java.util.List;

/**
 * Strategy interface for answering one logical call from a fixed set of endpoints.
 *
 * Implementations must be thread-safe: one instance may serve concurrent executions.
 * The endpoint list is fixed at construction.
 */
public interface RequestStrategy {

    /**
     * Returns the name of this strategy for configuration, logging and metrics.
     */
    default String getName() {
        return getType().getName();
    }

    StrategyType getType();

    /**
     * Executes a call against the configured endpoints.
     *
     * <p>Never throws for endpoint failures; callers must check {@link ExecutionResult#success()}.
     * The produced value depends on the strategy: a {@code JsonNode} (or null) for
     * {@link StrategyType#FALLBACK}, the ordered {@code List<CallAttempt>} for
     * {@link StrategyType#PARALLEL}.
     *
     * @param method RPC method name
     * @param params positional parameters, may be empty
     * @return aggregate result with metadata
     */
    <T> ExecutionResult<T> execute(String method, List<?> params);

    /**
     * Returns the transports in configuration order.
     */
    List<JsonRpcTransport> getTransports();
}
