package fr.lapetina.rpcpool.domain.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.rpcpool.domain.model.CallAttempt;
import fr.lapetina.rpcpool.domain.model.ExecutionMetadata;
import fr.lapetina.rpcpool.domain.model.ExecutionResult;
import fr.lapetina.rpcpool.exception.ConfigurationException;
import fr.lapetina.rpcpool.infrastructure.http.JsonRpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Sequential fallback strategy.
 *
 * Tries endpoints in configuration order and stops at the first success;
 * lower-priority endpoints are never contacted once a higher-priority one answered.
 * Worst-case latency is the sum of all endpoint latencies.
 *
 * The produced value is the raw {@code result} of the answering endpoint. Metadata keeps
 * the full attempt history: failures first, then the successful attempt.
 */
public final class FallbackStrategy implements RequestStrategy {

    private static final Logger log = LoggerFactory.getLogger(FallbackStrategy.class);

    private final List<JsonRpcTransport> transports;

    public FallbackStrategy(List<JsonRpcTransport> transports) {
        if (transports == null || transports.isEmpty()) {
            throw new ConfigurationException("At least one RPC transport must be provided");
        }
        this.transports = List.copyOf(transports);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.FALLBACK;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> ExecutionResult<T> execute(String method, List<?> params) {
        Objects.requireNonNull(method, "Method is required");
        Instant timestamp = Instant.now();
        List<CallAttempt> attempts = new ArrayList<>(transports.size());

        for (JsonRpcTransport transport : transports) {
            long startTime = System.nanoTime();
            try {
                JsonNode data = transport.call(method, params).join();
                attempts.add(CallAttempt.success(transport.getUrl(), elapsedMillis(startTime), data));

                if (attempts.size() > 1) {
                    log.info("Fallback succeeded after failures: method={}, url={}, failedAttempts={}",
                            method, transport.getUrl(), attempts.size() - 1);
                }
                return ExecutionResult.success((T) data, metadata(timestamp, attempts));
            } catch (RuntimeException e) {
                CallAttempt failed = CallAttempt.error(transport.getUrl(), elapsedMillis(startTime), e);
                attempts.add(failed);
                log.warn("Endpoint failed, trying next: method={}, url={}, errorType={}, error={}",
                        method, failed.url(), failed.errorType(), failed.error());
            }
        }

        log.warn("All endpoints failed: method={}, endpoints={}", method, transports.size());
        return ExecutionResult.failure(attempts, metadata(timestamp, attempts));
    }

    private static ExecutionMetadata metadata(Instant timestamp, List<CallAttempt> attempts) {
        return new ExecutionMetadata(StrategyType.FALLBACK, timestamp, attempts, false);
    }

    static long elapsedMillis(long startNanos) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    @Override
    public List<JsonRpcTransport> getTransports() {
        return transports;
    }
}
