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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Parallel strategy with cross-endpoint consistency detection.
 *
 * Sends the same call to every endpoint at once and joins on all of them; slow
 * endpoints are never cancelled since the comparison needs every response. Each
 * per-endpoint future produces only its own attempt. Fingerprinting and comparison
 * run on the calling thread after the join.
 *
 * The produced value is the ordered list of attempts; the caller picks what to use.
 */
public final class ParallelStrategy implements RequestStrategy {

    private static final Logger log = LoggerFactory.getLogger(ParallelStrategy.class);

    private final List<JsonRpcTransport> transports;

    public ParallelStrategy(List<JsonRpcTransport> transports) {
        if (transports == null || transports.isEmpty()) {
            throw new ConfigurationException("At least one RPC transport must be provided");
        }
        this.transports = List.copyOf(transports);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.PARALLEL;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> ExecutionResult<T> execute(String method, List<?> params) {
        Objects.requireNonNull(method, "Method is required");
        Instant timestamp = Instant.now();

        List<CompletableFuture<CallAttempt>> pending = new ArrayList<>(transports.size());
        for (JsonRpcTransport transport : transports) {
            pending.add(attempt(transport, method, params));
        }

        CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();

        List<CallAttempt> responses = new ArrayList<>(pending.size());
        for (CompletableFuture<CallAttempt> future : pending) {
            CallAttempt attempt = future.join();
            responses.add(attempt.isSuccess()
                    ? attempt.withFingerprint(ResponseFingerprint.of(attempt.data()))
                    : attempt);
        }

        boolean hasSuccess = responses.stream().anyMatch(CallAttempt::isSuccess);
        boolean hasInconsistencies = detectInconsistencies(responses);

        if (hasInconsistencies) {
            log.warn("Inconsistent responses across endpoints: method={}, fingerprints={}",
                    method, distinctFingerprints(responses));
        }

        ExecutionMetadata metadata = new ExecutionMetadata(
                StrategyType.PARALLEL, timestamp, responses, hasInconsistencies);

        if (hasSuccess) {
            return ExecutionResult.success((T) metadata.responses(), metadata);
        }

        log.warn("All endpoints failed: method={}, endpoints={}", method, transports.size());
        return ExecutionResult.failure(metadata.responses(), metadata);
    }

    private CompletableFuture<CallAttempt> attempt(JsonRpcTransport transport, String method, List<?> params) {
        long startTime = System.nanoTime();
        CompletableFuture<JsonNode> call;
        try {
            call = transport.call(method, params);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.handle((data, ex) -> {
            long elapsed = FallbackStrategy.elapsedMillis(startTime);
            if (ex == null) {
                return CallAttempt.success(transport.getUrl(), elapsed, data);
            }
            CallAttempt failed = CallAttempt.error(transport.getUrl(), elapsed, ex);
            log.warn("Endpoint failed: method={}, url={}, errorType={}, error={}",
                    method, failed.url(), failed.errorType(), failed.error());
            return failed;
        });
    }

    /**
     * Compares every successful fingerprint against the first successful attempt
     * in configuration order. Fewer than two successes are never inconsistent.
     */
    static boolean detectInconsistencies(List<CallAttempt> responses) {
        List<CallAttempt> successful = responses.stream()
                .filter(CallAttempt::isSuccess)
                .toList();

        if (successful.size() < 2) {
            return false;
        }

        String reference = successful.get(0).fingerprint();
        return successful.stream()
                .anyMatch(attempt -> !Objects.equals(attempt.fingerprint(), reference));
    }

    private static Set<String> distinctFingerprints(List<CallAttempt> responses) {
        Set<String> fingerprints = new LinkedHashSet<>();
        for (CallAttempt attempt : responses) {
            if (attempt.isSuccess()) {
                fingerprints.add(attempt.fingerprint());
            }
        }
        return fingerprints;
    }

    @Override
    public List<JsonRpcTransport> getTransports() {
        return transports;
    }
}
