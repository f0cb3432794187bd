package fr.lapetina.rpcpool.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.rpcpool.domain.strategy.StrategyType;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Describes how an execution was carried out.
 *
 * @param strategy           strategy that ran
 * @param timestamp          wall-clock time taken when the execution began
 * @param responses          attempts in endpoint configuration order
 * @param hasInconsistencies true when successful responses disagree (parallel only)
 */
public record ExecutionMetadata(
        StrategyType strategy,
        Instant timestamp,
        List<CallAttempt> responses,
        @JsonProperty("hasInconsistencies") boolean hasInconsistencies
) {
    public ExecutionMetadata {
        Objects.requireNonNull(strategy, "Strategy is required");
        Objects.requireNonNull(timestamp, "Timestamp is required");
        responses = responses != null ? List.copyOf(responses) : List.of();
    }

    public long successCount() {
        return responses.stream().filter(CallAttempt::isSuccess).count();
    }

    public long errorCount() {
        return responses.stream().filter(CallAttempt::isError).count();
    }
}
