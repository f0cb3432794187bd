package fr.lapetina.rpcpool.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Aggregate result of one logical call across the configured endpoints.
 *
 * <p>Never produced by throwing: total failure is a normal result with {@code success == false}
 * and every endpoint failure listed in {@code errors}.
 *
 * @param <T> type of the produced value
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult<T>(
        boolean success,
        T data,
        List<CallAttempt> errors,
        ExecutionMetadata metadata
) {
    public ExecutionResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /**
     * Creates a successful result.
     */
    public static <T> ExecutionResult<T> success(T data, ExecutionMetadata metadata) {
        return new ExecutionResult<>(true, data, List.of(), metadata);
    }

    /**
     * Creates a failed result carrying every failed attempt.
     */
    public static <T> ExecutionResult<T> failure(List<CallAttempt> errors, ExecutionMetadata metadata) {
        return new ExecutionResult<>(false, null, errors, metadata);
    }

    public boolean hasInconsistencies() {
        return metadata != null && metadata.hasInconsistencies();
    }
}
