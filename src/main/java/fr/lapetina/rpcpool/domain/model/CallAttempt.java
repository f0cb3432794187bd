package fr.lapetina.rpcpool.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Recorded outcome of one endpoint within one execution.
 * Immutable and thread-safe.
 *
 * On success {@code data} holds the raw JSON-RPC {@code result} (null for a JSON null or absent
 * result) and {@code fingerprint} is set by strategies that compare responses. On error
 * {@code error} and {@code errorType} describe the failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallAttempt(
        String url,
        CallStatus status,
        long responseTimeMs,
        JsonNode data,
        String fingerprint,
        @JsonProperty("error") String error,
        ErrorType errorType
) {
    public CallAttempt {
        Objects.requireNonNull(url, "URL is required");
        Objects.requireNonNull(status, "Status is required");
        if (responseTimeMs < 0) {
            throw new IllegalArgumentException("Response time must not be negative: " + responseTimeMs);
        }
        if (status == CallStatus.ERROR) {
            Objects.requireNonNull(errorType, "Error type is required for a failed attempt");
            if (error == null || error.isEmpty()) {
                error = errorType.name();
            }
        }
    }

    /**
     * Creates a successful attempt without a fingerprint.
     */
    public static CallAttempt success(String url, long responseTimeMs, JsonNode data) {
        return new CallAttempt(url, CallStatus.SUCCESS, responseTimeMs, data, null, null, null);
    }

    /**
     * Creates a failed attempt.
     */
    public static CallAttempt error(String url, long responseTimeMs, ErrorType errorType, String error) {
        return new CallAttempt(url, CallStatus.ERROR, responseTimeMs, null, null, error, errorType);
    }

    /**
     * Creates a failed attempt from the failure raised by a transport call.
     */
    public static CallAttempt error(String url, long responseTimeMs, Throwable failure) {
        Throwable cause = ErrorType.unwrap(failure);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return error(url, responseTimeMs, ErrorType.classify(cause), message);
    }

    /**
     * Returns a copy of this attempt carrying the given fingerprint.
     */
    public CallAttempt withFingerprint(String fingerprint) {
        return new CallAttempt(url, status, responseTimeMs, data, fingerprint, error, errorType);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == CallStatus.SUCCESS;
    }

    @JsonIgnore
    public boolean isError() {
        return status == CallStatus.ERROR;
    }
}
