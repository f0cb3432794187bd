package fr.lapetina.rpcpool.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a single endpoint for a single logical call.
 */
public enum CallStatus {
    SUCCESS("success"),
    ERROR("error");

    private final String name;

    CallStatus(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
