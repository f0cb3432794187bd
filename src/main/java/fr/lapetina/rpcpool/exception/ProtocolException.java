package fr.lapetina.rpcpool.exception;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Exception raised when an endpoint answers with a well-formed JSON-RPC error envelope.
 */
public final class ProtocolException extends RuntimeException {

    private final String url;
    private final int code;
    private final JsonNode data;

    public ProtocolException(String url, int code, String rpcMessage, JsonNode data) {
        super("RPC error: " + rpcMessage);
        this.url = url;
        this.code = code;
        this.data = data;
    }

    public String getUrl() {
        return url;
    }

    /**
     * JSON-RPC error code, e.g. -32601 for an unknown method.
     */
    public int getCode() {
        return code;
    }

    /**
     * Optional {@code error.data} member, null when absent.
     */
    public JsonNode getData() {
        return data;
    }
}
