package fr.lapetina.rpcpool.domain.model;

import fr.lapetina.rpcpool.exception.ProtocolException;
import fr.lapetina.rpcpool.exception.TransportException;

import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Error taxonomy for failed call attempts.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** HTTP or network level failure (non-2xx status, connection refused, bad URL) */
    TRANSPORT_ERROR,

    /** Endpoint answered with a JSON-RPC error envelope */
    PROTOCOL_ERROR,

    /** Request timed out waiting for the endpoint */
    TIMEOUT,

    /** Unexpected failure inside the transport */
    INTERNAL_ERROR;

    /**
     * Classifies a failure raised by a transport call.
     * Completion wrappers are unwrapped first.
     */
    public static ErrorType classify(Throwable failure) {
        Throwable cause = unwrap(failure);

        if (cause instanceof ProtocolException) {
            return PROTOCOL_ERROR;
        }
        if (isTimeout(cause)) {
            return TIMEOUT;
        }
        if (cause instanceof TransportException) {
            return TRANSPORT_ERROR;
        }
        return INTERNAL_ERROR;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isTimeout(Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }
}
