package fr.lapetina.rpcpool.exception;

/**
 * Exception raised when an endpoint cannot be reached or answers with a non-2xx status.
 *
 * Covers:
 * - HTTP status outside the 2xx range
 * - Connection failures and request timeouts
 * - Requests that cannot be built (malformed URL, unserializable params)
 * - Response bodies that are not a JSON object
 */
public final class TransportException extends RuntimeException {

    /** Status code used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final String url;
    private final int statusCode;

    public TransportException(String url, String message) {
        this(url, NO_STATUS, message, null);
    }

    public TransportException(String url, String message, Throwable cause) {
        this(url, NO_STATUS, message, cause);
    }

    public TransportException(String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    /**
     * Creates the exception for an HTTP response outside the 2xx range.
     */
    public static TransportException httpStatus(String url, int statusCode) {
        return new TransportException(url, statusCode, "HTTP error! status: " + statusCode, null);
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode != NO_STATUS;
    }
}
