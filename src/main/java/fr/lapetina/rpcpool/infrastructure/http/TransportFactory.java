package fr.lapetina.rpcpool.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Creates one {@link JsonRpcTransport} per endpoint URL.
 *
 * Transports built by the same factory share its HttpClient and ObjectMapper,
 * but each owns its request-id counter.
 */
@FunctionalInterface
public interface TransportFactory {

    Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Creates a fresh transport for the given URL.
     */
    JsonRpcTransport create(String url);

    /**
     * Factory with a 10s connect timeout and a 30s per-request timeout.
     */
    static TransportFactory defaults() {
        return withTimeouts(DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * Factory sharing one HttpClient configured with the given timeouts.
     *
     * @param connectTimeout connection timeout
     * @param requestTimeout per-request timeout, null or zero to rely on the connect timeout only
     */
    static TransportFactory withTimeouts(Duration connectTimeout, Duration requestTimeout) {
        HttpClient httpClient = JsonRpcTransport.defaultHttpClient(connectTimeout);
        ObjectMapper objectMapper = JsonRpcTransport.defaultObjectMapper();
        return url -> new JsonRpcTransport(url, httpClient, objectMapper, requestTimeout);
    }
}
