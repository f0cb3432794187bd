package fr.lapetina.rpcpool.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.rpcpool.exception.ProtocolException;
import fr.lapetina.rpcpool.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 transport for a single endpoint.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Each instance owns its
 * request-id counter, which starts at 1 and is incremented once per call,
 * failed calls included. No retry logic lives here.
 */
public class JsonRpcTransport {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcTransport.class);

    static final String JSONRPC_VERSION = "2.0";

    private final String url;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final AtomicLong requestId = new AtomicLong(0);

    public JsonRpcTransport(
            String url,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Duration requestTimeout
    ) {
        this.url = Objects.requireNonNull(url, "URL is required");
        this.httpClient = Objects.requireNonNull(httpClient, "HTTP client is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper is required");
        this.requestTimeout = requestTimeout;
    }

    /**
     * Issues one JSON-RPC call.
     *
     * @param method RPC method name, passed through verbatim
     * @param params positional parameters, null is sent as an empty array
     * @return future completed with the {@code result} member (null when null or absent),
     *         or completed exceptionally with {@link TransportException} or {@link ProtocolException}
     */
    public CompletableFuture<JsonNode> call(String method, List<?> params) {
        long id = requestId.incrementAndGet();

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(id, method, params);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.warn("Failed to build request: url={}, id={}, method={}, error={}", url, id, method, e.getMessage());
            return CompletableFuture.failedFuture(
                    new TransportException(url, "Failed to build request: " + e.getMessage(), e));
        }

        log.debug("Sending request: url={}, id={}, method={}", url, id, method);

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, ex) -> {
                    if (ex != null) {
                        throw toTransportException(ex);
                    }
                    return readResult(id, method, response);
                });
    }

    private HttpRequest buildHttpRequest(long id, String method, List<?> params) throws JsonProcessingException {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("jsonrpc", JSONRPC_VERSION);
        envelope.put("id", id);
        envelope.put("method", method);
        envelope.set("params", objectMapper.valueToTree(params != null ? params : List.of()));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(envelope)));

        if (requestTimeout != null && !requestTimeout.isZero()) {
            builder.timeout(requestTimeout);
        }
        return builder.build();
    }

    private JsonNode readResult(long id, String method, HttpResponse<String> response) {
        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            log.debug("Request failed with HTTP error: url={}, id={}, method={}, status={}", url, id, method, statusCode);
            throw TransportException.httpStatus(url, statusCode);
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new TransportException(url, statusCode, "Invalid JSON-RPC response: " + e.getOriginalMessage(), e);
        }
        if (body == null || !body.isObject()) {
            throw new TransportException(url, statusCode, "Invalid JSON-RPC response: expected an object", null);
        }

        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            String message = error.path("message").asText(error.toString());
            log.debug("Request failed with RPC error: url={}, id={}, method={}, code={}, message={}",
                    url, id, method, error.path("code").asInt(), message);
            throw new ProtocolException(url, error.path("code").asInt(), message, error.get("data"));
        }

        JsonNode result = body.get("result");
        log.debug("Request successful: url={}, id={}, method={}", url, id, method);
        return result == null || result.isNull() ? null : result;
    }

    private TransportException toTransportException(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TransportException transportException) {
            return transportException;
        }
        String message = cause.getMessage() != null
                ? cause.getMessage()
                : cause.getClass().getSimpleName();
        return new TransportException(url, message, cause);
    }

    public String getUrl() {
        return url;
    }

    /**
     * Returns the per-request timeout, null when none is applied.
     */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Returns the id of the last request issued, 0 before the first call.
     */
    public long getRequestId() {
        return requestId.get();
    }

    static HttpClient defaultHttpClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String toString() {
        return "JsonRpcTransport{" +
                "url='" + url + '\'' +
                ", requestId=" + requestId.get() +
                '}';
    }
}
