/**
 * JSON-RPC 2.0 over HTTP.
 *
 * <p>{@link fr.lapetina.rpcpool.infrastructure.http.JsonRpcTransport} performs one call against one
 * endpoint and reports failures as {@link fr.lapetina.rpcpool.exception.TransportException} or
 * {@link fr.lapetina.rpcpool.exception.ProtocolException}.
 * {@link fr.lapetina.rpcpool.infrastructure.http.TransportFactory} creates transports that share an
 * {@code HttpClient}.
 */
package fr.lapetina.rpcpool.infrastructure.http;
