/**
 * Error taxonomy of the client.
 *
 * <p>{@link fr.lapetina.rpcpool.exception.TransportException} and
 * {@link fr.lapetina.rpcpool.exception.ProtocolException} are produced by a transport for a single
 * endpoint and never escape a strategy: they are recorded as failed call attempts.
 * {@link fr.lapetina.rpcpool.exception.ConfigurationException} is the only exception thrown to callers,
 * and only while building strategies, clients or configuration.
 */
package fr.lapetina.rpcpool.exception;
