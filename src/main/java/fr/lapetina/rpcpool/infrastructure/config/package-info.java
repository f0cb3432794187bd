/**
 * Configuration loading and hot-reload support.
 *
 * <p>This package handles YAML configuration parsing, validation and runtime updates
 * without rebuilding the client.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.rpcpool.infrastructure.config.RpcPoolConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.rpcpool.infrastructure.config.ConfigLoader} - YAML loading, validation and file watching</li>
 *   <li>{@link fr.lapetina.rpcpool.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code strategy} - {@code fallback} or {@code parallel}</li>
 *   <li>{@code rpcUrls} - Ordered endpoint URLs, first is highest priority</li>
 *   <li>{@code timeouts} - Connect and per-request timeouts</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * strategy: parallel
 * rpcUrls:
 *   - https://eth.merkle.io
 *   - https://ethereum.publicnode.com
 * timeouts:
 *   connectTimeoutMs: 5000
 *   requestTimeoutMs: 15000
 * metrics:
 *   enabled: true
 *   prefix: rpc_pool
 * }</pre>
 *
 * @see fr.lapetina.rpcpool.infrastructure.config.RpcPoolConfig
 * @see fr.lapetina.rpcpool.infrastructure.config.ConfigLoader
 */
package fr.lapetina.rpcpool.infrastructure.config;
