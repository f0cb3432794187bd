/**
 * rpc-pool - Multi-endpoint JSON-RPC client for blockchain nodes.
 *
 * <p>This library sends one logical JSON-RPC call to one or more configured endpoints
 * and returns a uniform result with per-endpoint execution metadata.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.rpcpool.NetworkClient} - Client facade holding the active strategy</li>
 *   <li>{@link fr.lapetina.rpcpool.NetworkClientFactory} - Creates a fully-configured client
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.rpcpool.RpcPoolApplication} - Command-line runner for single calls</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * NetworkClient client = new NetworkClient(StrategyConfig.parallel(List.of(
 *         "https://eth.merkle.io",
 *         "https://ethereum.publicnode.com")));
 *
 * ExecutionResult<List<CallAttempt>> result = client.execute("eth_blockNumber");
 * if (result.success() && !result.hasInconsistencies()) {
 *     System.out.println(result.data().get(0).data());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Sequential fallback and parallel strategies, switchable at runtime</li>
 *   <li>Cross-endpoint consistency detection by response fingerprint</li>
 *   <li>Hot-reload configuration without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.rpcpool.NetworkClient
 * @see fr.lapetina.rpcpool.domain.strategy.StrategyFactory
 */
package fr.lapetina.rpcpool;
