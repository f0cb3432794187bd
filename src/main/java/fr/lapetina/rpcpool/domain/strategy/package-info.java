/**
 * Execution strategies deciding how the configured endpoints answer one call.
 *
 * <p>All implementations are thread-safe and never throw for endpoint failures.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th><th>Produced value</th></tr>
 *   <tr><td>{@code fallback}</td><td>Tries endpoints in order, stops at the first success</td><td>Raw {@code result} as {@code JsonNode}</td></tr>
 *   <tr><td>{@code parallel}</td><td>Calls every endpoint, waits for all, compares fingerprints</td><td>{@code List<CallAttempt>}</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RequestStrategy strategy = StrategyFactory.create(StrategyConfig.parallel(urls));
 * ExecutionResult<List<CallAttempt>> result = strategy.execute("eth_blockNumber", List.of());
 * if (result.hasInconsistencies()) {
 *     // endpoints disagree
 * }
 * }</pre>
 *
 * @see fr.lapetina.rpcpool.domain.strategy.RequestStrategy
 * @see fr.lapetina.rpcpool.domain.strategy.StrategyFactory
 */
package fr.lapetina.rpcpool.domain.strategy;
