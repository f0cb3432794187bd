/**
 * Result model produced by every execution.
 *
 * <p>This package contains immutable records created fresh for each call and never retained
 * by the strategies.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.rpcpool.domain.model.CallAttempt} - Outcome of one endpoint for one call</li>
 *   <li>{@link fr.lapetina.rpcpool.domain.model.ExecutionMetadata} - Strategy, start time, attempts, consistency flag</li>
 *   <li>{@link fr.lapetina.rpcpool.domain.model.ExecutionResult} - Success flag, produced value or errors</li>
 *   <li>{@link fr.lapetina.rpcpool.domain.model.ErrorType} - Categorized failure types for attempts</li>
 * </ul>
 *
 * <h2>Invariant</h2>
 * <p>{@code ExecutionResult.success()} is true iff at least one attempt of the execution succeeded.
 */
package fr.lapetina.rpcpool.domain.model;
