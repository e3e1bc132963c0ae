/**
 * Error taxonomy of the state store.
 *
 * <ul>
 *   <li>{@link com.ryuqq.statestore.core.exception.NoStateException} - read before first write</li>
 *   <li>{@link com.ryuqq.statestore.core.exception.StateValidationException} - payload failed shape checks</li>
 *   <li>{@link com.ryuqq.statestore.core.exception.TransactionConflictException} - second concurrent transaction</li>
 *   <li>{@link com.ryuqq.statestore.core.exception.TransactionNotFoundException} - id is not the active transaction</li>
 *   <li>{@link com.ryuqq.statestore.core.exception.SnapshotNotFoundException} - evicted or unknown snapshot</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.core.exception;
