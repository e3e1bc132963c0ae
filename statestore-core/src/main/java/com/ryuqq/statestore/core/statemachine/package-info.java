/**
 * Transaction status machine package.
 *
 * <p>{@link com.ryuqq.statestore.core.statemachine.TransactionStatus} defines the lifecycle of a
 * {@link com.ryuqq.statestore.core.model.StateTransaction};
 * {@link com.ryuqq.statestore.core.statemachine.TransactionStatusTransition} rejects every
 * transition except ACTIVE → COMMITTED and ACTIVE → ROLLED_BACK.</p>
 *
 * <pre>
 * ACTIVE ──► COMMITTED
 *   │
 *   └────► ROLLED_BACK
 * </pre>
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.core.statemachine;
