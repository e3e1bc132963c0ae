/**
 * Transaction helpers built on top of the {@link com.ryuqq.statestore.core.spi.StateStore} SPI.
 *
 * <ul>
 *   <li>{@link com.ryuqq.statestore.core.transaction.TransactionScope} - rollback-unless-committed guard</li>
 *   <li>{@link com.ryuqq.statestore.core.transaction.StateOperation} - unit of work run under a transaction</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.core.transaction;
