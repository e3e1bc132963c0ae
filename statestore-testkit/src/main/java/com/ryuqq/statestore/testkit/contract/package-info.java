/**
 * Reusable contract tests for {@link com.ryuqq.statestore.core.spi.StateStore} implementations.
 *
 * <p>Each contract is an abstract JUnit 5 class. An implementation module runs a contract by
 * subclassing it and overriding
 * {@link com.ryuqq.statestore.testkit.contract.AbstractStateStoreContractTest#createStore}.</p>
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.testkit.contract;
