/**
 * In-memory StateStore adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.statestore.adapter.inmemory.store.InMemoryStateStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.statestore.core.spi.StateStore}</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> one {@link java.util.concurrent.locks.ReentrantLock} per store
 *       guards state, histories, active transaction and sequence counter together</li>
 *   <li><strong>Ordering:</strong> snapshot sequence ids increase monotonically and are never reused</li>
 *   <li><strong>Bounded History:</strong> snapshots and transactions are evicted oldest first</li>
 *   <li><strong>No I/O under lock:</strong> consistency checks stat files after releasing the lock</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Single process only</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // Use in Contract Tests
 * class MyStoreContractTest extends TransactionContractTest {
 *     {@literal @}Override
 *     protected StateStore createStore(StateStoreConfig config, FileMetadataProvider files) {
 *         return new InMemoryStateStore(config, files);
 *     }
 * }
 * </pre>
 *
 * @see com.ryuqq.statestore.core.spi.StateStore
 * @author StateStore Team
 * @since 1.0.0
 */
package com.ryuqq.statestore.adapter.inmemory.store;
