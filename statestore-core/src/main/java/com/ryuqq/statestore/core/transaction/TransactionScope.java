package com.ryuqq.statestore.core.transaction;

import com.ryuqq.statestore.core.model.TransactionId;
import com.ryuqq.statestore.core.spi.StateStore;

/**
 * Rollback-unless-committed guard around one store transaction.
 *
 * <p>The transaction begins when the scope is opened. Closing a scope that was neither committed nor
 * rolled back rolls the transaction back, so every exit path of a try-with-resources block
 * (normal return, early return, exception, error) leaves the store resolved.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * try (TransactionScope scope = TransactionScope.begin(store, "generate_tests")) {
 *     store.setState(withGeneratedTests(store.getState()));
 *     store.setState(withBuildStatus(store.getState()));
 *     scope.commit();
 * }
 * </pre>
 *
 * <p>Not thread-safe: a scope belongs to the thread that opened it.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public final class TransactionScope implements AutoCloseable {

    static final String CLOSED_WITHOUT_COMMIT = "scope closed without commit";

    private final StateStore store;
    private final TransactionId transactionId;
    private boolean resolved;

    private TransactionScope(StateStore store, TransactionId transactionId) {
        this.store = store;
        this.transactionId = transactionId;
    }

    /**
     * Begins a transaction and returns its guard.
     *
     * @param store the store
     * @param operationName human-readable operation name
     * @return an open scope
     * @throws IllegalArgumentException if store is null
     * @throws com.ryuqq.statestore.core.exception.TransactionConflictException if a transaction is already active
     */
    public static TransactionScope begin(StateStore store, String operationName) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        return new TransactionScope(store, store.beginTransaction(operationName));
    }

    public TransactionId transactionId() {
        return transactionId;
    }

    public boolean isResolved() {
        return resolved;
    }

    /**
     * Commits the transaction and disarms the guard.
     *
     * <p>If the commit is rejected (e.g. validation), the guard stays armed and {@link #close()} will roll back.</p>
     *
     * @throws IllegalStateException if the scope was already resolved
     */
    public void commit() {
        ensureOpen();
        store.commitTransaction(transactionId);
        resolved = true;
    }

    /**
     * Rolls the transaction back and disarms the guard.
     *
     * @param error reason recorded on the transaction (null allowed)
     * @throws IllegalStateException if the scope was already resolved
     */
    public void rollback(String error) {
        ensureOpen();
        resolved = true;
        store.rollbackTransaction(transactionId, error);
    }

    @Override
    public void close() {
        if (!resolved) {
            resolved = true;
            store.rollbackTransaction(transactionId, CLOSED_WITHOUT_COMMIT);
        }
    }

    private void ensureOpen() {
        if (resolved) {
            throw new IllegalStateException("Transaction scope already resolved: " + transactionId);
        }
    }
}
