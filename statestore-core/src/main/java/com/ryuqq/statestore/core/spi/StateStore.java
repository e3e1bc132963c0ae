package com.ryuqq.statestore.core.spi;

import com.ryuqq.statestore.core.consistency.ConsistencyReport;
import com.ryuqq.statestore.core.diff.DiffReport;
import com.ryuqq.statestore.core.diff.StateDiffer;
import com.ryuqq.statestore.core.model.ProjectState;
import com.ryuqq.statestore.core.model.StateSnapshot;
import com.ryuqq.statestore.core.model.StateTransaction;
import com.ryuqq.statestore.core.model.TransactionId;
import com.ryuqq.statestore.core.transaction.StateOperation;
import com.ryuqq.statestore.core.transaction.TransactionScope;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Transactional, snapshot-based store of the current project analysis state.
 *
 * <p>One instance holds the state of one project. Pipeline stages read a copy with {@link #getState()},
 * build a modified copy, and write it back with {@link #setState(ProjectState)}. Multi-step sequences
 * are wrapped in {@link #executeWithRollback(String, StateOperation)} so that a failure part-way through
 * restores the state as it was before the sequence began.</p>
 *
 * <p><strong>State Machine:</strong></p>
 * <pre>
 * Uninitialized ──(first setState)──► Ready
 *
 * Ready:  NoActiveTransaction ⇄ TransactionActive
 *         (beginTransaction / commitTransaction | rollbackTransaction)
 * </pre>
 *
 * <p><strong>Transaction Model:</strong></p>
 * <ul>
 *   <li>At most one active transaction per store; no nesting</li>
 *   <li>Writes inside a transaction are applied live immediately (no buffering)</li>
 *   <li>Rollback restores the pre-image captured at begin time</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: live state, both histories and the active transaction are guarded together</li>
 *   <li>Copy semantics: callers never obtain a reference into store internals</li>
 *   <li>No filesystem I/O while holding the store lock</li>
 * </ul>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Returns an independent copy of the current state.
     *
     * @return current state (equal to, but not the same instance as, the stored value)
     * @throws com.ryuqq.statestore.core.exception.NoStateException if no state has been set
     */
    ProjectState getState();

    /**
     * @return true once a state has been set and until it is cleared or rolled back to nothing
     */
    boolean hasState();

    /**
     * Validates and stores a copy of the given state, appending a snapshot to history.
     *
     * @param state the new state
     * @throws IllegalArgumentException if state is null
     * @throws com.ryuqq.statestore.core.exception.StateValidationException if the state has violations;
     *         the live state is unchanged
     */
    void setState(ProjectState state);

    /**
     * Validates a state without side effects.
     *
     * @param state the state to check
     * @return human-readable violations; empty when valid
     */
    List<String> validateState(ProjectState state);

    /**
     * Begins a transaction, capturing the current state as its pre-image.
     *
     * @param operationName human-readable operation name
     * @return the new transaction's id
     * @throws IllegalArgumentException if operationName is null or blank
     * @throws com.ryuqq.statestore.core.exception.TransactionConflictException if a transaction is already active
     */
    TransactionId beginTransaction(String operationName);

    /**
     * Re-validates the current state and commits the active transaction.
     *
     * @param transactionId id returned by {@link #beginTransaction(String)}
     * @throws com.ryuqq.statestore.core.exception.TransactionNotFoundException if the id is not the active transaction
     * @throws com.ryuqq.statestore.core.exception.StateValidationException if the current state is invalid;
     *         the transaction stays active
     */
    void commitTransaction(TransactionId transactionId);

    /**
     * Restores the pre-image of the active transaction.
     *
     * <p>Snapshots taken after the pre-image are discarded, so afterwards the latest snapshot
     * holds the restored state (or the history is empty if the store was uninitialized at begin).</p>
     *
     * @param transactionId id returned by {@link #beginTransaction(String)}
     * @throws com.ryuqq.statestore.core.exception.TransactionNotFoundException if the id is not the active transaction
     */
    default void rollbackTransaction(TransactionId transactionId) {
        rollbackTransaction(transactionId, null);
    }

    /**
     * Restores the pre-image of the active transaction, recording why.
     *
     * @param transactionId id returned by {@link #beginTransaction(String)}
     * @param error reason recorded on the transaction (null allowed)
     * @throws com.ryuqq.statestore.core.exception.TransactionNotFoundException if the id is not the active transaction
     */
    void rollbackTransaction(TransactionId transactionId, String error);

    /**
     * @return the active transaction, if any
     */
    Optional<StateTransaction> getActiveTransaction();

    /**
     * Runs an operation under a transaction: commit on success, rollback on failure.
     *
     * @param operationName human-readable operation name
     * @param operation the work to run
     * @param <T> result type
     * @param <E> exception type the operation may throw
     * @return the operation's result
     * @throws E exactly what the operation threw, after the rollback
     * @see #executeWithRollback(String, StateOperation, Consumer)
     */
    default <T, E extends Exception> T executeWithRollback(String operationName,
                                                           StateOperation<T, E> operation) throws E {
        return executeWithRollback(operationName, operation, null);
    }

    /**
     * Runs an operation under a transaction: commit on success, rollback on failure.
     *
     * <p><strong>Failure Path:</strong></p>
     * <pre>
     * 1. operation throws e
     * 2. rollbackTransaction(id, e.toString())  → pre-image restored
     * 3. onError.accept(e)                      → if given
     * 4. throw e                                → same instance, unwrapped
     * </pre>
     *
     * <p>If the commit itself is rejected, the transaction is rolled back and the rejection propagates.
     * A failure inside the rollback or inside {@code onError} is attached to {@code e} as suppressed
     * and never replaces it.</p>
     *
     * @param operationName human-readable operation name
     * @param operation the work to run
     * @param onError callback invoked after rollback (null allowed)
     * @param <T> result type
     * @param <E> exception type the operation may throw
     * @return the operation's result
     * @throws E exactly what the operation threw, after the rollback
     */
    default <T, E extends Exception> T executeWithRollback(String operationName,
                                                           StateOperation<T, E> operation,
                                                           Consumer<? super Exception> onError) throws E {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        try (TransactionScope scope = TransactionScope.begin(this, operationName)) {
            T result;
            try {
                result = operation.run();
            } catch (Exception e) {
                try {
                    scope.rollback(e.toString());
                } catch (RuntimeException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                if (onError != null) {
                    try {
                        onError.accept(e);
                    } catch (RuntimeException callbackFailure) {
                        e.addSuppressed(callbackFailure);
                    }
                }
                throw e;
            }
            scope.commit();
            return result;
        }
    }

    /**
     * Compares the current state's project directory and class records against the filesystem.
     *
     * <p>A missing project directory is reported as the only issue.</p>
     *
     * @return consistency report
     * @throws com.ryuqq.statestore.core.exception.NoStateException if no state has been set
     */
    ConsistencyReport verifyStateConsistency();

    /**
     * Compares the given state's project directory and class records against the filesystem.
     *
     * @param state the state to check
     * @return consistency report
     * @throws IllegalArgumentException if state is null
     */
    ConsistencyReport verifyStateConsistency(ProjectState state);

    /**
     * Removes every class record with the given name and persists the result as a new snapshot.
     *
     * <p>No-op when no state has been set or no record matches.</p>
     *
     * @param className class name
     */
    void invalidateClassState(String className);

    /**
     * @param sequenceId snapshot sequence id
     * @return a copy of the snapshot
     * @throws com.ryuqq.statestore.core.exception.SnapshotNotFoundException if evicted or unknown
     */
    StateSnapshot getSnapshot(long sequenceId);

    /**
     * @return a copy of the most recent snapshot
     * @throws com.ryuqq.statestore.core.exception.SnapshotNotFoundException if history is empty
     */
    StateSnapshot getLatestSnapshot();

    /**
     * @param since inclusive lower bound on snapshot timestamps
     * @return copies of the retained snapshots taken at or after {@code since}, oldest first
     */
    List<StateSnapshot> getSnapshotsSince(Instant since);

    /**
     * @param limit maximum number of entries
     * @return resolved transactions, most recent first
     * @throws IllegalArgumentException if limit is not positive
     */
    List<StateTransaction> getTransactionHistory(int limit);

    /**
     * Diffs a retained snapshot against the current state.
     *
     * @param sequenceId snapshot sequence id
     * @return diff from the snapshot to the current state
     * @throws com.ryuqq.statestore.core.exception.SnapshotNotFoundException if evicted or unknown
     * @throws com.ryuqq.statestore.core.exception.NoStateException if no state has been set
     */
    default DiffReport diffAgainstSnapshot(long sequenceId) {
        return StateDiffer.diff(getSnapshot(sequenceId).state(), getState());
    }

    /**
     * Hard reset to the uninitialized condition.
     *
     * <p>Clears the state and both histories and drops any active transaction without rollback.
     * Intended for tests and teardown.</p>
     */
    void clearState();
}
