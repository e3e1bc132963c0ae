package com.ryuqq.statestore.adapter.inmemory.store;

import com.ryuqq.statestore.adapter.inmemory.filesystem.LocalFileMetadataProvider;
import com.ryuqq.statestore.core.config.StateStoreConfig;
import com.ryuqq.statestore.core.consistency.ConsistencyReport;
import com.ryuqq.statestore.core.consistency.ConsistencyVerifier;
import com.ryuqq.statestore.core.exception.NoStateException;
import com.ryuqq.statestore.core.exception.SnapshotNotFoundException;
import com.ryuqq.statestore.core.exception.StateValidationException;
import com.ryuqq.statestore.core.exception.TransactionConflictException;
import com.ryuqq.statestore.core.exception.TransactionNotFoundException;
import com.ryuqq.statestore.core.model.ProjectState;
import com.ryuqq.statestore.core.model.StateSnapshot;
import com.ryuqq.statestore.core.model.StateTransaction;
import com.ryuqq.statestore.core.model.TransactionId;
import com.ryuqq.statestore.core.spi.FileMetadataProvider;
import com.ryuqq.statestore.core.spi.StateStore;
import com.ryuqq.statestore.core.validation.StateValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link StateStore} SPI.
 *
 * <p>All mutable fields are guarded by one {@link ReentrantLock}, so a reader never observes the live
 * state, the histories and the active transaction out of step with each other.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>current:</strong> ProjectState - live value (null while uninitialized)</li>
 *   <li><strong>snapshots:</strong> ArrayDeque&lt;StateSnapshot&gt; - oldest first, evicted from the head</li>
 *   <li><strong>transactions:</strong> ArrayDeque&lt;StateTransaction&gt; - newest first, evicted from the tail</li>
 *   <li><strong>active:</strong> StateTransaction - the single active transaction slot</li>
 *   <li><strong>nextSequenceId:</strong> long - shared by history snapshots and pre-images, never reset</li>
 * </ul>
 *
 * <p><strong>Snapshot Operations:</strong></p>
 * <pre>
 * setState            → set_state
 * commitTransaction   → commit:&lt;operation name&gt;
 * invalidateClassState → invalidate_class:&lt;class name&gt;
 * beginTransaction    → pre-image only (held by the transaction, not added to history)
 * rollbackTransaction → drops the snapshots taken after the pre-image;
 *                       rollback:&lt;operation name&gt; only if the pre-image's own snapshot was evicted
 * </pre>
 *
 * <p><strong>Lock Discipline:</strong> filesystem metadata is read by {@link ConsistencyVerifier}
 * after the class records have been copied out and the lock released.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>One project per instance; see the application layer's registry for several projects</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StateStore store = new InMemoryStateStore(new StateStoreConfig().withMaxSnapshots(20));
 * store.setState(ProjectState.of("/work/demo", "demo"));
 *
 * store.executeWithRollback("analyze", () -&gt; {
 *     store.setState(analyzer.analyze(store.getState()));
 *     return null;
 * });
 * </pre>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    static final String SET_STATE = "set_state";
    static final String COMMIT_PREFIX = "commit:";
    static final String INVALIDATE_PREFIX = "invalidate_class:";
    static final String PRE_IMAGE_PREFIX = "pre_image:";
    static final String ROLLBACK_PREFIX = "rollback:";

    private final ReentrantLock lock = new ReentrantLock();

    private final StateStoreConfig config;
    private final StateValidator validator;
    private final ConsistencyVerifier verifier;
    private final Clock clock;

    private final Deque<StateSnapshot> snapshots = new ArrayDeque<>();
    private final Deque<StateTransaction> transactions = new ArrayDeque<>();

    private ProjectState current;
    private StateTransaction active;
    private long nextSequenceId = 1;

    /**
     * Creates a store with default configuration, reading file metadata from the local filesystem.
     */
    public InMemoryStateStore() {
        this(new StateStoreConfig());
    }

    /**
     * Creates a store reading file metadata from the local filesystem.
     *
     * @param config store configuration
     */
    public InMemoryStateStore(StateStoreConfig config) {
        this(config, new LocalFileMetadataProvider());
    }

    /**
     * Creates a store with a custom file metadata source.
     *
     * @param config store configuration
     * @param files file metadata provider used by consistency verification
     */
    public InMemoryStateStore(StateStoreConfig config, FileMetadataProvider files) {
        this(config, files, new StateValidator(), Clock.systemUTC());
    }

    /**
     * Full constructor.
     *
     * @param config store configuration
     * @param files file metadata provider used by consistency verification
     * @param validator state validator
     * @param clock clock for snapshot and transaction timestamps
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryStateStore(StateStoreConfig config, FileMetadataProvider files,
                              StateValidator validator, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (files == null) {
            throw new IllegalArgumentException("files cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.validator = validator;
        this.verifier = new ConsistencyVerifier(files, config.mtimeTolerance());
        this.clock = clock;
    }

    public StateStoreConfig config() {
        return config;
    }

    @Override
    public ProjectState getState() {
        lock.lock();
        try {
            return requireState().copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hasState() {
        lock.lock();
        try {
            return current != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Validation runs before anything is mutated</li>
     *   <li>The stored value is a copy; later changes to the argument's builder are not observed</li>
     *   <li>Allowed with or without an active transaction</li>
     * </ul>
     */
    @Override
    public void setState(ProjectState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        lock.lock();
        try {
            persist(state.copy(), SET_STATE);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> validateState(ProjectState state) {
        return validator.validate(state);
    }

    @Override
    public TransactionId beginTransaction(String operationName) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        lock.lock();
        try {
            if (active != null) {
                log.warn("Rejected transaction {}: {} ({}) is still active",
                    operationName, active.id(), active.operationName());
                throw new TransactionConflictException(active.id(), active.operationName());
            }

            Instant now = clock.instant();
            StateSnapshot preImage = current == null
                ? null
                : StateSnapshot.of(nextSequenceId++, now, PRE_IMAGE_PREFIX + operationName, current);

            active = StateTransaction.begin(TransactionId.generate(), operationName, preImage, now);
            log.debug("Transaction begun: {} ({})", active.id(), operationName);
            return active.id();
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>A store that is still uninitialized commits without appending a snapshot</li>
     *   <li>On validation failure nothing changes: the transaction stays active</li>
     * </ul>
     */
    @Override
    public void commitTransaction(TransactionId transactionId) {
        lock.lock();
        try {
            StateTransaction transaction = requireActive(transactionId);

            Long resultSequenceId = null;
            if (current != null) {
                List<String> violations = validator.validate(current);
                if (!violations.isEmpty()) {
                    log.warn("Commit of {} ({}) rejected: {}", transaction.id(), transaction.operationName(), violations);
                    throw new StateValidationException(violations);
                }
                resultSequenceId = appendSnapshot(COMMIT_PREFIX + transaction.operationName(), current).sequenceId();
            }

            recordResolved(transaction.commit(clock.instant(), resultSequenceId));
            log.info("Transaction committed: {} ({})", transaction.id(), transaction.operationName());
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The pre-image is restored as-is without re-validation</li>
     *   <li>An absent pre-image returns the store to the uninitialized condition</li>
     *   <li>Snapshots newer than the pre-image are discarded, so the latest snapshot matches the restored state</li>
     * </ul>
     */
    @Override
    public void rollbackTransaction(TransactionId transactionId, String error) {
        lock.lock();
        try {
            StateTransaction transaction = requireActive(transactionId);
            StateSnapshot preImage = transaction.preImage();
            if (preImage == null) {
                current = null;
                discardSnapshotsAfter(0);
            } else {
                current = preImage.state();
                discardSnapshotsAfter(preImage.sequenceId());
                StateSnapshot latest = snapshots.peekLast();
                if (latest == null || !latest.state().equals(current)) {
                    appendSnapshot(ROLLBACK_PREFIX + transaction.operationName(), current);
                }
            }

            recordResolved(transaction.rollback(clock.instant(), error));
            log.warn("Transaction rolled back: {} ({}){}", transaction.id(), transaction.operationName(),
                error == null ? "" : ": " + error);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StateTransaction> getActiveTransaction() {
        lock.lock();
        try {
            return Optional.ofNullable(active);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConsistencyReport verifyStateConsistency() {
        ProjectState state;
        lock.lock();
        try {
            state = requireState();
        } finally {
            lock.unlock();
        }
        return verifier.verify(state);
    }

    @Override
    public ConsistencyReport verifyStateConsistency(ProjectState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return verifier.verify(state);
    }

    @Override
    public void invalidateClassState(String className) {
        if (className == null) {
            throw new IllegalArgumentException("className cannot be null");
        }
        lock.lock();
        try {
            if (current == null) {
                log.debug("No state to invalidate class {} in", className);
                return;
            }
            ProjectState state = current;
            if (state.findClass(className).isEmpty()) {
                log.debug("Nothing to invalidate for class {}", className);
                return;
            }
            persist(state.toBuilder().removeClass(className).build(), INVALIDATE_PREFIX + className);
            log.info("Invalidated class state: {}", className);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public StateSnapshot getSnapshot(long sequenceId) {
        lock.lock();
        try {
            for (StateSnapshot snapshot : snapshots) {
                if (snapshot.sequenceId() == sequenceId) {
                    return snapshot.copy();
                }
            }
            throw new SnapshotNotFoundException(sequenceId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public StateSnapshot getLatestSnapshot() {
        lock.lock();
        try {
            StateSnapshot latest = snapshots.peekLast();
            if (latest == null) {
                throw SnapshotNotFoundException.emptyHistory();
            }
            return latest.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StateSnapshot> getSnapshotsSince(Instant since) {
        if (since == null) {
            throw new IllegalArgumentException("since cannot be null");
        }
        lock.lock();
        try {
            List<StateSnapshot> result = new ArrayList<>();
            for (StateSnapshot snapshot : snapshots) {
                if (!snapshot.timestamp().isBefore(since)) {
                    result.add(snapshot.copy());
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StateTransaction> getTransactionHistory(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        lock.lock();
        try {
            List<StateTransaction> result = new ArrayList<>(Math.min(limit, transactions.size()));
            for (StateTransaction transaction : transactions) {
                if (result.size() == limit) {
                    break;
                }
                result.add(transaction);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Sequence numbering continues after a clear, so ids handed out before remain unique.</p>
     */
    @Override
    public void clearState() {
        lock.lock();
        try {
            if (active != null) {
                log.warn("Dropping active transaction {} ({}) on clear", active.id(), active.operationName());
            }
            current = null;
            active = null;
            snapshots.clear();
            transactions.clear();
            log.debug("State store cleared");
        } finally {
            lock.unlock();
        }
    }

    // Callers hold the lock for everything below.

    private void persist(ProjectState next, String operation) {
        List<String> violations = validator.validate(next);
        if (!violations.isEmpty()) {
            log.warn("Rejected {}: {}", operation, violations);
            throw new StateValidationException(violations);
        }
        current = next;
        appendSnapshot(operation, next);
    }

    private StateSnapshot appendSnapshot(String operation, ProjectState state) {
        StateSnapshot snapshot = StateSnapshot.of(nextSequenceId++, clock.instant(), operation, state);
        snapshots.addLast(snapshot);
        while (snapshots.size() > config.maxSnapshots()) {
            StateSnapshot evicted = snapshots.removeFirst();
            log.debug("Evicted snapshot {} ({})", evicted.sequenceId(), evicted.operation());
        }
        return snapshot;
    }

    private void discardSnapshotsAfter(long sequenceId) {
        while (!snapshots.isEmpty() && snapshots.peekLast().sequenceId() > sequenceId) {
            StateSnapshot discarded = snapshots.removeLast();
            log.debug("Discarded snapshot {} ({})", discarded.sequenceId(), discarded.operation());
        }
    }

    private void recordResolved(StateTransaction transaction) {
        transactions.addFirst(transaction);
        while (transactions.size() > config.maxTransactions()) {
            transactions.removeLast();
        }
        active = null;
    }

    private ProjectState requireState() {
        if (current == null) {
            throw new NoStateException();
        }
        return current;
    }

    private StateTransaction requireActive(TransactionId transactionId) {
        if (transactionId == null) {
            throw new IllegalArgumentException("transactionId cannot be null");
        }
        if (active == null || !Objects.equals(active.id(), transactionId)) {
            throw new TransactionNotFoundException(transactionId);
        }
        return active;
    }
}
