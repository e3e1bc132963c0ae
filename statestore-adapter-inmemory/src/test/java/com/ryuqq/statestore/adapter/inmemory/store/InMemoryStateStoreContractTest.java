package com.ryuqq.statestore.adapter.inmemory.store;

import com.ryuqq.statestore.core.config.StateStoreConfig;
import com.ryuqq.statestore.core.spi.FileMetadataProvider;
import com.ryuqq.statestore.core.spi.StateStore;
import com.ryuqq.statestore.testkit.contract.ConcurrencyContractTest;
import com.ryuqq.statestore.testkit.contract.ConsistencyContractTest;
import com.ryuqq.statestore.testkit.contract.ExecuteWithRollbackContractTest;
import com.ryuqq.statestore.testkit.contract.SnapshotHistoryContractTest;
import com.ryuqq.statestore.testkit.contract.StateRoundTripContractTest;
import com.ryuqq.statestore.testkit.contract.TransactionContractTest;
import org.junit.jupiter.api.Nested;

/**
 * Contract Tests for InMemoryStateStore implementation.
 *
 * <p>Runs every testkit contract against {@link InMemoryStateStore}.</p>
 *
 * <p><strong>Test Coverage:</strong></p>
 * <ul>
 *   <li>State round trip ({@link StateRoundTripContractTest})</li>
 *   <li>Transactions ({@link TransactionContractTest})</li>
 *   <li>executeWithRollback ({@link ExecuteWithRollbackContractTest})</li>
 *   <li>Snapshot history ({@link SnapshotHistoryContractTest})</li>
 *   <li>Filesystem consistency ({@link ConsistencyContractTest})</li>
 *   <li>Concurrency ({@link ConcurrencyContractTest})</li>
 * </ul>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
class InMemoryStateStoreContractTest {

    private static StateStore newStore(StateStoreConfig config, FileMetadataProvider files) {
        return new InMemoryStateStore(config, files);
    }

    @Nested
    class RoundTrip extends StateRoundTripContractTest {
        @Override
        protected StateStore createStore(StateStoreConfig config, FileMetadataProvider files) {
            return newStore(config, files);
        }
    }

    @Nested
    class Transactions extends TransactionContractTest {
        @Override
        protected StateStore createStore(StateStoreConfig config, FileMetadataProvider files) {
            return newStore(config, files);
        }
    }

    @Nested
    class ExecuteWithRollback extends ExecuteWithRollbackContractTest {
        @Override
        protected StateStore createStore(StateStoreConfig config, FileMetadataProvider files) {
            return newStore(config, files);
        }
    }

    @Nested
    class SnapshotHistory extends SnapshotHistoryContractTest {
        @Override
        protected StateStore createStore(StateStoreConfig config, FileMetadataProvider files) {
            return newStore(config, files);
        }
    }

    @Nested
    class Consistency extends ConsistencyContractTest {
        @Override
        protected StateStore createStore(StateStoreConfig config, FileMetadataProvider files) {
            return newStore(config, files);
        }
    }

    @Nested
    class Concurrency extends ConcurrencyContractTest {
        @Override
        protected StateStore createStore(StateStoreConfig config, FileMetadataProvider files) {
            return newStore(config, files);
        }
    }
}
