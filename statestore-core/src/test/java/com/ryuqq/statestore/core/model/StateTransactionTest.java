package com.ryuqq.statestore.core.model;

import com.ryuqq.statestore.core.statemachine.TransactionStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransaction / StateSnapshot record 테스트.
 *
 * @author StateStore Team
 * @since 1.0.0
 */
class StateTransactionTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(5);

    @Test
    void begin_IsActiveWithoutEndTime() {
        StateTransaction tx = StateTransaction.begin(TransactionId.of("tx-1"), "analyze", null, T0);

        assertTrue(tx.isActive());
        assertEquals(TransactionStatus.ACTIVE, tx.status());
        assertNull(tx.endedAt());
        assertNull(tx.preImage());
    }

    @Test
    void commit_RecordsResultSequenceId() {
        StateTransaction tx = StateTransaction.begin(TransactionId.of("tx-1"), "analyze", null, T0);

        StateTransaction committed = tx.commit(T1, 7L);

        assertEquals(TransactionStatus.COMMITTED, committed.status());
        assertEquals(T1, committed.endedAt());
        assertEquals(7L, committed.resultSequenceId());
        assertFalse(committed.isActive());
        assertTrue(tx.isActive(), "Original instance is unchanged");
    }

    @Test
    void rollback_RecordsError() {
        StateTransaction tx = StateTransaction.begin(TransactionId.of("tx-1"), "analyze", null, T0);

        StateTransaction rolledBack = tx.rollback(T1, "boom");

        assertEquals(TransactionStatus.ROLLED_BACK, rolledBack.status());
        assertEquals("boom", rolledBack.error());
        assertNull(rolledBack.resultSequenceId());
    }

    @Test
    void resolvedTransaction_CannotTransitionAgain() {
        StateTransaction committed = StateTransaction.begin(TransactionId.of("tx-1"), "analyze", null, T0)
            .commit(T1, null);

        assertThrows(IllegalStateException.class, () -> committed.rollback(T1, null));
        assertThrows(IllegalStateException.class, () -> committed.commit(T1, null));
    }

    @Test
    void constructor_ValidatesRequiredFields() {
        TransactionId id = TransactionId.of("tx-1");

        assertThrows(IllegalArgumentException.class, () -> StateTransaction.begin(null, "op", null, T0));
        assertThrows(IllegalArgumentException.class, () -> StateTransaction.begin(id, " ", null, T0));
        assertThrows(IllegalArgumentException.class, () -> StateTransaction.begin(id, "op", null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new StateTransaction(id, "op", null, TransactionStatus.COMMITTED, T0, null, null, null));
    }

    @Test
    void snapshot_Of_ComputesChecksum() {
        ProjectState state = ProjectState.of("/work/demo", "demo");

        StateSnapshot snapshot = StateSnapshot.of(1, T0, "set_state", state);

        assertEquals(StateJson.checksum(state), snapshot.checksum());
        assertEquals(snapshot, snapshot.copy());
        assertNotSame(snapshot.state(), snapshot.copy().state());
    }

    @Test
    void snapshot_RejectsInvalidFields() {
        ProjectState state = ProjectState.of("/work/demo", "demo");

        assertThrows(IllegalArgumentException.class, () -> StateSnapshot.of(0, T0, "set_state", state));
        assertThrows(IllegalArgumentException.class, () -> StateSnapshot.of(1, null, "set_state", state));
        assertThrows(IllegalArgumentException.class, () -> StateSnapshot.of(1, T0, "", state));
        assertThrows(IllegalArgumentException.class, () -> StateSnapshot.of(1, T0, "set_state", null));
    }
}
