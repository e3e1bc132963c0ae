package com.ryuqq.statestore.core.spi;

import com.ryuqq.statestore.core.diff.DiffReport;
import com.ryuqq.statestore.core.model.ClassRecord;
import com.ryuqq.statestore.core.model.ProjectState;
import com.ryuqq.statestore.core.model.StateSnapshot;
import com.ryuqq.statestore.core.model.TransactionId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * StateStore default 메서드 테스트.
 *
 * <p>구현체와 무관하게 default 메서드가 추상 메서드를 올바르게 조합하는지 검증합니다.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
class StateStoreDefaultMethodsTest {

    private static final TransactionId TX = TransactionId.of("tx-1");

    private StateStore store;

    @BeforeEach
    void setUp() {
        store = mock(StateStore.class, CALLS_REAL_METHODS);
        doReturn(TX).when(store).beginTransaction("analyze");
    }

    @Test
    void executeWithRollback_Success_CommitsAndReturnsResult() throws Exception {
        // When
        String result = store.executeWithRollback("analyze", () -> "done");

        // Then
        assertEquals("done", result);
        verify(store).commitTransaction(TX);
        verify(store, never()).rollbackTransaction(any(), any());
    }

    @Test
    void executeWithRollback_CheckedFailure_RollsBackAndRethrowsSameInstance() {
        // Given
        IOException failure = new IOException("disk");
        List<Exception> seen = new ArrayList<>();

        // When
        IOException thrown = assertThrows(IOException.class,
            () -> store.executeWithRollback("analyze", () -> {
                throw failure;
            }, seen::add));

        // Then
        assertSame(failure, thrown);
        assertEquals(List.of(failure), seen);
        verify(store).rollbackTransaction(TX, failure.toString());
        verify(store, never()).commitTransaction(TX);
    }

    @Test
    void executeWithRollback_RollbackFailure_AddedAsSuppressed() {
        // Given
        IllegalStateException failure = new IllegalStateException("operation");
        IllegalStateException rollbackFailure = new IllegalStateException("rollback");
        doThrow(rollbackFailure).when(store).rollbackTransaction(TX, failure.toString());

        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> store.executeWithRollback("analyze", () -> {
                throw failure;
            }));

        // Then
        assertSame(failure, thrown);
        assertSame(rollbackFailure, thrown.getSuppressed()[0]);
    }

    @Test
    void rollbackTransaction_WithoutError_DelegatesWithNull() {
        // When
        store.rollbackTransaction(TX);

        // Then
        verify(store).rollbackTransaction(TX, null);
    }

    @Test
    void diffAgainstSnapshot_ComparesSnapshotWithCurrentState() {
        // Given
        ProjectState old = ProjectState.of("/work/demo", "demo");
        ProjectState current = old.toBuilder().addClass(ClassRecord.of("Foo", null, null)).build();
        doReturn(StateSnapshot.of(4, Instant.EPOCH, "set_state", old)).when(store).getSnapshot(4);
        doReturn(current).when(store).getState();

        // When
        DiffReport report = store.diffAgainstSnapshot(4);

        // Then
        assertEquals(1, report.changes().size());
        assertEquals("Foo", report.changes().get(0).identifier());
    }
}
