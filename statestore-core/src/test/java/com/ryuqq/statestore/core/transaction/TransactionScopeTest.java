package com.ryuqq.statestore.core.transaction;

import com.ryuqq.statestore.core.exception.StateValidationException;
import com.ryuqq.statestore.core.model.TransactionId;
import com.ryuqq.statestore.core.spi.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * TransactionScope 테스트.
 *
 * @author StateStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TransactionScopeTest {

    private static final TransactionId TX = TransactionId.of("tx-1");

    @Mock
    private StateStore store;

    @BeforeEach
    void setUp() {
        lenient().when(store.beginTransaction("analyze")).thenReturn(TX);
    }

    @Test
    void commit_ThenClose_DoesNotRollback() {
        // When
        try (TransactionScope scope = TransactionScope.begin(store, "analyze")) {
            assertEquals(TX, scope.transactionId());
            scope.commit();
            assertTrue(scope.isResolved());
        }

        // Then
        verify(store).commitTransaction(TX);
        verify(store, never()).rollbackTransaction(any(), any());
    }

    @Test
    void close_WithoutCommit_RollsBack() {
        // When
        try (TransactionScope scope = TransactionScope.begin(store, "analyze")) {
            assertFalse(scope.isResolved());
        }

        // Then
        verify(store).rollbackTransaction(TX, TransactionScope.CLOSED_WITHOUT_COMMIT);
    }

    @Test
    void rollback_PassesErrorAndResolves() {
        // Given
        TransactionScope scope = TransactionScope.begin(store, "analyze");

        // When
        scope.rollback("boom");
        scope.close();

        // Then
        verify(store).rollbackTransaction(TX, "boom");
        verify(store, never()).rollbackTransaction(TX, TransactionScope.CLOSED_WITHOUT_COMMIT);
    }

    @Test
    void resolveTwice_ThrowsIllegalState() {
        // Given
        TransactionScope scope = TransactionScope.begin(store, "analyze");
        scope.commit();

        // Then
        assertThrows(IllegalStateException.class, scope::commit);
        assertThrows(IllegalStateException.class, () -> scope.rollback("late"));
    }

    @Test
    void commitFailure_LeavesScopeArmedForRollback() {
        // Given
        doThrow(new StateValidationException(List.of("invalid"))).when(store).commitTransaction(TX);
        TransactionScope scope = TransactionScope.begin(store, "analyze");

        // When
        assertThrows(StateValidationException.class, scope::commit);
        assertFalse(scope.isResolved());
        scope.close();

        // Then
        verify(store).rollbackTransaction(TX, TransactionScope.CLOSED_WITHOUT_COMMIT);
    }

    @Test
    void begin_NullStore_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> TransactionScope.begin(null, "analyze"));
        verify(store, never()).beginTransaction(anyString());
    }
}
