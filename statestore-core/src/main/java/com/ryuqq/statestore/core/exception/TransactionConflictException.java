package com.ryuqq.statestore.core.exception;

import com.ryuqq.statestore.core.model.TransactionId;

/**
 * Raised when a transaction is begun while another one is still active.
 *
 * <p>Not retried by the store. Concurrent callers must coordinate before beginning a transaction.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class TransactionConflictException extends StateStoreException {

    private final TransactionId activeTransactionId;
    private final String activeOperationName;

    public TransactionConflictException(TransactionId activeTransactionId, String activeOperationName) {
        super(String.format("Transaction already active: %s (%s)", activeTransactionId, activeOperationName));
        this.activeTransactionId = activeTransactionId;
        this.activeOperationName = activeOperationName;
    }

    public TransactionId activeTransactionId() {
        return activeTransactionId;
    }

    public String activeOperationName() {
        return activeOperationName;
    }
}
