package com.ryuqq.statestore.core.exception;

import com.ryuqq.statestore.core.model.TransactionId;

/**
 * Raised when commit or rollback names a transaction that is not the active one.
 *
 * <p>Either the transaction was already resolved or it never existed. Callers treat this as a programming error.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class TransactionNotFoundException extends StateStoreException {

    private final TransactionId transactionId;

    public TransactionNotFoundException(TransactionId transactionId) {
        super("No active transaction with id: " + transactionId);
        this.transactionId = transactionId;
    }

    public TransactionId transactionId() {
        return transactionId;
    }
}
