package com.ryuqq.statestore.core.exception;

/**
 * Raised when state is read before any state has been set.
 *
 * <p>Callers should treat this as "project not yet analyzed".</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class NoStateException extends StateStoreException {

    public NoStateException() {
        super("No project state has been set");
    }
}
