package com.ryuqq.statestore.core.exception;

/**
 * Base type of every error raised by a {@link com.ryuqq.statestore.core.spi.StateStore}.
 *
 * <p>All store errors are synchronous and unchecked. They are never logged-and-ignored
 * by the store itself.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
