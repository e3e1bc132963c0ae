package com.ryuqq.statestore.core.exception;

import java.util.List;

/**
 * Raised when a state fails shape validation on {@code setState} or {@code commitTransaction}.
 *
 * <p>The live state is left unchanged when this is thrown.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class StateValidationException extends StateStoreException {

    private final List<String> violations;

    /**
     * @param violations human-readable violations (must not be empty)
     * @throws IllegalArgumentException if violations is null or empty
     */
    public StateValidationException(List<String> violations) {
        super(message(violations));
        this.violations = List.copyOf(violations);
    }

    private static String message(List<String> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations cannot be null or empty");
        }
        return "State validation failed: " + String.join("; ", violations);
    }

    /**
     * @return immutable list of violations
     */
    public List<String> violations() {
        return violations;
    }
}
