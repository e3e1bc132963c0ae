package com.ryuqq.statestore.core.exception;

/**
 * Raised when a snapshot is requested that was evicted, never existed, or when history is empty.
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class SnapshotNotFoundException extends StateStoreException {

    private final Long sequenceId;

    public SnapshotNotFoundException(long sequenceId) {
        super("Snapshot not found (evicted or out of range): " + sequenceId);
        this.sequenceId = sequenceId;
    }

    private SnapshotNotFoundException(String message) {
        super(message);
        this.sequenceId = null;
    }

    /**
     * @return exception for a lookup against an empty history
     */
    public static SnapshotNotFoundException emptyHistory() {
        return new SnapshotNotFoundException("Snapshot history is empty");
    }

    /**
     * @return requested sequence id, or null when the latest snapshot was requested
     */
    public Long sequenceId() {
        return sequenceId;
    }
}
