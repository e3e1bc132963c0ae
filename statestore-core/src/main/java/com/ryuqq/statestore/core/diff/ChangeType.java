package com.ryuqq.statestore.core.diff;

/**
 * 변경 유형.
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public enum ChangeType {

    ADDED,

    REMOVED,

    MODIFIED
}
