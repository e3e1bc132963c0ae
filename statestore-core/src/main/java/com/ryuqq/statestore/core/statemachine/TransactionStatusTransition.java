package com.ryuqq.statestore.core.statemachine;

/**
 * 트랜잭션 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>ACTIVE → COMMITTED</li>
 *   <li>ACTIVE → ROLLED_BACK</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 트랜잭션은 정확히 한 번 종료됩니다.
 * 종료 상태(COMMITTED, ROLLED_BACK)에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public final class TransactionStatusTransition {

    // Utility class - prevent instantiation
    private TransactionStatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TransactionStatus from, TransactionStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        // ACTIVE에서는 종료 상태로만 전이 가능
        if (!to.isTerminal()) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static TransactionStatus transition(TransactionStatus current, TransactionStatus next) {
        validate(current, next);
        return next;
    }
}
