package com.ryuqq.statestore.core.statemachine;

/**
 * 트랜잭션의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>ACTIVE → COMMITTED (확정)</li>
 *   <li>ACTIVE → ROLLED_BACK (되돌림)</li>
 *   <li><strong>종료 상태에서의 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * ACTIVE
 *    │
 *    ├─► COMMITTED (commitTransaction)
 *    │
 *    └─► ROLLED_BACK (rollbackTransaction)
 *
 * 금지된 전이:
 * - COMMITTED → ACTIVE ❌
 * - ROLLED_BACK → ACTIVE ❌
 * - COMMITTED ↔ ROLLED_BACK ❌
 * </pre>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public enum TransactionStatus {

    /**
     * 진행 중.
     */
    ACTIVE,

    /**
     * 확정됨.
     */
    COMMITTED,

    /**
     * 시작 시점 상태로 되돌려짐.
     */
    ROLLED_BACK;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMMITTED 또는 ROLLED_BACK인 경우 true
     */
    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK;
    }
}
