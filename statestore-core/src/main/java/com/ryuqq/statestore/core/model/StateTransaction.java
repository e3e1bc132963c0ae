package com.ryuqq.statestore.core.model;

import com.ryuqq.statestore.core.statemachine.TransactionStatus;
import com.ryuqq.statestore.core.statemachine.TransactionStatusTransition;

import java.time.Instant;

/**
 * 진행 중이거나 종료된 논리 작업 하나 (불변 record).
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * begin()    → ACTIVE
 * commit()   → COMMITTED   (resultSequenceId = commit 시 추가된 스냅샷 번호)
 * rollback() → ROLLED_BACK (error = 롤백 원인, 선택)
 * </pre>
 *
 * <p>상태 변경은 새 인스턴스를 반환하며, 허용되지 않은 전이는
 * {@link TransactionStatusTransition}이 거부합니다.</p>
 *
 * @param id 트랜잭션 ID
 * @param operationName 작업 이름
 * @param preImage 시작 시점 상태의 스냅샷 (StateStore가 비어 있었으면 null)
 * @param status 현재 상태
 * @param startedAt 시작 시각
 * @param endedAt 종료 시각 (ACTIVE이면 null)
 * @param resultSequenceId commit으로 생성된 스냅샷 번호 (없으면 null)
 * @param error 롤백 원인 메시지 (없으면 null)
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public record StateTransaction(
    TransactionId id,
    String operationName,
    StateSnapshot preImage,
    TransactionStatus status,
    Instant startedAt,
    Instant endedAt,
    Long resultSequenceId,
    String error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없는 경우
     */
    public StateTransaction {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        if (status.isTerminal() && endedAt == null) {
            throw new IllegalArgumentException("endedAt cannot be null for terminal status: " + status);
        }
    }

    /**
     * ACTIVE 트랜잭션 생성.
     *
     * @param id 트랜잭션 ID
     * @param operationName 작업 이름
     * @param preImage 시작 시점 스냅샷 (null 허용)
     * @param startedAt 시작 시각
     * @return ACTIVE 상태의 StateTransaction
     */
    public static StateTransaction begin(TransactionId id, String operationName,
                                         StateSnapshot preImage, Instant startedAt) {
        return new StateTransaction(id, operationName, preImage, TransactionStatus.ACTIVE,
            startedAt, null, null, null);
    }

    /**
     * COMMITTED 상태로 전이.
     *
     * @param endedAt 종료 시각
     * @param resultSequenceId commit으로 생성된 스냅샷 번호 (null 허용)
     * @return 새 StateTransaction
     * @throws IllegalStateException ACTIVE가 아닌 경우
     */
    public StateTransaction commit(Instant endedAt, Long resultSequenceId) {
        TransactionStatus next = TransactionStatusTransition.transition(status, TransactionStatus.COMMITTED);
        return new StateTransaction(id, operationName, preImage, next, startedAt, endedAt, resultSequenceId, null);
    }

    /**
     * ROLLED_BACK 상태로 전이.
     *
     * @param endedAt 종료 시각
     * @param error 롤백 원인 (null 허용)
     * @return 새 StateTransaction
     * @throws IllegalStateException ACTIVE가 아닌 경우
     */
    public StateTransaction rollback(Instant endedAt, String error) {
        TransactionStatus next = TransactionStatusTransition.transition(status, TransactionStatus.ROLLED_BACK);
        return new StateTransaction(id, operationName, preImage, next, startedAt, endedAt, null, error);
    }

    public boolean isActive() {
        return status == TransactionStatus.ACTIVE;
    }
}
