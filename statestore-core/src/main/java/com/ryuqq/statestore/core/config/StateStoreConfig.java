package com.ryuqq.statestore.core.config;

import java.time.Duration;

/**
 * StateStore 설정 (불변 record).
 *
 * <p>StateStore 생성자에 전달되며, 전역 설정이나 환경 변수는 사용하지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxSnapshots: 스냅샷 이력 최대 개수 (기본 10, 초과 시 가장 오래된 것부터 제거)</li>
 *   <li>maxTransactions: 트랜잭션 이력 최대 개수 (기본 100)</li>
 *   <li>mtimeTolerance: 기록된 수정 시각과 실제 수정 시각의 허용 오차 (기본 0)</li>
 * </ul>
 *
 * @author StateStore Team
 * @since 1.0.0
 * @param maxSnapshots 스냅샷 이력 크기 (1 이상이어야 함)
 * @param maxTransactions 트랜잭션 이력 크기 (1 이상이어야 함)
 * @param mtimeTolerance 수정 시각 허용 오차 (음수 불가)
 */
public record StateStoreConfig(int maxSnapshots, int maxTransactions, Duration mtimeTolerance) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxSnapshots=10, maxTransactions=100, mtimeTolerance=0</p>
     */
    public StateStoreConfig() {
        this(10, 100, Duration.ZERO);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StateStoreConfig {
        if (maxSnapshots <= 0) {
            throw new IllegalArgumentException(
                "maxSnapshots must be positive (current: " + maxSnapshots + ")"
            );
        }
        if (maxTransactions <= 0) {
            throw new IllegalArgumentException(
                "maxTransactions must be positive (current: " + maxTransactions + ")"
            );
        }
        if (mtimeTolerance == null) {
            throw new IllegalArgumentException("mtimeTolerance cannot be null");
        }
        if (mtimeTolerance.isNegative()) {
            throw new IllegalArgumentException(
                "mtimeTolerance cannot be negative (current: " + mtimeTolerance + ")"
            );
        }
    }

    /**
     * maxSnapshots만 변경한 새 인스턴스 생성.
     *
     * @param maxSnapshots 새로운 스냅샷 이력 크기
     * @return 새 StateStoreConfig 인스턴스
     */
    public StateStoreConfig withMaxSnapshots(int maxSnapshots) {
        return new StateStoreConfig(maxSnapshots, this.maxTransactions, this.mtimeTolerance);
    }

    /**
     * maxTransactions만 변경한 새 인스턴스 생성.
     *
     * @param maxTransactions 새로운 트랜잭션 이력 크기
     * @return 새 StateStoreConfig 인스턴스
     */
    public StateStoreConfig withMaxTransactions(int maxTransactions) {
        return new StateStoreConfig(this.maxSnapshots, maxTransactions, this.mtimeTolerance);
    }

    /**
     * mtimeTolerance만 변경한 새 인스턴스 생성.
     *
     * @param mtimeTolerance 새로운 허용 오차
     * @return 새 StateStoreConfig 인스턴스
     */
    public StateStoreConfig withMtimeTolerance(Duration mtimeTolerance) {
        return new StateStoreConfig(this.maxSnapshots, this.maxTransactions, mtimeTolerance);
    }
}
