package com.ryuqq.statestore.core.model;

import java.time.Instant;

/**
 * 특정 시점의 ProjectState 스냅샷 (불변 record).
 *
 * <p>setState, 트랜잭션 commit, 클래스 무효화가 성공할 때마다 생성되어
 * 크기가 제한된 이력(FIFO)에 보관됩니다. 트랜잭션 시작 시 캡처되는 pre-image도
 * 스냅샷으로 표현되지만 이력에는 추가되지 않습니다.</p>
 *
 * <p><strong>sequenceId:</strong> StateStore 인스턴스 내에서 단조 증가하며 재사용되지 않습니다.</p>
 *
 * @param sequenceId 단조 증가 일련번호 (1 이상)
 * @param timestamp 생성 시각
 * @param operation 스냅샷을 만든 작업 이름 (예: set_state, commit:analyze)
 * @param state 상태 값
 * @param checksum 정규화 JSON의 SHA-256 체크섬
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public record StateSnapshot(
    long sequenceId,
    Instant timestamp,
    String operation,
    ProjectState state,
    String checksum
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 sequenceId가 양수가 아닌 경우
     */
    public StateSnapshot {
        if (sequenceId <= 0) {
            throw new IllegalArgumentException("sequenceId must be positive (current: " + sequenceId + ")");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (checksum == null || checksum.isBlank()) {
            throw new IllegalArgumentException("checksum cannot be null or blank");
        }
    }

    /**
     * 체크섬을 계산하여 스냅샷 생성.
     *
     * @param sequenceId 일련번호
     * @param timestamp 생성 시각
     * @param operation 작업 이름
     * @param state 상태 값
     * @return StateSnapshot 인스턴스
     */
    public static StateSnapshot of(long sequenceId, Instant timestamp, String operation, ProjectState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return new StateSnapshot(sequenceId, timestamp, operation, state, StateJson.checksum(state));
    }

    /**
     * 상태 값이 독립 복사된 스냅샷 생성.
     *
     * @return 복사본
     */
    public StateSnapshot copy() {
        return new StateSnapshot(sequenceId, timestamp, operation, state.copy(), checksum);
    }
}
