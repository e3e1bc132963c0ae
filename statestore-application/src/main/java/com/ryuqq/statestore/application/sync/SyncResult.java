package com.ryuqq.statestore.application.sync;

import com.ryuqq.statestore.core.consistency.ConsistencyReport;
import com.ryuqq.statestore.core.diff.DiffReport;

import java.util.Optional;

/**
 * 동기화 결과 (불변 record).
 *
 * @param reloaded 파일 시스템에서 상태를 다시 읽었으면 true
 * @param consistency 동기화 전 일관성 검증 결과 (검증하지 않았으면 null)
 * @param diff 이전 상태 대비 변경 내역 (이전 상태가 없었거나 다시 읽지 않았으면 null)
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public record SyncResult(boolean reloaded, ConsistencyReport consistency, DiffReport diff) {

    static SyncResult upToDate(ConsistencyReport consistency) {
        return new SyncResult(false, consistency, null);
    }

    public Optional<DiffReport> diffIfAny() {
        return Optional.ofNullable(diff);
    }
}
