package com.ryuqq.statestore.core.consistency;

import java.util.List;

/**
 * 일관성 검증 결과.
 *
 * <p>{@code consistent()}는 불일치가 하나도 없을 때만 true입니다.</p>
 *
 * @param consistent 불일치가 없으면 true
 * @param issues 발견된 불일치 목록 (수정 불가)
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public record ConsistencyReport(boolean consistent, List<ConsistencyIssue> issues) {

    public ConsistencyReport {
        if (issues == null) {
            throw new IllegalArgumentException("issues cannot be null");
        }
        issues = List.copyOf(issues);
        if (consistent != issues.isEmpty()) {
            throw new IllegalArgumentException(
                "consistent must be true exactly when there are no issues (issues: " + issues.size() + ")");
        }
    }

    /**
     * 불일치 목록으로 결과 생성.
     *
     * @param issues 불일치 목록
     * @return ConsistencyReport 인스턴스
     */
    public static ConsistencyReport of(List<ConsistencyIssue> issues) {
        return new ConsistencyReport(issues.isEmpty(), issues);
    }

    /**
     * @return 불일치 설명 문자열 목록
     */
    public List<String> messages() {
        return issues.stream().map(ConsistencyIssue::message).toList();
    }

    /**
     * 특정 유형의 불일치만 조회.
     *
     * @param type 불일치 유형
     * @return 해당 유형의 불일치 목록
     */
    public List<ConsistencyIssue> issuesOf(ConsistencyIssue.Type type) {
        return issues.stream().filter(issue -> issue.type() == type).toList();
    }
}
