package com.ryuqq.statestore.core.diff;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 두 상태 간 변경 하나.
 *
 * @param type 변경 유형
 * @param component 변경 위치
 * @param identifier 식별자 (예: {@code Foo}, {@code Foo.methods}, {@code build_status})
 * @param oldValue 이전 값 (ADDED이면 null)
 * @param newValue 새 값 (REMOVED이면 null)
 * @param details 사람이 읽을 수 있는 설명
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public record DiffChange(
    ChangeType type,
    DiffComponent component,
    String identifier,
    JsonNode oldValue,
    JsonNode newValue,
    String details
) {

    public DiffChange {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (component == null) {
            throw new IllegalArgumentException("component cannot be null");
        }
        if (identifier == null) {
            throw new IllegalArgumentException("identifier cannot be null");
        }
    }
}
