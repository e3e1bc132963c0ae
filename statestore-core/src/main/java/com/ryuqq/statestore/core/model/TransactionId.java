package com.ryuqq.statestore.core.model;

import java.util.UUID;

/**
 * 트랜잭션의 고유 식별자.
 *
 * <p>StateStore 인스턴스 내에서 트랜잭션을 구분하는 데 사용되며,
 * commit/rollback 호출 시 활성 트랜잭션과 일치하는지 확인하는 키로 활용됩니다.</p>
 *
 * <p>값은 StateStore가 {@link #generate()}로 만들며 형식에 의미를 두지 않습니다.
 * null 또는 빈 문자열만 거부합니다.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public final class TransactionId {

    private final String value;

    private TransactionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TransactionId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 기존 값으로 TransactionId 복원 (예: 로그나 {@link #getValue()}로 보관한 값).
     *
     * @param value TransactionId 값
     * @return TransactionId 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static TransactionId of(String value) {
        return new TransactionId(value);
    }

    /**
     * 무작위 UUID 기반 TransactionId 생성.
     *
     * @return 새 TransactionId 인스턴스
     */
    public static TransactionId generate() {
        return new TransactionId(UUID.randomUUID().toString());
    }

    /**
     * TransactionId 값 조회.
     *
     * @return TransactionId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransactionId that = (TransactionId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TransactionId{" + value + '}';
    }
}
