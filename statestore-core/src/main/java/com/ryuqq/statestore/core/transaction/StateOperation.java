package com.ryuqq.statestore.core.transaction;

/**
 * 트랜잭션 안에서 실행되는 작업.
 *
 * <p>작업은 보통 {@code getState}/{@code setState}를 호출하고 결과를 반환합니다.
 * 던진 예외는 감싸지지 않고 그대로 호출자에게 전달됩니다.</p>
 *
 * @param <T> 결과 타입
 * @param <E> 작업이 던질 수 있는 예외 타입
 *
 * @author StateStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateOperation<T, E extends Exception> {

    /**
     * 작업 실행.
     *
     * @return 작업 결과
     * @throws E 작업 실패 시
     */
    T run() throws E;
}
