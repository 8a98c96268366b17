package com.example.shadowbrook.global.concurrency;

import java.util.function.Supplier;

/**
 * 세션 단위 동시성 제어 전략.
 * 같은 키에 대한 작업은 하나씩 실행되고, 다른 키의 작업은 병렬로 실행됩니다.
 */
public interface LockStrategy {

    /**
     * 락을 획득하고 비즈니스 로직을 실행
     *
     * @param lockKey 락을 식별하는 키 (게임 ID)
     * @param action  락 보호 하에 실행할 로직
     * @return 로직 실행 결과
     */
    <T> T executeWithLock(String lockKey, Supplier<T> action);

    /**
     * 더 이상 쓰지 않는 키의 락 자원을 해제합니다.
     */
    default void release(String lockKey) {
    }
}
