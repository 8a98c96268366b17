package com.example.shadowbrook.global.concurrency;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

/**
 * 단일 JVM 기반 세션 락 전략.
 * 게임 ID별로 공정(fair) ReentrantLock 을 하나씩 두고, 도착 순서대로 작업을 직렬화합니다.
 */
@Component
public class SessionLockStrategy implements LockStrategy {

    // lockKey별로 별도의 락 객체를 관리 (같은 키에 대해서만 동기화)
    private final Map<String, ReentrantLock> lockMap = new ConcurrentHashMap<>();

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> action) {
        ReentrantLock lock = lockMap.computeIfAbsent(lockKey, k -> new ReentrantLock(true));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(String lockKey) {
        lockMap.remove(lockKey);
    }
}
