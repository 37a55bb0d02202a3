package com.wheelskills.progress.tracking;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per live attempt id. Writers of the same attempt run one at a time; different
 * attempts never contend.
 */
@Component
public class AttemptLocks {
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String attemptId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(attemptId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Drops the lock of an attempt that can no longer be written to. */
    public void release(String attemptId) {
        locks.remove(attemptId);
    }
}
