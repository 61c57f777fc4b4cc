package com.questrail.lantern.internal.concurrent;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * KeyedLocks
 * -----------------------------------------------------------------------------
 * One {@link ReentrantLock} per key, created on first use.
 *
 * <p>Used to serialize read-modify-write sequences against a single station
 * or a single session owner while letting unrelated keys proceed in parallel.
 * Locks are never evicted; the key space (stations, players) is small and
 * bounded by the game.</p>
 */
public final class KeyedLocks<K> {

    private final Map<K, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(action, "action");

        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return locks.size();
    }
}
