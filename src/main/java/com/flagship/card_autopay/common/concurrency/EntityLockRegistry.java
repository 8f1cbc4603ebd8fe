package com.flagship.card_autopay.common.concurrency;

import com.flagship.card_autopay.common.exception.EntityBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer guard for cards, payments and schedules.
 *
 * Every (scope, id) pair gets its own {@link ReentrantLock}, so a slow holder only ever
 * delays writers of the same entity. A lock lives in the registry while some thread holds
 * or waits for it and is dropped when the last one leaves, which keeps memory bounded by
 * the number of entities in flight.
 *
 * Where two entity locks are nested, callers take them in one fixed order. Locks are taken
 * outside any database transaction, and each store write commits on its own. The optimistic
 * {@code version} column catches writers on other nodes.
 */
@Component
@Slf4j
public class EntityLockRegistry {

    private final Map<String, EntityLock> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public EntityLockRegistry(@Value("${autopay.locks.wait-timeout:PT30S}") Duration waitTimeout) {
        if (waitTimeout.isNegative()) {
            throw new IllegalArgumentException("Lock wait timeout must not be negative: " + waitTimeout);
        }
        this.waitTimeout = waitTimeout;
    }

    /**
     * Runs {@code action} while holding the lock for the given entity.
     *
     * @throws EntityBusyException if the lock is not acquired within the configured wait
     */
    public <T> T withLock(String scope, Object id, Supplier<T> action) {
        String key = scope + ":" + id;
        EntityLock entry = acquireEntry(key);
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for lock {}", key);
                throw new EntityBusyException(key);
            }
            if (!acquired) {
                log.warn("Timed out after {} waiting for lock {}", waitTimeout, key);
                throw new EntityBusyException(key);
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            releaseEntry(key);
        }
    }

    public void withLock(String scope, Object id, Runnable action) {
        withLock(scope, id, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Number of entities currently locked or waited on.
     */
    int activeLocks() {
        return locks.size();
    }

    private EntityLock acquireEntry(String key) {
        return locks.compute(key, (k, existing) -> {
            EntityLock entry = existing != null ? existing : new EntityLock();
            entry.users++;
            return entry;
        });
    }

    private void releaseEntry(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class EntityLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
