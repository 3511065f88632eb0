package com.identity.reconciliation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily created per-entity locks serializing read-modify-write sequences on one identity
 * id or one merged identifier.
 *
 * <p>Lock objects are registered with an atomic insert-if-absent; waiting for a lock happens
 * outside that step, so creating the lock for one key never waits on another key's holder.
 * Every caller acquires the identity-id lock before the merged-identifier lock, which keeps
 * rows touching overlapping keys from forming a wait cycle.</p>
 */
public class LockRegistry {
    private static final Logger log = LoggerFactory.getLogger(LockRegistry.class);

    private final ConcurrentHashMap<String, ReentrantLock> identityLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> uuidLocks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LockRegistry() {
        this(LockConfig.defaults());
    }

    public LockRegistry(LockConfig config) {
        this.config = config;
    }

    /**
     * Acquires the identity-id lock and then the merged-identifier lock.
     *
     * @param identityId identity primary id
     * @param uuid       merged identifier of that identity
     * @return a scoped lock releasing both on close
     * @throws LockAcquisitionException if either lock is not acquired within the timeout
     */
    public ScopedLock acquire(String identityId, String uuid) {
        ReentrantLock identityLock = register(identityLocks, identityId, "identity");
        lock(identityLock, "identity:" + identityId);
        try {
            ReentrantLock uuidLock = register(uuidLocks, uuid, "uuid");
            lock(uuidLock, "uuid:" + uuid);
            return new ScopedLock(identityId, uuid, identityLock, uuidLock);
        } catch (RuntimeException e) {
            identityLock.unlock();
            throw e;
        }
    }

    /**
     * Discards all registered lock objects. Only called while no row is in flight.
     */
    public void reset() {
        log.debug("Resetting lock registry: {} identity locks, {} uuid locks",
                identityLocks.size(), uuidLocks.size());
        identityLocks.clear();
        uuidLocks.clear();
    }

    /**
     * Number of registered lock objects across both key spaces.
     */
    public int size() {
        return identityLocks.size() + uuidLocks.size();
    }

    private ReentrantLock register(ConcurrentHashMap<String, ReentrantLock> locks, String key, String space) {
        ReentrantLock existing = locks.get(key);
        if (existing != null) {
            log.debug("Duplicate {} {} in flight", space, key);
            return existing;
        }
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    private void lock(ReentrantLock lock, String key) {
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.debug("Lock acquired: {}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }
}
