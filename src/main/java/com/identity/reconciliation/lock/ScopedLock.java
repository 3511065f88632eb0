package com.identity.reconciliation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the identity-id lock and the merged-identifier lock of one row.
 * Both are released in reverse acquisition order on {@link #close()}.
 */
public final class ScopedLock implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScopedLock.class);

    private final String identityId;
    private final String uuid;
    private final ReentrantLock identityLock;
    private final ReentrantLock uuidLock;
    private boolean released = false;

    ScopedLock(String identityId, String uuid, ReentrantLock identityLock, ReentrantLock uuidLock) {
        this.identityId = identityId;
        this.uuid = uuid;
        this.identityLock = identityLock;
        this.uuidLock = uuidLock;
    }

    public String identityId() {
        return identityId;
    }

    public String uuid() {
        return uuid;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            uuidLock.unlock();
        } finally {
            identityLock.unlock();
        }
        log.debug("Locks released: identity {} uuid {}", identityId, uuid);
    }
}
