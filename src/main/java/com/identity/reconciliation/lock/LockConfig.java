package com.identity.reconciliation.lock;

/**
 * Configuration for the {@link LockRegistry}.
 *
 * @param timeoutMs maximum time to wait for a single per-entity lock
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 10 minute timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(600_000);
    }
}
