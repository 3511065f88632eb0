package com.identity.reconciliation.reconcile;

import com.identity.reconciliation.cache.CacheConfig;
import com.identity.reconciliation.config.ReconcilerConfig;
import com.identity.reconciliation.lock.LockConfig;

/**
 * Options for a reconciliation run.
 * Configures the worker count, dry-run and trace modes, and lock and cache settings.
 */
public class ReconcileOptions {

    private final int threads;
    private final boolean dryRun;
    private final boolean debug;
    private final boolean debugSql;
    private final LockConfig lockConfig;
    private final CacheConfig cacheConfig;

    private ReconcileOptions(Builder builder) {
        this.threads = builder.threads;
        this.dryRun = builder.dryRun;
        this.debug = builder.debug;
        this.debugSql = builder.debugSql;
        this.lockConfig = builder.lockConfig;
        this.cacheConfig = builder.cacheConfig;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isDebug() {
        return debug;
    }

    public boolean isDebugSql() {
        return debugSql;
    }

    public LockConfig getLockConfig() {
        return lockConfig;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Creates default options: one worker per available processor, writes enabled, no tracing.
     */
    public static ReconcileOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options from the process configuration.
     */
    public static ReconcileOptions from(ReconcilerConfig config) {
        return builder()
                .threads(config.threads())
                .dryRun(config.dryRun())
                .debug(config.debug())
                .debugSql(config.debugSql())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int threads = Runtime.getRuntime().availableProcessors();
        private boolean dryRun = false;
        private boolean debug = false;
        private boolean debugSql = false;
        private LockConfig lockConfig = LockConfig.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder threads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("threads must be positive");
            }
            this.threads = threads;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder debugSql(boolean debugSql) {
            this.debugSql = debugSql;
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public ReconcileOptions build() {
            if (lockConfig == null) {
                throw new IllegalArgumentException("lockConfig is required");
            }
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig is required");
            }
            return new ReconcileOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ReconcileOptions{threads=" + threads +
                ", dryRun=" + dryRun +
                ", debug=" + debug +
                ", debugSql=" + debugSql + '}';
    }
}
