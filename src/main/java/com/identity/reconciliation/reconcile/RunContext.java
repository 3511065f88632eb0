package com.identity.reconciliation.reconcile;

import com.identity.reconciliation.cache.LookupCache;
import com.identity.reconciliation.lock.LockRegistry;
import com.identity.reconciliation.metrics.MetricsService;
import com.identity.reconciliation.metrics.NoOpMetricsService;
import com.identity.reconciliation.store.SqlExecutor;

import java.util.Objects;

/**
 * Everything one run shares between its reconciler calls: the store, the lookup cache,
 * the lock registry and the aggregates. Created per run and passed to every call.
 */
public class RunContext {

    private final SqlExecutor store;
    private final LookupCache lookupCache;
    private final LockRegistry lockRegistry;
    private final RunStatistics statistics;
    private final ReconcileOptions options;
    private final MetricsService metricsService;

    public RunContext(SqlExecutor store, LookupCache lookupCache, LockRegistry lockRegistry,
                      RunStatistics statistics, ReconcileOptions options, MetricsService metricsService) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.lookupCache = Objects.requireNonNull(lookupCache, "lookupCache is required");
        this.lockRegistry = Objects.requireNonNull(lockRegistry, "lockRegistry is required");
        this.statistics = Objects.requireNonNull(statistics, "statistics is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Creates a fresh context with an empty cache, registry and aggregates.
     */
    public static RunContext create(SqlExecutor store, ReconcileOptions options, MetricsService metricsService) {
        MetricsService metrics = metricsService != null ? metricsService : new NoOpMetricsService();
        LookupCache cache = new LookupCache(store, options.getCacheConfig(), null, metrics, options.isDebug());
        return new RunContext(store, cache, new LockRegistry(options.getLockConfig()),
                new RunStatistics(), options, metrics);
    }

    public SqlExecutor store() {
        return store;
    }

    public LookupCache lookupCache() {
        return lookupCache;
    }

    public LockRegistry lockRegistry() {
        return lockRegistry;
    }

    public RunStatistics statistics() {
        return statistics;
    }

    public ReconcileOptions options() {
        return options;
    }

    public MetricsService metrics() {
        return metricsService;
    }
}
