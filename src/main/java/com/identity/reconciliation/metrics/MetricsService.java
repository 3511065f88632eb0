package com.identity.reconciliation.metrics;

import com.identity.reconciliation.cache.LookupKind;
import com.identity.reconciliation.reconcile.ReconcileOutcome;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs
 * without a meter registry.
 */
public interface MetricsService {

    void recordRowOutcome(String phase, ReconcileOutcome outcome, Duration duration);

    void recordRowFailure(String phase);

    void recordLookupHit(LookupKind kind);

    void recordLookupMiss(LookupKind kind);
}
