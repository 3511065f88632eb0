package com.identity.reconciliation.metrics;

import com.identity.reconciliation.cache.LookupKind;
import com.identity.reconciliation.reconcile.ReconcileOutcome;

import java.time.Duration;

/**
 * No-op metrics implementation. All methods are empty.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRowOutcome(String phase, ReconcileOutcome outcome, Duration duration) {
    }

    @Override
    public void recordRowFailure(String phase) {
    }

    @Override
    public void recordLookupHit(LookupKind kind) {
    }

    @Override
    public void recordLookupMiss(LookupKind kind) {
    }
}
