package com.identity.reconciliation.dispatch;

import com.identity.reconciliation.reconcile.ReconcileOutcome;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome counts of one completed phase.
 */
public record PhaseResult(
        Phase phase,
        long rows,
        Map<ReconcileOutcome, Long> outcomes,
        Duration elapsed
) {
    public PhaseResult {
        Map<ReconcileOutcome, Long> copy = new EnumMap<>(ReconcileOutcome.class);
        if (outcomes != null) {
            copy.putAll(outcomes);
        }
        outcomes = Collections.unmodifiableMap(copy);
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    /**
     * Number of rows that ended with the given outcome.
     */
    public long count(ReconcileOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0L);
    }

    /**
     * Number of rows that committed a change.
     */
    public long writes() {
        return outcomes.entrySet().stream()
                .filter(e -> e.getKey().isWrite())
                .mapToLong(Map.Entry::getValue)
                .sum();
    }

    /**
     * Number of rows that were reported and skipped.
     */
    public long warnings() {
        return outcomes.entrySet().stream()
                .filter(e -> e.getKey().isWarning())
                .mapToLong(Map.Entry::getValue)
                .sum();
    }

    @Override
    public String toString() {
        return "PhaseResult{" +
                "phase=" + phase.label() +
                ", rows=" + rows +
                ", outcomes=" + outcomes +
                ", elapsed=" + elapsed.toMillis() + "ms" +
                '}';
    }
}
