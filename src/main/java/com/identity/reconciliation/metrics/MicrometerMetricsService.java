package com.identity.reconciliation.metrics;

import com.identity.reconciliation.cache.LookupKind;
import com.identity.reconciliation.reconcile.ReconcileOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconcile.row.duration} - Timer (tag: phase)</li>
 *   <li>{@code reconcile.row.outcome} - Counter (tags: phase, outcome)</li>
 *   <li>{@code reconcile.row.failure} - Counter (tag: phase)</li>
 *   <li>{@code reconcile.lookup.hit} - Counter (tag: kind)</li>
 *   <li>{@code reconcile.lookup.miss} - Counter (tag: kind)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRowOutcome(String phase, ReconcileOutcome outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(phase, k ->
                Timer.builder("reconcile.row.duration")
                        .description("Duration of single row reconciliation")
                        .tag("phase", phase)
                        .register(registry));
        timer.record(duration);

        String key = "outcome:" + phase + ":" + outcome.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("reconcile.row.outcome")
                        .description("Number of reconciled rows by outcome")
                        .tag("phase", phase)
                        .tag("outcome", outcome.name())
                        .register(registry)).increment();
    }

    @Override
    public void recordRowFailure(String phase) {
        counterCache.computeIfAbsent("failure:" + phase, k ->
                Counter.builder("reconcile.row.failure")
                        .description("Number of rows that failed with a hard error")
                        .tag("phase", phase)
                        .register(registry)).increment();
    }

    @Override
    public void recordLookupHit(LookupKind kind) {
        lookupCounter("reconcile.lookup.hit", "Number of lookups answered from the cache", kind).increment();
    }

    @Override
    public void recordLookupMiss(LookupKind kind) {
        lookupCounter("reconcile.lookup.miss", "Number of lookups sent to the store", kind).increment();
    }

    private Counter lookupCounter(String name, String description, LookupKind kind) {
        return counterCache.computeIfAbsent(name + ":" + kind.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("kind", kind.name())
                        .register(registry));
    }
}
