package com.identity.reconciliation.metrics;

import com.identity.reconciliation.cache.LookupKind;
import com.identity.reconciliation.reconcile.ReconcileOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordRowOutcome("identities", ReconcileOutcome.UPDATED, Duration.ofMillis(5));
                noOp.recordRowFailure("identities");
                noOp.recordLookupHit(LookupKind.ORGANIZATION);
                noOp.recordLookupMiss(LookupKind.PROJECT_SLUG);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record row duration per phase and outcome counts")
        void rowOutcome() {
            metrics.recordRowOutcome("identities", ReconcileOutcome.UPDATED, Duration.ofMillis(150));
            metrics.recordRowOutcome("identities", ReconcileOutcome.UNCHANGED, Duration.ofMillis(50));
            metrics.recordRowOutcome("identities", ReconcileOutcome.UPDATED, Duration.ofMillis(100));

            Timer timer = registry.find("reconcile.row.duration").tag("phase", "identities").timer();
            assertNotNull(timer);
            assertEquals(3, timer.count());
            assertEquals(300, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);

            Counter updated = registry.find("reconcile.row.outcome")
                    .tag("phase", "identities").tag("outcome", "UPDATED").counter();
            assertNotNull(updated);
            assertEquals(2.0, updated.count());
        }

        @Test
        @DisplayName("Should count failures per phase")
        void rowFailure() {
            metrics.recordRowFailure("enrollments");

            Counter counter = registry.find("reconcile.row.failure").tag("phase", "enrollments").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should count lookup hits and misses per kind")
        void lookups() {
            metrics.recordLookupHit(LookupKind.ORGANIZATION);
            metrics.recordLookupHit(LookupKind.ORGANIZATION);
            metrics.recordLookupMiss(LookupKind.PROJECT_SLUG);

            assertEquals(2.0, registry.find("reconcile.lookup.hit").tag("kind", "ORGANIZATION").counter().count());
            assertEquals(1.0, registry.find("reconcile.lookup.miss").tag("kind", "PROJECT_SLUG").counter().count());
            assertNull(registry.find("reconcile.lookup.miss").tag("kind", "ORGANIZATION").counter());
        }
    }
}
