package com.identity.reconciliation.cache;

import com.identity.reconciliation.metrics.NoOpMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LookupCache Tests")
class LookupCacheTest {

    @Mock
    private LookupSource source;

    private final List<String> diagnostics = new CopyOnWriteArrayList<>();
    private LookupCache cache;

    @BeforeEach
    void setUp() {
        cache = new LookupCache(source, CacheConfig.defaults(),
                (kind, key) -> diagnostics.add(kind.label() + ":" + key), new NoOpMetricsService(), false);
    }

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("Should query the store once per resolved key")
        void memoizesHits() {
            when(source.findOrganizationId("Acme")).thenReturn(Optional.of(7));

            assertEquals(Optional.of(7), cache.resolveOrganization("Acme"));
            assertEquals(Optional.of(7), cache.resolveOrganization("Acme"));

            verify(source, times(1)).findOrganizationId("Acme");
            assertEquals(1, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("Should resolve slugs independently of organizations")
        void slugs() {
            when(source.findInternalSlug("sf")).thenReturn(Optional.of("da"));

            assertEquals(Optional.of("da"), cache.resolveSlug("sf"));
            assertTrue(cache.missedOrganizations().isEmpty());
        }

        @Test
        @DisplayName("Should report a missing key once and not query it again")
        void missReportedOnce() {
            when(source.findOrganizationId("Ghost")).thenReturn(Optional.empty());

            assertTrue(cache.resolveOrganization("Ghost").isEmpty());
            assertTrue(cache.resolveOrganization("Ghost").isEmpty());

            assertEquals(List.of("Organization:Ghost"), diagnostics);
            assertEquals(Set.of("Ghost"), cache.missedOrganizations());
            verify(source, times(1)).findOrganizationId("Ghost");
            assertEquals(1, cache.getStats().unresolved());
        }

        @Test
        @DisplayName("Should propagate store failures instead of recording a miss")
        void storeFailure() {
            when(source.findInternalSlug("sf")).thenThrow(new IllegalStateException("down"));

            assertThrows(IllegalStateException.class, () -> cache.resolveSlug("sf"));
            assertTrue(cache.missedSlugs().isEmpty());
            assertTrue(diagnostics.isEmpty());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Fifty concurrent requests for one missing key should yield one diagnostic")
        void singleDiagnosticUnderContention() throws Exception {
            when(source.findOrganizationId("Ghost")).thenReturn(Optional.empty());
            int threads = 50;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Optional<Integer>>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return cache.resolveOrganization("Ghost");
                    }));
                }
                start.countDown();
                for (Future<Optional<Integer>> future : futures) {
                    assertTrue(future.get(10, TimeUnit.SECONDS).isEmpty());
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(List.of("Organization:Ghost"), diagnostics);
            assertEquals(Set.of("Ghost"), cache.missedOrganizations());
        }

        @Test
        @DisplayName("Concurrent requests for one resolvable key should query the store once")
        void singleLoadUnderContention() throws Exception {
            when(source.findOrganizationId("Acme")).thenAnswer(invocation -> {
                Thread.sleep(100);
                return Optional.of(7);
            });
            int threads = 20;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Optional<Integer>>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return cache.resolveOrganization("Acme");
                    }));
                }
                start.countDown();
                for (Future<Optional<Integer>> future : futures) {
                    assertEquals(Optional.of(7), future.get(10, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }

            verify(source, times(1)).findOrganizationId("Acme");
        }
    }

    @Test
    @DisplayName("CacheStats should compute the hit rate")
    void hitRate() {
        assertEquals(0.0, CacheStats.empty().hitRate());
        assertEquals(0.75, new CacheStats(3, 1, 0, 1).hitRate(), 1e-9);
    }

    @Test
    @DisplayName("CacheConfig should reject a non-positive size")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0));
    }
}
