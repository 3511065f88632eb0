package com.identity.reconciliation.cache;

import com.identity.reconciliation.metrics.MetricsService;
import com.identity.reconciliation.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Run-scoped memoization of organization-name and project-slug resolutions.
 *
 * <p>Resolved keys are kept for the lifetime of the run. Keys the store cannot resolve are
 * recorded in a per-kind missed set and reported to the {@link LookupMissListener} exactly
 * once. Resolved keys are loaded at most once, even under concurrent requests. Misses are
 * recorded under a guard, so concurrent requests for the same missing key still produce a
 * single diagnostic.</p>
 */
public class LookupCache {
    private static final Logger log = LoggerFactory.getLogger(LookupCache.class);

    private final LookupSource source;
    private final LookupMissListener missListener;
    private final MetricsService metricsService;
    private final boolean debug;

    private final Cache<String, Integer> organizations;
    private final Cache<String, String> slugs;
    private final Set<String> missedOrganizations = new LinkedHashSet<>();
    private final Set<String> missedSlugs = new LinkedHashSet<>();
    private final ReentrantLock guard = new ReentrantLock();

    public LookupCache(LookupSource source) {
        this(source, CacheConfig.defaults(), LookupMissListener.logging(), new NoOpMetricsService(), false);
    }

    public LookupCache(LookupSource source, CacheConfig config, LookupMissListener missListener,
                       MetricsService metricsService, boolean debug) {
        this.source = source;
        this.missListener = missListener != null ? missListener : LookupMissListener.logging();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.debug = debug;
        this.organizations = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        this.slugs = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
    }

    /**
     * Resolves an organization name to its id.
     *
     * @return the id, or empty when no organization has that name
     */
    public Optional<Integer> resolveOrganization(String name) {
        return resolve(LookupKind.ORGANIZATION, name, organizations, missedOrganizations,
                source::findOrganizationId);
    }

    /**
     * Resolves an external project slug to the store's slug.
     *
     * @return the internal slug, or empty when no mapping exists
     */
    public Optional<String> resolveSlug(String externalSlug) {
        return resolve(LookupKind.PROJECT_SLUG, externalSlug, slugs, missedSlugs,
                source::findInternalSlug);
    }

    private <V> Optional<V> resolve(LookupKind kind, String key, Cache<String, V> cache,
                                    Set<String> missed, Function<String, Optional<V>> loader) {
        guard.lock();
        try {
            if (missed.contains(key)) {
                return Optional.empty();
            }
        } finally {
            guard.unlock();
        }

        // Caffeine runs the loader once per key; concurrent callers wait for its result
        AtomicBoolean loadedHere = new AtomicBoolean();
        V value = cache.get(key, k -> {
            loadedHere.set(true);
            metricsService.recordLookupMiss(kind);
            return loader.apply(k).orElse(null);
        });

        if (value != null) {
            if (!loadedHere.get()) {
                metricsService.recordLookupHit(kind);
            }
            if (debug) {
                log.debug("lookup.{} kind={} key={} value={}", loadedHere.get() ? "loaded" : "hit", kind, key, value);
            }
            return Optional.of(value);
        }

        guard.lock();
        try {
            if (missed.add(key)) {
                missListener.onMiss(kind, key);
            }
        } finally {
            guard.unlock();
        }
        return Optional.empty();
    }

    /**
     * Organization names that could not be resolved, in first-seen order.
     */
    public Set<String> missedOrganizations() {
        return snapshot(missedOrganizations);
    }

    /**
     * Project slugs that could not be resolved, in first-seen order.
     */
    public Set<String> missedSlugs() {
        return snapshot(missedSlugs);
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats orgStats = organizations.stats();
        com.github.benmanes.caffeine.cache.stats.CacheStats slugStats = slugs.stats();
        long unresolved;
        guard.lock();
        try {
            unresolved = missedOrganizations.size() + missedSlugs.size();
        } finally {
            guard.unlock();
        }
        return new CacheStats(
                orgStats.hitCount() + slugStats.hitCount(),
                orgStats.missCount() + slugStats.missCount(),
                unresolved,
                organizations.estimatedSize() + slugs.estimatedSize());
    }

    private Set<String> snapshot(Set<String> missed) {
        guard.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(missed));
        } finally {
            guard.unlock();
        }
    }
}
