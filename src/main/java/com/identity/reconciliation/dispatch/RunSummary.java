package com.identity.reconciliation.dispatch;

import com.identity.reconciliation.cache.CacheStats;

import java.time.Duration;
import java.util.List;

/**
 * Result of a complete run: both phase results, the distinct-identifier aggregates and
 * the lookup keys that could not be resolved.
 */
public record RunSummary(
        PhaseResult identities,
        PhaseResult enrollments,
        int updatedIdentities,
        int updatedEnrollments,
        int updatedUidentities,
        int updatedProfiles,
        List<String> unresolvedOrganizations,
        List<String> unresolvedSlugs,
        CacheStats lookupStats,
        Duration elapsed
) {
    public RunSummary {
        unresolvedOrganizations = unresolvedOrganizations != null ? List.copyOf(unresolvedOrganizations) : List.of();
        unresolvedSlugs = unresolvedSlugs != null ? List.copyOf(unresolvedSlugs) : List.of();
        lookupStats = lookupStats != null ? lookupStats : CacheStats.empty();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    /**
     * Returns true if any organization or project slug could not be resolved.
     */
    public boolean hasUnresolved() {
        return !unresolvedOrganizations.isEmpty() || !unresolvedSlugs.isEmpty();
    }

    @Override
    public String toString() {
        return "RunSummary{" +
                "identities=" + updatedIdentities +
                ", enrollments=" + updatedEnrollments +
                ", uidentities=" + updatedUidentities +
                ", profiles=" + updatedProfiles +
                ", unresolvedOrganizations=" + unresolvedOrganizations.size() +
                ", unresolvedSlugs=" + unresolvedSlugs.size() +
                ", elapsed=" + elapsed.toMillis() + "ms" +
                '}';
    }
}
