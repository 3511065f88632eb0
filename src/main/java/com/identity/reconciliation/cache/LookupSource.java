package com.identity.reconciliation.cache;

import java.util.Optional;

/**
 * Store-backed foreign-key resolutions consulted by the {@link LookupCache} on a cache miss.
 */
public interface LookupSource {

    /**
     * Finds the id of the organization with exactly the given name.
     */
    Optional<Integer> findOrganizationId(String name);

    /**
     * Maps an externally sourced project slug to the store's own slug.
     */
    Optional<String> findInternalSlug(String externalSlug);
}
