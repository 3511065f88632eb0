package com.identity.reconciliation.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives the diagnostic for a key that could not be resolved.
 * Invoked at most once per distinct key and kind during a run.
 */
@FunctionalInterface
public interface LookupMissListener {

    void onMiss(LookupKind kind, String key);

    /**
     * Logs one warning line per unresolved key.
     */
    static LookupMissListener logging() {
        Logger log = LoggerFactory.getLogger(LookupCache.class);
        return (kind, key) -> log.warn("{} not found in store: {}", kind.label(), key);
    }
}
