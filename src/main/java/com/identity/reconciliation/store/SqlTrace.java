package com.identity.reconciliation.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statement tracing. Every statement is logged when statement debugging is on;
 * failed statements are always logged except classified collisions.
 */
public class SqlTrace {
    private static final Logger log = LoggerFactory.getLogger("com.identity.reconciliation.store.SQL");

    private final boolean enabled;

    public SqlTrace(boolean enabled) {
        this.enabled = enabled;
    }

    public static SqlTrace disabled() {
        return new SqlTrace(false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void executed(SqlStatement statement) {
        if (enabled) {
            log.info("sql.executed statement={} args={}", statement.sql(), statement.arguments());
        }
    }

    public void failed(SqlStatement statement, StoreErrorKind kind, Exception e) {
        if (kind == StoreErrorKind.UNIQUE_VIOLATION && !enabled) {
            return;
        }
        log.warn("sql.failed kind={} statement={} args={} error={}",
                kind, statement.sql(), statement.arguments(), e.getMessage());
    }
}
