package com.identity.reconciliation.store;

import com.identity.reconciliation.config.ReconcilerConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the pooled data source shared by all workers of a run.
 * Each worker holds at most one connection at a time, so the pool is sized to the
 * worker count plus one spare for the dispatching thread.
 */
public final class DataSourceFactory {
    private static final Logger log = LoggerFactory.getLogger(DataSourceFactory.class);

    static final String POOL_NAME = "identity-store";

    private DataSourceFactory() {
    }

    public static HikariDataSource create(ReconcilerConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(POOL_NAME);
        hikari.setJdbcUrl(config.jdbcUrl());
        if (!config.user().isEmpty()) {
            hikari.setUsername(config.user());
        }
        if (!config.password().isEmpty()) {
            hikari.setPassword(config.password());
        }
        hikari.setMaximumPoolSize(poolSize(config.threads()));
        hikari.setMinimumIdle(1);
        hikari.setAutoCommit(true);
        log.info("store.pool.create pool={} maxSize={}", POOL_NAME, hikari.getMaximumPoolSize());
        return new HikariDataSource(hikari);
    }

    static int poolSize(int threads) {
        return Math.max(1, threads) + 1;
    }
}
