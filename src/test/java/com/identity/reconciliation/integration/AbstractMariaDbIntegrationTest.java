package com.identity.reconciliation.integration;

import com.identity.reconciliation.config.ReconcilerConfig;
import com.identity.reconciliation.store.DataSourceFactory;
import com.identity.reconciliation.store.TestStore;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.testcontainers.containers.MariaDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base class for MariaDB integration tests using Testcontainers.
 * Provides a shared MariaDB container; the schema is reloaded before every test.
 */
@Tag("integration")
@Testcontainers
abstract class AbstractMariaDbIntegrationTest {

    @SuppressWarnings("resource")
    @Container
    static final MariaDBContainer<?> mariaDb = new MariaDBContainer<>("mariadb:10.11");

    protected HikariDataSource dataSource;
    protected TestStore db;

    @BeforeEach
    void openStore() {
        dataSource = DataSourceFactory.create(config(4));
        db = TestStore.on(dataSource);
    }

    @AfterEach
    void closeStore() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    protected ReconcilerConfig config(int threads) {
        return new ReconcilerConfig(mariaDb.getJdbcUrl(), mariaDb.getUsername(), mariaDb.getPassword(),
                threads, false, false, true);
    }
}
