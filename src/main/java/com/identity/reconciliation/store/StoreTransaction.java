package com.identity.reconciliation.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * A single store transaction on a dedicated pooled connection.
 * Rolled back on {@link #close()} unless {@link #commit()} succeeded.
 *
 * <p>Usage:</p>
 * <pre>
 * try (StoreTransaction tx = executor.begin()) {
 *     int affected = tx.update(statement);
 *     ...
 *     tx.commit();
 * }
 * // Without a successful commit() the transaction is rolled back
 * </pre>
 */
public class StoreTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreTransaction.class);

    private final Connection connection;
    private final SqlTrace trace;
    private boolean committed = false;
    private boolean closed = false;

    StoreTransaction(Connection connection, SqlTrace trace) {
        this.connection = connection;
        this.trace = trace;
    }

    /**
     * Opens a transaction on a connection borrowed from the data source.
     *
     * @throws StoreException if no connection could be obtained or auto-commit cannot be disabled
     */
    static StoreTransaction begin(DataSource dataSource, SqlTrace trace) {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new StoreException("Error obtaining connection: " + e.getMessage(),
                    StoreErrorClassifier.classify(e), e);
        }
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new StoreException("Error starting transaction: " + e.getMessage(),
                    StoreErrorClassifier.classify(e), e);
        }
        return new StoreTransaction(connection, trace);
    }

    /**
     * Executes a write statement inside this transaction.
     *
     * @return the number of affected rows
     * @throws StoreException classified by {@link StoreErrorClassifier} when the statement fails
     */
    public int update(SqlStatement statement) {
        checkOpen();
        try (PreparedStatement ps = connection.prepareStatement(statement.sql())) {
            SqlExecutor.bind(ps, statement.arguments());
            int affected = ps.executeUpdate();
            trace.executed(statement);
            return affected;
        } catch (SQLException e) {
            StoreErrorKind kind = StoreErrorClassifier.classify(e);
            trace.failed(statement, kind, e);
            throw new StoreException("Error executing statement: " + e.getMessage(),
                    kind, statement.sql(), statement.arguments(), e);
        }
    }

    public void commit() {
        checkOpen();
        try {
            connection.commit();
            committed = true;
        } catch (SQLException e) {
            throw new StoreException("Error committing transaction: " + e.getMessage(),
                    StoreErrorClassifier.classify(e), e);
        }
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (!committed) {
                log.debug("Rolling back uncommitted transaction");
                connection.rollback();
            }
        } catch (SQLException e) {
            throw new StoreException("Error rolling back transaction: " + e.getMessage(),
                    StoreErrorClassifier.classify(e), e);
        } finally {
            release();
        }
    }

    private void release() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to reset auto-commit: {}", e.getMessage());
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to release transaction connection: {}", e.getMessage());
            }
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
    }
}
