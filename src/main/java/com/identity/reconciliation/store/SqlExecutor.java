package com.identity.reconciliation.store;

import com.identity.reconciliation.cache.LookupSource;
import com.identity.reconciliation.core.model.DateRange;
import com.identity.reconciliation.core.model.EnrollmentField;
import com.identity.reconciliation.core.model.EnrollmentRecord;
import com.identity.reconciliation.core.model.IdentityField;
import com.identity.reconciliation.core.model.IdentityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and statement builders for the identity store.
 *
 * <p>Reads run on their own auto-commit connection. Writes are returned as
 * {@link SqlStatement}s and executed by the caller inside a {@link StoreTransaction}.</p>
 */
public class SqlExecutor implements LookupSource {
    private static final Logger log = LoggerFactory.getLogger(SqlExecutor.class);

    /** Value written to {@code locked_by} on every touched row. */
    public static final String LOCKED_BY = "individual";

    private final DataSource dataSource;
    private final SqlTrace trace;

    public SqlExecutor(DataSource dataSource) {
        this(dataSource, SqlTrace.disabled());
    }

    public SqlExecutor(DataSource dataSource, SqlTrace trace) {
        this.dataSource = dataSource;
        this.trace = trace;
    }

    // ========== Identities ==========

    /**
     * Finds an identity by primary id. Text columns are trimmed and NULL is read as empty.
     */
    public Optional<IdentityRecord> findIdentity(String id) {
        SqlStatement statement = SqlStatement.of("""
                select uuid, trim(coalesce(name, '')) as name, trim(coalesce(username, '')) as username,
                       trim(coalesce(email, '')) as email, trim(coalesce(source, '')) as source
                from identities where id = ?""", id);
        return first(query(statement, rs -> new IdentityRecord(
                id,
                rs.getString("uuid"),
                rs.getString("name"),
                rs.getString("username"),
                rs.getString("email"),
                rs.getString("source"))));
    }

    /**
     * Finds the merged identifier of an identity.
     */
    public Optional<String> findIdentityUuid(String id) {
        SqlStatement statement = SqlStatement.of("select uuid from identities where id = ?", id);
        return first(query(statement, rs -> rs.getString("uuid")));
    }

    public SqlStatement identityUpdate(String id, Map<IdentityField, String> changes, String actor) {
        StringBuilder sql = new StringBuilder("update identities set ");
        List<Object> args = new ArrayList<>();
        changes.forEach((field, value) -> {
            sql.append(field.column()).append(" = ?, ");
            args.add(value);
        });
        sql.append("last_modified = now(), last_modified_by = ?, locked_by = ? where id = ?");
        args.add(actor);
        args.add(LOCKED_BY);
        args.add(id);
        return new SqlStatement(sql.toString(), args);
    }

    // ========== Dependent records ==========

    public SqlStatement uidentityTouch(String uuid, String actor) {
        return SqlStatement.of(
                "update uidentities set last_modified = now(), last_modified_by = ?, locked_by = ? where uuid = ?",
                actor, LOCKED_BY, uuid);
    }

    public SqlStatement profileTouch(String uuid, String actor) {
        return SqlStatement.of(
                "update profiles set last_modified = now(), last_modified_by = ?, locked_by = ? where uuid = ?",
                actor, LOCKED_BY, uuid);
    }

    // ========== Lookups ==========

    @Override
    public Optional<Integer> findOrganizationId(String name) {
        SqlStatement statement = SqlStatement.of("select id from organizations where name = ?", name);
        return first(query(statement, rs -> rs.getInt("id")));
    }

    @Override
    public Optional<String> findInternalSlug(String externalSlug) {
        SqlStatement statement = SqlStatement.of("select da_name from slug_mapping where sf_name = ?", externalSlug);
        return first(query(statement, rs -> rs.getString("da_name")));
    }

    // ========== Enrollments ==========

    /**
     * Finds enrollments of a merged identity for a project, organization and exact date range.
     * At most {@code limit} records are returned.
     */
    public List<EnrollmentRecord> findEnrollments(String uuid, String projectSlug, int organizationId,
                                                  DateRange range, int limit) {
        SqlStatement statement = SqlStatement.of("""
                select id, uuid, organization_id, trim(coalesce(project_slug, '')) as project_slug, start, end
                from enrollments
                where uuid = ? and trim(coalesce(project_slug, '')) = ? and organization_id = ?
                and start = ? and end = ?
                order by id limit\s""" + limit,
                uuid, projectSlug, organizationId, range.start(), range.end());
        return query(statement, rs -> new EnrollmentRecord(
                rs.getLong("id"),
                rs.getString("uuid"),
                rs.getInt("organization_id"),
                rs.getString("project_slug"),
                DateRange.of(toDate(rs.getTimestamp("start")), toDate(rs.getTimestamp("end")))));
    }

    public SqlStatement enrollmentUpdate(long enrollmentId, Map<EnrollmentField, Object> changes, String actor) {
        StringBuilder sql = new StringBuilder("update enrollments set ");
        List<Object> args = new ArrayList<>();
        changes.forEach((field, value) -> {
            sql.append(field.column()).append(" = ?, ");
            args.add(value);
        });
        sql.append("last_modified = now(), last_modified_by = ?, locked_by = ? where id = ?");
        args.add(actor);
        args.add(LOCKED_BY);
        args.add(enrollmentId);
        return new SqlStatement(sql.toString(), args);
    }

    public SqlStatement enrollmentInsert(String uuid, int organizationId, String projectSlug,
                                         DateRange range, String actor) {
        return SqlStatement.of("""
                insert into enrollments(uuid, organization_id, project_slug, start, end, last_modified_by, locked_by)
                values(?, ?, ?, ?, ?, ?, ?)""",
                uuid, organizationId, projectSlug, range.start(), range.end(), actor, LOCKED_BY);
    }

    // ========== Transactions ==========

    /**
     * Opens a new transaction on its own connection.
     */
    public StoreTransaction begin() {
        return StoreTransaction.begin(dataSource, trace);
    }

    public SqlTrace getTrace() {
        return trace;
    }

    // ========== Internals ==========

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    <T> List<T> query(SqlStatement statement, RowMapper<T> mapper) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(statement.sql())) {
            bind(ps, statement.arguments());
            List<T> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
            }
            trace.executed(statement);
            return results;
        } catch (SQLException e) {
            StoreErrorKind kind = StoreErrorClassifier.classify(e);
            trace.failed(statement, kind, e);
            throw new StoreException("Error querying store: " + e.getMessage(),
                    kind, statement.sql(), statement.arguments(), e);
        }
    }

    /**
     * Binds positional arguments. Dates are bound as midnight timestamps so they compare
     * equal to stored datetime columns.
     */
    static void bind(PreparedStatement ps, List<Object> arguments) throws SQLException {
        for (int i = 0; i < arguments.size(); i++) {
            Object value = arguments.get(i);
            if (value instanceof LocalDate date) {
                ps.setTimestamp(i + 1, Timestamp.valueOf(date.atStartOfDay()));
            } else {
                ps.setObject(i + 1, value);
            }
        }
    }

    private static LocalDate toDate(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime().toLocalDate() : null;
    }

    private static <T> Optional<T> first(List<T> results) {
        if (results.size() > 1) {
            log.debug("Expected at most one row, found {}; using the first", results.size());
        }
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
