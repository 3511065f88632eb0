package com.identity.reconciliation.reconcile;

import com.identity.reconciliation.core.model.ChangeRow;
import com.identity.reconciliation.store.SqlExecutor;
import com.identity.reconciliation.store.SqlStatement;
import com.identity.reconciliation.store.StoreException;
import com.identity.reconciliation.store.StoreTransaction;
import org.slf4j.Logger;

/**
 * Shared steps of the identity and enrollment reconcilers: row validation, operation trace,
 * and the transactional write of a primary record together with both dependent records.
 */
abstract class AbstractRowReconciler implements RowReconciler {

    static final String IDENTITY_ID = "identity_id";
    static final String USER_SFID = "user_sfid";
    static final String USER_EMAIL = "user_email";

    private final Logger log;

    protected AbstractRowReconciler(Logger log) {
        this.log = log;
    }

    protected String requireIdentityId(ChangeRow row) {
        String id = row.trimmed(IDENTITY_ID);
        if (id.isEmpty()) {
            throw new RowInputException(IDENTITY_ID + " cannot be empty", row);
        }
        return id;
    }

    /**
     * Logs an operation trace line: INFO when the run traces operations, DEBUG otherwise.
     */
    protected void trace(RunContext context, String format, Object... args) {
        if (context.options().isDebug()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    /**
     * Writes the primary statement and touches both dependent records of {@code uuid} in one
     * transaction.
     *
     * <p>A uniqueness violation on the primary statement rolls back and yields
     * {@link ReconcileOutcome#COLLISION}. If any of the three statements affects no row the
     * transaction is rolled back and {@link ReconcileOutcome#PARTIAL_EFFECT} is returned.
     * Any other failure rolls back and propagates.</p>
     *
     * @param primaryTable table of the primary record, used in diagnostics
     * @param success      outcome returned after a successful commit
     */
    protected ReconcileOutcome write(RunContext context, SqlStatement primary, String primaryTable,
                                     String uuid, String actor, String description,
                                     ReconcileOutcome success) {
        SqlExecutor store = context.store();
        try (StoreTransaction tx = store.begin()) {
            int affectedPrimary;
            try {
                affectedPrimary = tx.update(primary);
            } catch (StoreException e) {
                if (e.isUniqueViolation()) {
                    log.info("{}: collision, equivalent record already stored", description);
                    return ReconcileOutcome.COLLISION;
                }
                throw e;
            }
            logAffected(context, description, affectedPrimary, primaryTable);

            int affectedUidentities = tx.update(store.uidentityTouch(uuid, actor));
            logAffected(context, description, affectedUidentities, "uidentities");

            int affectedProfiles = tx.update(store.profileTouch(uuid, actor));
            logAffected(context, description, affectedProfiles, "profiles");

            if (affectedPrimary <= 0 || affectedUidentities <= 0 || affectedProfiles <= 0) {
                log.warn("{}: didn't affect {} or uidentities or profiles: ({},{},{}), rolled back",
                        description, primaryTable, affectedPrimary, affectedUidentities, affectedProfiles);
                return ReconcileOutcome.PARTIAL_EFFECT;
            }
            tx.commit();
            trace(context, "{}: committed", description);
            return success;
        } catch (RuntimeException e) {
            log.warn("rollback {}: {}", description, e.getMessage());
            throw e;
        }
    }

    private void logAffected(RunContext context, String description, int affected, String table) {
        if (affected <= 0) {
            log.warn("{}: affected {} {} rows", description, affected, table);
        } else {
            trace(context, "{}: affected {} {} rows", description, affected, table);
        }
    }
}
