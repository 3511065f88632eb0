package com.identity.reconciliation.reconcile;

import com.identity.reconciliation.core.model.ChangeRow;
import com.identity.reconciliation.core.model.IdentityField;
import com.identity.reconciliation.core.model.IdentityRecord;
import com.identity.reconciliation.lock.ScopedLock;
import com.identity.reconciliation.store.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies identity corrections: the minimal update of name, username and email of one
 * identity, plus a modification stamp on the dependent records of its merged identifier.
 *
 * <p>Input columns: {@code identity_id} (required), {@code identity_name},
 * {@code identity_username}, {@code identity_email}, {@code identity_source},
 * {@code user_sfid}, {@code user_email}. Only the identity columns present in the row are
 * compared; a present but empty value clears the stored one.</p>
 */
public class IdentityReconciler extends AbstractRowReconciler {
    private static final Logger log = LoggerFactory.getLogger(IdentityReconciler.class);

    static final String IDENTITY_NAME = "identity_name";
    static final String IDENTITY_USERNAME = "identity_username";
    static final String IDENTITY_EMAIL = "identity_email";
    static final String IDENTITY_SOURCE = "identity_source";

    private static final Map<IdentityField, String> COLUMNS = Map.of(
            IdentityField.NAME, IDENTITY_NAME,
            IdentityField.USERNAME, IDENTITY_USERNAME,
            IdentityField.EMAIL, IDENTITY_EMAIL);

    public IdentityReconciler() {
        super(log);
    }

    @Override
    public ReconcileOutcome reconcile(ChangeRow row, RunContext context) {
        trace(context, "identity.row {}", row);
        String id = requireIdentityId(row);

        Optional<IdentityRecord> found = context.store().findIdentity(id);
        if (found.isEmpty()) {
            log.warn("cannot find identity with id={} ({})", id, row);
            return ReconcileOutcome.NOT_FOUND;
        }
        IdentityRecord current = found.get();
        trace(context, "identity.found id={} uuid={} name={} username={} email={} source={}",
                id, current.uuid(), current.name(), current.username(), current.email(), current.source());

        // files without the column neither change nor check the source
        if (row.values().containsKey(IDENTITY_SOURCE)) {
            String newSource = row.trimmed(IDENTITY_SOURCE);
            if (!newSource.equals(current.source())) {
                throw new RowInputException("identity_id " + id + "/" + current.uuid()
                        + " updating source is not supported, attempted " + current.source()
                        + " -> " + newSource, row);
            }
        }

        if (diff(current, row).isEmpty()) {
            trace(context, "identity_id {}/{} ({},{},{}) nothing changed",
                    id, current.uuid(), current.name(), current.username(), current.email());
            return ReconcileOutcome.UNCHANGED;
        }

        try (ScopedLock lock = context.lockRegistry().acquire(id, current.uuid())) {
            // state may have moved while waiting for the lock
            Optional<IdentityRecord> reread = context.store().findIdentity(id);
            if (reread.isEmpty()) {
                log.warn("identity with id={} disappeared while waiting for its lock ({})", id, row);
                return ReconcileOutcome.NOT_FOUND;
            }
            IdentityRecord locked = reread.get();
            Map<IdentityField, String> changes = diff(locked, row);
            if (changes.isEmpty()) {
                trace(context, "identity_id {}/{} already updated by a concurrent row", id, locked.uuid());
                return ReconcileOutcome.UNCHANGED;
            }

            String actor = actor(row);
            String description = describe(locked, changes, actor);
            SqlStatement update = context.store().identityUpdate(id, changes, actor);
            if (context.options().isDryRun()) {
                log.info("{}", description);
                trace(context, "planned {}", update);
                return ReconcileOutcome.DRY_RUN;
            }

            ReconcileOutcome outcome = write(context, update, "identities", locked.uuid(), actor,
                    description, ReconcileOutcome.UPDATED);
            if (outcome == ReconcileOutcome.UPDATED) {
                context.statistics().recordIdentity(id, locked.uuid());
            }
            return outcome;
        }
    }

    /**
     * Columns whose trimmed row value differs from the stored value, in a stable order.
     */
    static Map<IdentityField, String> diff(IdentityRecord current, ChangeRow row) {
        Map<IdentityField, String> changes = new EnumMap<>(IdentityField.class);
        for (IdentityField field : IdentityField.values()) {
            String column = COLUMNS.get(field);
            if (!row.values().containsKey(column)) {
                continue;
            }
            String value = row.trimmed(column);
            if (!value.equals(storedValue(current, field))) {
                changes.put(field, value);
            }
        }
        return changes;
    }

    static String actor(ChangeRow row) {
        return "email:" + row.trimmed(USER_EMAIL) + ",sfid:" + row.trimmed(USER_SFID);
    }

    private static String storedValue(IdentityRecord record, IdentityField field) {
        return switch (field) {
            case NAME -> record.name();
            case USERNAME -> record.username();
            case EMAIL -> record.email();
        };
    }

    private static String describe(IdentityRecord current, Map<IdentityField, String> changes, String actor) {
        StringBuilder msg = new StringBuilder("identity_id ")
                .append(current.id()).append('/').append(current.uuid()).append(' ');
        changes.forEach((field, value) -> msg.append(field.column()).append(' ')
                .append(storedValue(current, field)).append(" -> ").append(value).append(' '));
        return msg.append("by ").append(actor).toString();
    }
}
