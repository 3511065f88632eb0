package com.identity.reconciliation.reconcile;

import com.identity.reconciliation.cache.LookupCache;
import com.identity.reconciliation.core.model.ChangeRow;
import com.identity.reconciliation.core.model.DateRange;
import com.identity.reconciliation.core.model.EnrollmentField;
import com.identity.reconciliation.core.model.EnrollmentRecord;
import com.identity.reconciliation.lock.ScopedLock;
import com.identity.reconciliation.store.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies affiliation corrections: moves an existing enrollment to a new organization or
 * period, or creates a new enrollment, and stamps the dependent records of the merged
 * identifier.
 *
 * <p>When {@code from_org_name} is given the row updates the single enrollment matching
 * {@code (uuid, project, from organization, from_start_date, from_end_date)}, where a missing
 * date stands for its open-range sentinel. Without it
 * the row inserts a new enrollment; an equivalent existing enrollment surfaces as a
 * collision on the unique key.</p>
 */
public class EnrollmentReconciler extends AbstractRowReconciler {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentReconciler.class);

    static final String USER_NAME = "user_name";
    static final String PROJECT_SLUG = "project_slug";
    static final String TO_ORG_NAME = "to_org_name";
    static final String TO_START_DATE = "to_start_date";
    static final String TO_END_DATE = "to_end_date";
    static final String FROM_ORG_NAME = "from_org_name";
    static final String FROM_START_DATE = "from_start_date";
    static final String FROM_END_DATE = "from_end_date";

    // two rows are enough to tell a unique match from an ambiguous one
    private static final int MATCH_LIMIT = 2;

    public EnrollmentReconciler() {
        super(log);
    }

    @Override
    public ReconcileOutcome reconcile(ChangeRow row, RunContext context) {
        trace(context, "enrollment.row {}", row);
        String id = requireIdentityId(row);

        Optional<String> foundUuid = context.store().findIdentityUuid(id);
        if (foundUuid.isEmpty()) {
            log.warn("cannot find identity with id={} ({})", id, row);
            return ReconcileOutcome.NOT_FOUND;
        }
        String uuid = foundUuid.get();
        trace(context, "enrollment.identity id={} uuid={}", id, uuid);

        DateRange current = DateRange.of(
                parseDate(row, FROM_START_DATE, id, uuid),
                parseDate(row, FROM_END_DATE, id, uuid));
        DateRange target = DateRange.of(
                parseDate(row, TO_START_DATE, id, uuid),
                parseDate(row, TO_END_DATE, id, uuid));

        String newOrgName = row.trimmed(TO_ORG_NAME);
        if (newOrgName.isEmpty()) {
            throw new RowInputException("identity_id " + id + "/" + uuid + " " + TO_ORG_NAME + " cannot be empty", row);
        }
        String fromOrgName = row.trimmed(FROM_ORG_NAME);

        LookupCache lookups = context.lookupCache();
        String projectSlug = "";
        String externalSlug = row.trimmed(PROJECT_SLUG);
        if (!externalSlug.isEmpty()) {
            Optional<String> slug = lookups.resolveSlug(externalSlug);
            if (slug.isEmpty()) {
                trace(context, "identity_id {}/{} unresolved project slug {} ({})", id, uuid, externalSlug, row);
                return ReconcileOutcome.UNRESOLVED;
            }
            projectSlug = slug.get();
        }
        Integer fromOrgId = null;
        if (!fromOrgName.isEmpty()) {
            Optional<Integer> resolved = lookups.resolveOrganization(fromOrgName);
            if (resolved.isEmpty()) {
                trace(context, "identity_id {}/{} unresolved organization {} ({})", id, uuid, fromOrgName, row);
                return ReconcileOutcome.UNRESOLVED;
            }
            fromOrgId = resolved.get();
        }
        Optional<Integer> resolvedNewOrg = lookups.resolveOrganization(newOrgName);
        if (resolvedNewOrg.isEmpty()) {
            trace(context, "identity_id {}/{} unresolved organization {} ({})", id, uuid, newOrgName, row);
            return ReconcileOutcome.UNRESOLVED;
        }
        int newOrgId = resolvedNewOrg.get();

        Lookup lookup = new Lookup(uuid, projectSlug, fromOrgName, fromOrgId, current);
        EnrollmentRecord matched = null;
        if (fromOrgId != null) {
            Match match = match(context, lookup, row);
            if (match.outcome() != null) {
                return match.outcome();
            }
            matched = match.record();
            if (isUnchanged(matched, newOrgId, target)) {
                trace(context, "enrollment {} for identity_id {}/{} nothing changed", matched.id(), id, uuid);
                return ReconcileOutcome.UNCHANGED;
            }
        } else {
            trace(context, "identity {}/{} insert mode", id, uuid);
        }

        try (ScopedLock lock = context.lockRegistry().acquire(id, uuid)) {
            if (matched != null) {
                // state may have moved while waiting for the lock
                Match match = match(context, lookup, row);
                if (match.outcome() != null) {
                    return match.outcome();
                }
                matched = match.record();
                if (isUnchanged(matched, newOrgId, target)) {
                    trace(context, "enrollment {} for identity_id {}/{} already updated by a concurrent row",
                            matched.id(), id, uuid);
                    return ReconcileOutcome.UNCHANGED;
                }
            }

            String actor = actor(row);
            SqlStatement statement;
            String description;
            ReconcileOutcome success;
            if (matched != null) {
                Map<EnrollmentField, Object> changes = diff(matched, newOrgId, target);
                statement = context.store().enrollmentUpdate(matched.id(), changes, actor);
                description = describeUpdate(id, matched, fromOrgName, newOrgName, newOrgId, target, changes, actor);
                success = ReconcileOutcome.UPDATED;
            } else {
                statement = context.store().enrollmentInsert(uuid, newOrgId, projectSlug, target, actor);
                description = "new enrollment identity_id " + id + "/" + uuid + " " + newOrgName + "/" + newOrgId
                        + " " + projectSlug + " " + target.start() + " " + target.end() + " by " + actor;
                success = ReconcileOutcome.INSERTED;
            }

            if (context.options().isDryRun()) {
                log.info("{}", description);
                trace(context, "planned {}", statement);
                return ReconcileOutcome.DRY_RUN;
            }

            ReconcileOutcome outcome = write(context, statement, "enrollments", uuid, actor, description, success);
            if (outcome.isWrite()) {
                context.statistics().recordEnrollment(id, uuid);
            }
            return outcome;
        }
    }

    private Match match(RunContext context, Lookup lookup, ChangeRow row) {
        List<EnrollmentRecord> found = context.store().findEnrollments(lookup.uuid(), lookup.projectSlug(),
                lookup.orgId(), lookup.range(), MATCH_LIMIT);
        if (found.isEmpty()) {
            log.warn("cannot find enrollment with uuid={} project_slug={} organization={}/{} range={} ({})",
                    lookup.uuid(), lookup.projectSlug(), lookup.orgName(), lookup.orgId(),
                    lookup.range(), row);
            return new Match(null, ReconcileOutcome.NOT_FOUND);
        }
        if (found.size() > 1) {
            log.warn("found more than one enrollment with uuid={} project_slug={} organization={}/{} range={} ({})",
                    lookup.uuid(), lookup.projectSlug(), lookup.orgName(), lookup.orgId(),
                    lookup.range(), row);
            return new Match(null, ReconcileOutcome.AMBIGUOUS);
        }
        EnrollmentRecord record = found.get(0);
        trace(context, "enrollment.found id={} uuid={} organization={} range={}",
                record.id(), record.uuid(), record.organizationId(), record.range());
        return new Match(record, null);
    }

    static boolean isUnchanged(EnrollmentRecord current, int newOrgId, DateRange target) {
        return current.organizationId() == newOrgId && current.range().equals(target);
    }

    static Map<EnrollmentField, Object> diff(EnrollmentRecord current, int newOrgId, DateRange target) {
        Map<EnrollmentField, Object> changes = new EnumMap<>(EnrollmentField.class);
        if (current.organizationId() != newOrgId) {
            changes.put(EnrollmentField.ORGANIZATION_ID, newOrgId);
        }
        if (!current.range().start().equals(target.start())) {
            changes.put(EnrollmentField.START, target.start());
        }
        if (!current.range().end().equals(target.end())) {
            changes.put(EnrollmentField.END, target.end());
        }
        return changes;
    }

    static String actor(ChangeRow row) {
        return "email:" + row.trimmed(USER_EMAIL) + ",name:" + row.trimmed(USER_NAME)
                + ",sfid:" + row.trimmed(USER_SFID);
    }

    private static LocalDate parseDate(ChangeRow row, String column, String id, String uuid) {
        String value = row.trimmed(column);
        if (value.isEmpty()) {
            return null;
        }
        return FlexibleDateParser.parse(value).orElseThrow(() -> new RowInputException(
                "identity_id " + id + "/" + uuid + " cannot parse " + column + " '" + value + "'", row));
    }

    private static String describeUpdate(String id, EnrollmentRecord current, String fromOrgName,
                                         String newOrgName, int newOrgId, DateRange target,
                                         Map<EnrollmentField, Object> changes, String actor) {
        StringBuilder msg = new StringBuilder("enrollment ").append(current.id())
                .append(" identity_id ").append(id).append('/').append(current.uuid()).append(' ');
        if (changes.containsKey(EnrollmentField.ORGANIZATION_ID)) {
            msg.append("org ").append(fromOrgName).append('/').append(current.organizationId())
                    .append(" -> ").append(newOrgName).append('/').append(newOrgId).append(' ');
        }
        if (changes.containsKey(EnrollmentField.START)) {
            msg.append("start ").append(current.range().start()).append(" -> ").append(target.start()).append(' ');
        }
        if (changes.containsKey(EnrollmentField.END)) {
            msg.append("end ").append(current.range().end()).append(" -> ").append(target.end()).append(' ');
        }
        return msg.append("by ").append(actor).toString();
    }

    private record Lookup(String uuid, String projectSlug, String orgName, Integer orgId, DateRange range) {
    }

    private record Match(EnrollmentRecord record, ReconcileOutcome outcome) {
    }
}
