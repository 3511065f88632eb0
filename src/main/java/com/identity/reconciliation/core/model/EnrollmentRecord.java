package com.identity.reconciliation.core.model;

/**
 * Persisted enrollment (organization affiliation) of a merged identity.
 *
 * @param id             enrollment row id
 * @param uuid           merged identifier
 * @param organizationId affiliated organization
 * @param projectSlug    internal project slug, empty when the enrollment is project independent
 * @param range          affiliation period
 */
public record EnrollmentRecord(
        long id,
        String uuid,
        int organizationId,
        String projectSlug,
        DateRange range
) {
}
