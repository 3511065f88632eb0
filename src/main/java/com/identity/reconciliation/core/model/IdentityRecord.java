package com.identity.reconciliation.core.model;

/**
 * Persisted state of an identity as read for diffing.
 * Name, username and email are trimmed, with NULL read as an empty string.
 *
 * @param id       primary identifier
 * @param uuid     merged identifier shared by identities of the same person
 * @param name     display name
 * @param username login name
 * @param email    email address
 * @param source   origin of the identity; never changed by reconciliation
 */
public record IdentityRecord(
        String id,
        String uuid,
        String name,
        String username,
        String email,
        String source
) {
}
