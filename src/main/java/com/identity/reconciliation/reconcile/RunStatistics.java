package com.identity.reconciliation.reconcile;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-wide sets of distinct identifiers changed by committed transactions.
 */
public class RunStatistics {

    private final Set<String> identities = ConcurrentHashMap.newKeySet();
    private final Set<String> enrollments = ConcurrentHashMap.newKeySet();
    private final Set<String> uidentities = ConcurrentHashMap.newKeySet();
    private final Set<String> profiles = ConcurrentHashMap.newKeySet();

    /**
     * Records a committed identity change and the dependent touches of its merged identifier.
     */
    public void recordIdentity(String identityId, String uuid) {
        identities.add(identityId);
        uidentities.add(uuid);
        profiles.add(uuid);
    }

    /**
     * Records a committed enrollment change, keyed by the identity that requested it,
     * and the dependent touches of its merged identifier.
     */
    public void recordEnrollment(String identityId, String uuid) {
        enrollments.add(identityId);
        uidentities.add(uuid);
        profiles.add(uuid);
    }

    public int updatedIdentities() {
        return identities.size();
    }

    public int updatedEnrollments() {
        return enrollments.size();
    }

    public int updatedUidentities() {
        return uidentities.size();
    }

    public int updatedProfiles() {
        return profiles.size();
    }

    @Override
    public String toString() {
        return "RunStatistics{identities=" + identities.size() +
                ", enrollments=" + enrollments.size() +
                ", uidentities=" + uidentities.size() +
                ", profiles=" + profiles.size() + '}';
    }
}
