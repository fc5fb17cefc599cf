package com.flagship.pto_ledger.policy;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Immutable snapshot of a policy's rules over the half-open interval
 * {@code [effectiveFrom, effectiveTo)}; a null {@code effectiveTo} means open-ended.
 *
 * Versions are never edited. A change creates version {@code n + 1} and closes version
 * {@code n} at the new start date, so every ledger entry keeps pointing at the rules that
 * produced it.
 */
@Value
public class PolicyVersion {
    UUID id;
    UUID policyId;
    int version;
    LocalDate effectiveFrom;
    LocalDate effectiveTo;
    PolicyKind kind;
    DisplayUnit displayUnit;
    PolicySettings settings;
    UUID createdBy;
    Instant createdAt;

    public static PolicyVersion first(UUID policyId, NewPolicyVersion input, Instant createdAt) {
        return of(policyId, 1, input, createdAt);
    }

    /**
     * Builds the version that follows this one.
     */
    public PolicyVersion successor(NewPolicyVersion input, Instant createdAt) {
        return of(policyId, version + 1, input, createdAt);
    }

    /**
     * Returns this version closed at {@code endDate}.
     */
    public PolicyVersion endAt(LocalDate endDate) {
        return new PolicyVersion(id, policyId, version, effectiveFrom, endDate, kind, displayUnit,
                settings, createdBy, createdAt);
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(effectiveFrom) && (effectiveTo == null || date.isBefore(effectiveTo));
    }

    public boolean isOpenEnded() {
        return effectiveTo == null;
    }

    private static PolicyVersion of(UUID policyId, int version, NewPolicyVersion input, Instant createdAt) {
        return new PolicyVersion(
                UUID.randomUUID(),
                policyId,
                version,
                input.getEffectiveFrom(),
                null,
                input.getSettings().kind(),
                input.getDisplayUnit() != null ? input.getDisplayUnit() : DisplayUnit.HOURS,
                input.getSettings(),
                input.getCreatedBy(),
                createdAt
        );
    }
}
