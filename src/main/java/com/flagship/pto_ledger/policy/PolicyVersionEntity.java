package com.flagship.pto_ledger.policy;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for a policy version.
 *
 * Everything except {@code effectiveTo} is write-once. Settings are stored as jsonb with the
 * variant discriminator, so a version reads back as exactly the rules it was created with.
 */
@Entity
@Table(name = "policy_versions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PolicyVersionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "policy_id", nullable = false, updatable = false)
    private UUID policyId;

    @Column(nullable = false, updatable = false)
    private int version;

    @Column(name = "effective_from", nullable = false, updatable = false)
    private LocalDate effectiveFrom;

    @Column(name = "effective_to")
    private LocalDate effectiveTo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private PolicyKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "display_unit", nullable = false, updatable = false, length = 10)
    private DisplayUnit displayUnit;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    private PolicySettings settings;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static PolicyVersionEntity fromDomain(PolicyVersion version) {
        return new PolicyVersionEntity(
            version.getId(),
            version.getPolicyId(),
            version.getVersion(),
            version.getEffectiveFrom(),
            version.getEffectiveTo(),
            version.getKind(),
            version.getDisplayUnit(),
            version.getSettings(),
            version.getCreatedBy(),
            version.getCreatedAt()
        );
    }

    public PolicyVersion toDomain() {
        return new PolicyVersion(id, policyId, version, effectiveFrom, effectiveTo, kind, displayUnit,
                settings, createdBy, createdAt);
    }

    /**
     * Closes this version. The only mutation a version ever receives.
     */
    void closeAt(LocalDate endDate) {
        if (this.effectiveTo != null) {
            throw new IllegalStateException(
                "Policy version " + id + " is already closed at " + effectiveTo);
        }
        this.effectiveTo = endDate;
    }
}
