package com.flagship.pto_ledger.policy;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the policy header.
 *
 * No setters: the key and company are fixed for the life of the policy, and every rule change
 * goes through a new {@link PolicyVersionEntity}.
 */
@Entity
@Table(
    name = "time_off_policies",
    uniqueConstraints = @UniqueConstraint(name = "uq_time_off_policies_key", columnNames = {"company_id", "policy_key"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeOffPolicyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(name = "policy_key", nullable = false, updatable = false, length = 100)
    private String policyKey;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PolicyCategory category;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static TimeOffPolicyEntity fromDomain(TimeOffPolicy policy) {
        return new TimeOffPolicyEntity(
            policy.getId(),
            policy.getCompanyId(),
            policy.getKey(),
            policy.getName(),
            policy.getCategory(),
            policy.getCreatedBy(),
            policy.getCreatedAt(),
            policy.getCreatedAt()
        );
    }

    public TimeOffPolicy toDomain() {
        return new TimeOffPolicy(id, companyId, policyKey, name, category, createdBy, createdAt);
    }
}
