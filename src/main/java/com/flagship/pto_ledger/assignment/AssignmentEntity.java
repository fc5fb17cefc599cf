package com.flagship.pto_ledger.assignment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "policy_assignments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AssignmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private UUID employeeId;

    @Column(name = "policy_id", nullable = false, updatable = false)
    private UUID policyId;

    @Column(name = "effective_from", nullable = false, updatable = false)
    private LocalDate effectiveFrom;

    @Column(name = "effective_to")
    private LocalDate effectiveTo;

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

    static AssignmentEntity fromDomain(Assignment assignment) {
        return new AssignmentEntity(
            assignment.getId(),
            assignment.getCompanyId(),
            assignment.getEmployeeId(),
            assignment.getPolicyId(),
            assignment.getEffectiveFrom(),
            assignment.getEffectiveTo(),
            assignment.getCreatedBy(),
            assignment.getCreatedAt()
        );
    }

    public Assignment toDomain() {
        return new Assignment(id, companyId, employeeId, policyId, effectiveFrom, effectiveTo, createdBy, createdAt);
    }

    void endAt(LocalDate effectiveTo) {
        this.effectiveTo = effectiveTo;
    }
}
