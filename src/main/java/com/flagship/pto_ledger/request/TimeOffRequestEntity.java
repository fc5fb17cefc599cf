package com.flagship.pto_ledger.request;

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

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for time-off requests.
 *
 * Only the lifecycle fields are mutable. The idempotency key is a persistence concern and is
 * passed separately to {@link #fromDomain}.
 */
@Entity
@Table(name = "time_off_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeOffRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private UUID employeeId;

    @Column(name = "policy_id", nullable = false, updatable = false)
    private UUID policyId;

    @Column(name = "start_at", nullable = false, updatable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false, updatable = false)
    private Instant endAt;

    @Column(name = "requested_minutes", nullable = false, updatable = false)
    private int requestedMinutes;

    @Column(updatable = false)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RequestStatus status;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "decided_by")
    private UUID decidedBy;

    @Column(name = "decision_note")
    private String decisionNote;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

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

    static TimeOffRequestEntity fromDomain(TimeOffRequest request, String idempotencyKey) {
        return new TimeOffRequestEntity(
            request.getId(),
            request.getCompanyId(),
            request.getEmployeeId(),
            request.getPolicyId(),
            request.getStartAt(),
            request.getEndAt(),
            request.getRequestedMinutes(),
            request.getReason(),
            request.getStatus(),
            request.getSubmittedAt(),
            request.getDecidedAt(),
            request.getDecidedBy(),
            request.getDecisionNote(),
            idempotencyKey,
            request.getCreatedAt(),
            request.getUpdatedAt()
        );
    }

    public TimeOffRequest toDomain() {
        return new TimeOffRequest(
            id,
            companyId,
            employeeId,
            policyId,
            startAt,
            endAt,
            requestedMinutes,
            reason,
            status,
            submittedAt,
            decidedAt,
            decidedBy,
            decisionNote,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(TimeOffRequest request) {
        this.status = request.getStatus();
        this.submittedAt = request.getSubmittedAt();
        this.decidedAt = request.getDecidedAt();
        this.decidedBy = request.getDecidedBy();
        this.decisionNote = request.getDecisionNote();
        this.updatedAt = request.getUpdatedAt();
    }
}
