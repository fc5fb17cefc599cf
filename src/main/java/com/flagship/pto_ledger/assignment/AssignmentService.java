package com.flagship.pto_ledger.assignment;

import com.flagship.pto_ledger.audit.AuditAction;
import com.flagship.pto_ledger.audit.AuditEntityType;
import com.flagship.pto_ledger.audit.AuditService;
import com.flagship.pto_ledger.exception.NotFoundException;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.policy.PolicyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Employee-to-policy assignments. An employee holds at most one assignment per policy on any date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentService {

    private final AssignmentRepository repository;
    private final PolicyService policyService;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Assigns a policy over {@code [effectiveFrom, effectiveTo)}.
     *
     * Runs under the policy header lock, so two concurrent assignments for the same employee
     * cannot both pass the overlap check.
     */
    @Transactional
    public Assignment assign(UUID companyId, UUID employeeId, UUID policyId,
                             LocalDate effectiveFrom, LocalDate effectiveTo, UUID createdBy) {
        if (employeeId == null || effectiveFrom == null) {
            throw new ValidationException("Assignment requires employeeId and effectiveFrom");
        }
        if (effectiveTo != null && !effectiveTo.isAfter(effectiveFrom)) {
            throw new ValidationException("Assignment effectiveTo must be after effectiveFrom");
        }
        policyService.lockPolicy(companyId, policyId);
        rejectOverlap(companyId, employeeId, policyId, null, effectiveFrom, effectiveTo);

        Assignment assignment = Assignment.create(companyId, employeeId, policyId, effectiveFrom, effectiveTo,
                createdBy, clock.instant());
        AssignmentEntity saved = repository.save(AssignmentEntity.fromDomain(assignment));
        auditService.record(companyId, createdBy, AuditEntityType.ASSIGNMENT, saved.getId(), AuditAction.CREATE,
                null, assignment);
        log.info("Assigned policy: assignmentId={}, employeeId={}, policyId={}, from={}, to={}",
                saved.getId(), employeeId, policyId, effectiveFrom, effectiveTo);
        return saved.toDomain();
    }

    /**
     * Sets the end date of an assignment. Moving the end later is allowed only while the
     * widened interval stays clear of the employee's other assignments to the policy.
     */
    @Transactional
    public Assignment endAssignment(UUID companyId, UUID assignmentId, LocalDate effectiveTo, UUID actorId) {
        AssignmentEntity entity = repository.findById(assignmentId)
            .filter(a -> a.getCompanyId().equals(companyId))
            .orElseThrow(() -> new NotFoundException("Assignment not found: " + assignmentId));
        if (effectiveTo == null || !effectiveTo.isAfter(entity.getEffectiveFrom())) {
            throw new ValidationException("Assignment effectiveTo must be after effectiveFrom " + entity.getEffectiveFrom());
        }
        policyService.lockPolicy(companyId, entity.getPolicyId());
        rejectOverlap(companyId, entity.getEmployeeId(), entity.getPolicyId(), assignmentId,
                entity.getEffectiveFrom(), effectiveTo);

        Assignment before = entity.toDomain();
        entity.endAt(effectiveTo);
        Assignment after = repository.save(entity).toDomain();
        auditService.record(companyId, actorId, AuditEntityType.ASSIGNMENT, assignmentId, AuditAction.UPDATE,
                before, after);
        log.info("Ended assignment: assignmentId={}, effectiveTo={}", assignmentId, effectiveTo);
        return after;
    }

    private void rejectOverlap(UUID companyId, UUID employeeId, UUID policyId, UUID excludedId,
                               LocalDate effectiveFrom, LocalDate effectiveTo) {
        boolean overlapping = repository.findByCompanyIdAndEmployeeIdAndPolicyId(companyId, employeeId, policyId)
            .stream()
            .filter(existing -> !existing.getId().equals(excludedId))
            .map(AssignmentEntity::toDomain)
            .anyMatch(existing -> existing.overlaps(effectiveFrom, effectiveTo));
        if (overlapping) {
            throw new ValidationException(String.format(
                "Employee %s already has an assignment to policy %s overlapping [%s, %s)",
                employeeId, policyId, effectiveFrom, effectiveTo));
        }
    }

    /**
     * Every assignment active on {@code onDate}; all companies when {@code companyId} is null.
     */
    @Transactional(readOnly = true)
    public List<Assignment> findActiveAssignments(LocalDate onDate, UUID companyId) {
        List<AssignmentEntity> rows = companyId == null
            ? repository.findActiveOn(onDate)
            : repository.findActiveOnForCompany(companyId, onDate);
        return rows.stream().map(AssignmentEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public List<Assignment> findActiveAssignments(UUID companyId, UUID employeeId, LocalDate onDate) {
        return repository.findActiveOnForEmployee(companyId, employeeId, onDate).stream()
            .map(AssignmentEntity::toDomain)
            .toList();
    }

    /**
     * @throws ValidationException when the employee has no assignment to the policy on {@code onDate}
     */
    @Transactional(readOnly = true)
    public Assignment requireActiveAssignment(UUID companyId, UUID employeeId, UUID policyId, LocalDate onDate) {
        return repository.findByCompanyIdAndEmployeeIdAndPolicyId(companyId, employeeId, policyId).stream()
            .map(AssignmentEntity::toDomain)
            .filter(a -> a.covers(onDate))
            .findFirst()
            .orElseThrow(() -> new ValidationException(String.format(
                "Employee %s has no active assignment to policy %s on %s", employeeId, policyId, onDate)));
    }

    @Transactional(readOnly = true)
    public List<Assignment> listAssignments(UUID companyId, UUID employeeId) {
        return repository.findByCompanyIdAndEmployeeIdOrderByEffectiveFromAsc(companyId, employeeId).stream()
            .map(AssignmentEntity::toDomain)
            .toList();
    }
}
