package com.flagship.pto_ledger.assignment;

import com.flagship.pto_ledger.audit.AuditAction;
import com.flagship.pto_ledger.audit.AuditEntityType;
import com.flagship.pto_ledger.audit.AuditService;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.policy.PolicyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Overlap rules for assignments with the repository mocked out.
 */
class AssignmentServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-15T10:00:00Z");

    private final UUID companyId = UUID.randomUUID();
    private final UUID employeeId = UUID.randomUUID();
    private final UUID policyId = UUID.randomUUID();

    private AssignmentRepository repository;
    private PolicyService policyService;
    private AuditService auditService;
    private AssignmentService service;

    private AssignmentEntity closed;
    private AssignmentEntity later;

    @BeforeEach
    void setUp() {
        repository = mock(AssignmentRepository.class);
        policyService = mock(PolicyService.class);
        auditService = mock(AuditService.class);
        service = new AssignmentService(repository, policyService, auditService, Clock.fixed(NOW, ZoneOffset.UTC));

        closed = entity(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 1));
        later = entity(LocalDate.of(2024, 3, 1), null);
        when(repository.findById(closed.getId())).thenReturn(Optional.of(closed));
        when(repository.findByCompanyIdAndEmployeeIdAndPolicyId(companyId, employeeId, policyId))
            .thenReturn(List.of(closed, later));
        when(repository.save(any(AssignmentEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private AssignmentEntity entity(LocalDate from, LocalDate to) {
        return AssignmentEntity.fromDomain(
            Assignment.create(companyId, employeeId, policyId, from, to, null, NOW.minusSeconds(86_400)));
    }

    @Test
    @DisplayName("Extending a closed assignment across a later one is rejected")
    void extendingAcrossLaterAssignmentIsRejected() {
        assertThrows(ValidationException.class,
            () -> service.endAssignment(companyId, closed.getId(), LocalDate.of(2024, 6, 1), null));

        assertEquals(LocalDate.of(2024, 3, 1), closed.getEffectiveTo());
        verify(repository, never()).save(any());
        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("Shortening an assignment ignores its own current interval")
    void shorteningIsAllowed() {
        Assignment shortened = service.endAssignment(companyId, closed.getId(), LocalDate.of(2024, 2, 15), null);

        assertEquals(LocalDate.of(2024, 2, 15), shortened.getEffectiveTo());
        assertFalse(shortened.overlaps(later.getEffectiveFrom(), later.getEffectiveTo()));
        verify(auditService).record(eq(companyId), isNull(), eq(AuditEntityType.ASSIGNMENT), eq(closed.getId()),
                eq(AuditAction.UPDATE), any(Assignment.class), eq(shortened));
    }

    @Test
    @DisplayName("Both writers take the policy lock before reading existing assignments")
    void writersLockPolicyFirst() {
        service.endAssignment(companyId, closed.getId(), LocalDate.of(2024, 2, 15), null);
        assertThrows(ValidationException.class, () -> service.assign(companyId, employeeId, policyId,
                LocalDate.of(2024, 4, 1), null, null));

        InOrder order = inOrder(policyService, repository);
        order.verify(policyService).lockPolicy(companyId, policyId);
        order.verify(repository).findByCompanyIdAndEmployeeIdAndPolicyId(companyId, employeeId, policyId);
        order.verify(policyService).lockPolicy(companyId, policyId);
        order.verify(repository).findByCompanyIdAndEmployeeIdAndPolicyId(companyId, employeeId, policyId);
    }

    @Test
    @DisplayName("New assignments carry the service clock's timestamp")
    void createdAtComesFromClock() {
        when(repository.findByCompanyIdAndEmployeeIdAndPolicyId(companyId, employeeId, policyId))
            .thenReturn(List.of(closed));

        Assignment created = service.assign(companyId, employeeId, policyId, LocalDate.of(2024, 3, 1), null, null);

        assertEquals(NOW, created.getCreatedAt());
    }
}
