package com.flagship.pto_ledger.request;

import com.flagship.pto_ledger.assignment.AssignmentService;
import com.flagship.pto_ledger.audit.AuditAction;
import com.flagship.pto_ledger.audit.AuditEntityType;
import com.flagship.pto_ledger.audit.AuditService;
import com.flagship.pto_ledger.directory.EmployeeDirectory;
import com.flagship.pto_ledger.directory.EmployeeSchedule;
import com.flagship.pto_ledger.directory.HolidayCalendar;
import com.flagship.pto_ledger.duration.DurationCalculator;
import com.flagship.pto_ledger.duration.WorkSchedule;
import com.flagship.pto_ledger.event.TimeOffRequestEvent;
import com.flagship.pto_ledger.exception.BalanceInvariantViolatedException;
import com.flagship.pto_ledger.exception.ConcurrencyConflictException;
import com.flagship.pto_ledger.exception.InsufficientBalanceException;
import com.flagship.pto_ledger.exception.NotFoundException;
import com.flagship.pto_ledger.exception.TimeOffException;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.ledger.BalanceKey;
import com.flagship.pto_ledger.ledger.BalanceProjector;
import com.flagship.pto_ledger.ledger.LedgerEntryType;
import com.flagship.pto_ledger.ledger.LedgerPosting;
import com.flagship.pto_ledger.ledger.LedgerPostingService;
import com.flagship.pto_ledger.ledger.LedgerSourceType;
import com.flagship.pto_ledger.observability.CorrelationContext;
import com.flagship.pto_ledger.observability.PtoMetrics;
import com.flagship.pto_ledger.outbox.OutboxService;
import com.flagship.pto_ledger.policy.PolicyService;
import com.flagship.pto_ledger.policy.PolicyVersion;
import com.flagship.pto_ledger.policy.PolicyVersionStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Time-off request workflow and its ledger effects.
 *
 * <pre>
 * submit            HOLD(-m)
 * approve           HOLD_RELEASE(+m), USAGE(-m)
 * deny              HOLD_RELEASE(+m)
 * cancel submitted  HOLD_RELEASE(+m)
 * cancel draft      nothing
 * </pre>
 *
 * Every transition is one transaction. The request row is locked first, then the balance
 * snapshot (inside {@link LedgerPostingService}); the status change, ledger entries, snapshot
 * and outbox event commit together. All request postings use the request id as source id, so a
 * retried transition cannot post twice.
 */
@Service
@Slf4j
public class TimeOffRequestService {

    static final String AGGREGATE_TYPE = "TimeOffRequest";
    private static final Set<RequestStatus> BLOCKING_STATUSES =
            EnumSet.of(RequestStatus.SUBMITTED, RequestStatus.APPROVED);

    private final TimeOffRequestRepository repository;
    private final IdempotencyService idempotencyService;
    private final PolicyService policyService;
    private final PolicyVersionStore versionStore;
    private final AssignmentService assignmentService;
    private final EmployeeDirectory employeeDirectory;
    private final HolidayCalendar holidayCalendar;
    private final DurationCalculator durationCalculator;
    private final LedgerPostingService postingService;
    private final BalanceProjector projector;
    private final OutboxService outboxService;
    private final AuditService auditService;
    private final PtoMetrics metrics;
    private final Clock clock;
    private final boolean overlapCheckEnabled;
    private final LocalTime workStart;

    public TimeOffRequestService(TimeOffRequestRepository repository,
                                 IdempotencyService idempotencyService,
                                 PolicyService policyService,
                                 PolicyVersionStore versionStore,
                                 AssignmentService assignmentService,
                                 EmployeeDirectory employeeDirectory,
                                 HolidayCalendar holidayCalendar,
                                 DurationCalculator durationCalculator,
                                 LedgerPostingService postingService,
                                 BalanceProjector projector,
                                 OutboxService outboxService,
                                 AuditService auditService,
                                 PtoMetrics metrics,
                                 Clock clock,
                                 @Value("${pto.requests.overlap-check-enabled:true}") boolean overlapCheckEnabled,
                                 @Value("${pto.schedule.work-start:09:00}") String workStart) {
        this.repository = repository;
        this.idempotencyService = idempotencyService;
        this.policyService = policyService;
        this.versionStore = versionStore;
        this.assignmentService = assignmentService;
        this.employeeDirectory = employeeDirectory;
        this.holidayCalendar = holidayCalendar;
        this.durationCalculator = durationCalculator;
        this.postingService = postingService;
        this.projector = projector;
        this.outboxService = outboxService;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
        this.overlapCheckEnabled = overlapCheckEnabled;
        this.workStart = LocalTime.parse(workStart);
    }

    /**
     * Saves a request without holding anything.
     */
    @Transactional
    public TimeOffRequest createDraft(NewTimeOffRequest input) {
        return create(input, false);
    }

    /**
     * Creates a request directly in SUBMITTED and holds its minutes.
     *
     * @throws InsufficientBalanceException when the hold would break the policy's balance floor
     */
    @Transactional
    public TimeOffRequest submitRequest(NewTimeOffRequest input) {
        return create(input, true);
    }

    @Transactional
    public TimeOffRequest submitDraft(UUID companyId, UUID requestId, UUID actorId) {
        return transition(companyId, requestId, RequestStatus.SUBMITTED, "submit", actorId, request -> {
            TimeOffRequest submitted = request.submit(clock.instant());
            PolicyVersion version = requireSubmittable(submitted, scheduleOf(submitted));
            placeHold(submitted, version);
            return submitted;
        });
    }

    @Transactional
    public TimeOffRequest approveRequest(UUID companyId, UUID requestId, UUID approverId, String note) {
        return transition(companyId, requestId, RequestStatus.APPROVED, "approve", approverId, request -> {
            TimeOffRequest approved = request.approve(approverId, note, clock.instant());
            int minutes = approved.getRequestedMinutes();
            settleHold(approved, List.of(
                requestPosting(approved, LedgerEntryType.HOLD_RELEASE, minutes, "approve"),
                requestPosting(approved, LedgerEntryType.USAGE, -minutes, "approve")));
            return approved;
        });
    }

    @Transactional
    public TimeOffRequest denyRequest(UUID companyId, UUID requestId, UUID approverId, String note) {
        return transition(companyId, requestId, RequestStatus.DENIED, "deny", approverId, request -> {
            TimeOffRequest denied = request.deny(approverId, note, clock.instant());
            settleHold(denied, List.of(
                requestPosting(denied, LedgerEntryType.HOLD_RELEASE, denied.getRequestedMinutes(), "deny")));
            return denied;
        });
    }

    @Transactional
    public TimeOffRequest cancelRequest(UUID companyId, UUID requestId, UUID actorId) {
        return transition(companyId, requestId, RequestStatus.CANCELLED, "cancel", actorId, request -> {
            boolean held = request.holdsBalance();
            TimeOffRequest cancelled = request.cancel(actorId, clock.instant());
            if (held) {
                settleHold(cancelled, List.of(
                    requestPosting(cancelled, LedgerEntryType.HOLD_RELEASE, cancelled.getRequestedMinutes(), "cancel")));
            }
            return cancelled;
        });
    }

    @Transactional(readOnly = true)
    public TimeOffRequest getRequest(UUID companyId, UUID requestId) {
        return load(companyId, requestId);
    }

    /**
     * Requests of an employee, latest start first, optionally filtered by status.
     */
    @Transactional(readOnly = true)
    public List<TimeOffRequest> listRequests(UUID companyId, UUID employeeId, RequestStatus status) {
        List<TimeOffRequestEntity> rows = status == null
            ? repository.findByCompanyIdAndEmployeeIdOrderByStartAtDesc(companyId, employeeId)
            : repository.findByCompanyIdAndEmployeeIdAndStatusOrderByStartAtDesc(companyId, employeeId, status);
        return rows.stream().map(TimeOffRequestEntity::toDomain).toList();
    }

    private TimeOffRequest create(NewTimeOffRequest input, boolean submit) {
        String transition = submit ? "submit" : "draft";
        long startTime = System.currentTimeMillis();
        validate(input);
        UUID companyId = input.getCompanyId();
        UUID employeeId = input.getEmployeeId();

        MDC.put(CorrelationContext.EMPLOYEE_ID_MDC_KEY, employeeId.toString());
        MDC.put(CorrelationContext.POLICY_ID_MDC_KEY, input.getPolicyId().toString());
        try {
            Optional<UUID> existingId =
                idempotencyService.findRequestId(companyId, employeeId, input.getIdempotencyKey());
            if (existingId.isPresent()) {
                metrics.recordIdempotencyHit();
                MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, existingId.get().toString());
                log.info("Idempotency key already used, returning existing request");
                return load(companyId, existingId.get());
            }
            if (input.getIdempotencyKey() != null) {
                metrics.recordIdempotencyMiss();
            }

            policyService.getPolicy(companyId, input.getPolicyId());
            EmployeeSchedule schedule = employeeDirectory.getSchedule(companyId, employeeId);
            Instant startAt = resolveInstant(input.getStartAt(), input.getLocalStartAt(), schedule.getTimezone(), "start");
            Instant endAt = resolveInstant(input.getEndAt(), input.getLocalEndAt(), schedule.getTimezone(), "end");
            int minutes = chargeableMinutes(companyId, startAt, endAt, schedule);

            TimeOffRequest request = TimeOffRequest.draft(companyId, employeeId, input.getPolicyId(),
                    startAt, endAt, minutes, input.getReason(), clock.instant());
            MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, request.getId().toString());

            PolicyVersion version = null;
            if (submit) {
                request = request.submit(clock.instant());
                version = requireSubmittable(request, schedule);
            }

            TimeOffRequest persisted = insert(request, input.getIdempotencyKey()).toDomain();
            if (submit) {
                placeHold(persisted, version);
            }
            outboxService.saveEvent(AGGREGATE_TYPE, TimeOffRequestEvent.transitioned(persisted, null, input.getActorId()));
            auditService.record(companyId, input.getActorId(), AuditEntityType.REQUEST, persisted.getId(),
                    submit ? AuditAction.SUBMIT : AuditAction.CREATE, null, persisted);
            cacheKeyAfterCommit(companyId, employeeId, input.getIdempotencyKey(), persisted.getId());

            metrics.recordRequestTransition(transition, "success");
            log.info("Created time-off request: status={}, minutes={}, startAt={}, endAt={}",
                    persisted.getStatus(), minutes, startAt, endAt);
            return persisted;
        } catch (RuntimeException e) {
            metrics.recordRequestTransition(transition, outcomeOf(e));
            log.warn("Time-off request {} failed: {}", transition, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("request_" + transition, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.REQUEST_ID_MDC_KEY);
            MDC.remove(CorrelationContext.EMPLOYEE_ID_MDC_KEY);
            MDC.remove(CorrelationContext.POLICY_ID_MDC_KEY);
        }
    }

    private TimeOffRequest transition(UUID companyId, UUID requestId, RequestStatus target, String name,
                                      UUID actorId, UnaryOperator<TimeOffRequest> change) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, requestId.toString());
        try {
            projector.boundLockWait();
            TimeOffRequestEntity entity = repository.findByIdForUpdate(requestId)
                .filter(r -> r.getCompanyId().equals(companyId))
                .orElseThrow(() -> new NotFoundException("Time-off request not found: " + requestId));
            TimeOffRequest current = entity.toDomain();
            MDC.put(CorrelationContext.EMPLOYEE_ID_MDC_KEY, current.getEmployeeId().toString());
            MDC.put(CorrelationContext.POLICY_ID_MDC_KEY, current.getPolicyId().toString());

            if (current.getStatus() == target) {
                metrics.recordRequestTransition(name, "noop");
                log.info("Request already {}, nothing to do", target);
                return current;
            }

            TimeOffRequest updated = change.apply(current);
            entity.updateFromDomain(updated);
            TimeOffRequest persisted = repository.saveAndFlush(entity).toDomain();
            outboxService.saveEvent(AGGREGATE_TYPE,
                    TimeOffRequestEvent.transitioned(persisted, current.getStatus(), actorId));
            auditService.record(companyId, actorId, AuditEntityType.REQUEST, requestId, auditActionFor(target),
                    current, persisted);

            metrics.recordRequestTransition(name, "success");
            log.info("Request transitioned: {} -> {}", current.getStatus(), persisted.getStatus());
            return persisted;
        } catch (RuntimeException e) {
            metrics.recordRequestTransition(name, outcomeOf(e));
            log.warn("Request {} failed: {}", name, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("request_" + name, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.REQUEST_ID_MDC_KEY);
            MDC.remove(CorrelationContext.EMPLOYEE_ID_MDC_KEY);
            MDC.remove(CorrelationContext.POLICY_ID_MDC_KEY);
        }
    }

    /**
     * Checks that the employee is assigned to the policy on the request's start date and returns
     * the version whose rules govern the hold.
     */
    private PolicyVersion requireSubmittable(TimeOffRequest request, EmployeeSchedule schedule) {
        LocalDate startDate = request.getStartAt().atZone(schedule.getTimezone()).toLocalDate();
        assignmentService.requireActiveAssignment(request.getCompanyId(), request.getEmployeeId(),
                request.getPolicyId(), startDate);
        return versionStore.resolveEffective(request.getPolicyId(), startDate);
    }

    /**
     * Posts the HOLD under the balance lock. The overlap check runs under the same lock, so two
     * overlapping submissions for one balance cannot both pass it.
     */
    private void placeHold(TimeOffRequest request, PolicyVersion version) {
        LedgerPosting hold = requestPosting(request, LedgerEntryType.HOLD, -request.getRequestedMinutes(), "submit")
            .toBuilder().policyVersionId(version.getId()).build();
        try {
            postingService.post(balanceKeyOf(request), version.getSettings().balanceRules(), locked -> {
                rejectOverlap(request);
                return List.of(hold);
            });
        } catch (BalanceInvariantViolatedException e) {
            throw new InsufficientBalanceException(e.getAvailableMinutes(), request.getRequestedMinutes());
        }
    }

    private void settleHold(TimeOffRequest request, List<LedgerPosting> postings) {
        PolicyVersion version = versionStore.resolveEffective(request.getPolicyId(),
                request.getStartAt().atZone(scheduleOf(request).getTimezone()).toLocalDate());
        List<LedgerPosting> versioned = postings.stream()
            .map(p -> p.toBuilder().policyVersionId(version.getId()).build())
            .toList();
        postingService.post(balanceKeyOf(request), version.getSettings().balanceRules(), versioned);
    }

    private void rejectOverlap(TimeOffRequest request) {
        if (!overlapCheckEnabled) {
            return;
        }
        boolean overlapping = repository.existsOverlapping(request.getCompanyId(), request.getEmployeeId(),
                request.getPolicyId(), request.getId(), BLOCKING_STATUSES, request.getStartAt(), request.getEndAt());
        if (overlapping) {
            throw new ValidationException(String.format(
                "Request overlaps another submitted or approved request between %s and %s",
                request.getStartAt(), request.getEndAt()));
        }
    }

    private LedgerPosting requestPosting(TimeOffRequest request, LedgerEntryType type, int amount, String transition) {
        return LedgerPosting.builder()
            .entryType(type)
            .amountMinutes(amount)
            .sourceType(LedgerSourceType.REQUEST)
            .sourceId(request.getId().toString())
            .effectiveAt(request.getStartAt())
            .metadata(Map.of("requestId", request.getId().toString(), "transition", transition))
            .build();
    }

    private int chargeableMinutes(UUID companyId, Instant startAt, Instant endAt, EmployeeSchedule schedule) {
        ZoneId zone = schedule.getTimezone();
        LocalDate from = startAt.atZone(zone).toLocalDate().minusDays(1);
        LocalDate to = endAt.atZone(zone).toLocalDate();
        Set<LocalDate> holidays = from.isAfter(to) ? Set.of() : holidayCalendar.listHolidays(companyId, from, to);

        int minutes = durationCalculator.computeMinutes(startAt, endAt, WorkSchedule.of(schedule, workStart), holidays);
        if (minutes <= 0) {
            throw new ValidationException(String.format(
                "Requested range %s to %s covers no working time", startAt, endAt));
        }
        return minutes;
    }

    private TimeOffRequestEntity insert(TimeOffRequest request, String idempotencyKey) {
        try {
            return repository.saveAndFlush(TimeOffRequestEntity.fromDomain(request, idempotencyKey));
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey == null) {
                throw e;
            }
            // The key was claimed by a concurrent submission; a retry returns that request.
            throw new ConcurrencyConflictException("Idempotency key is in use by a concurrent request: " + idempotencyKey, e);
        }
    }

    private void cacheKeyAfterCommit(UUID companyId, UUID employeeId, String idempotencyKey, UUID requestId) {
        if (idempotencyKey == null || !TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyService.storeIdempotencyKey(companyId, employeeId, idempotencyKey, requestId);
            }
        });
    }

    private TimeOffRequest load(UUID companyId, UUID requestId) {
        return repository.findById(requestId)
            .filter(r -> r.getCompanyId().equals(companyId))
            .map(TimeOffRequestEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Time-off request not found: " + requestId));
    }

    private EmployeeSchedule scheduleOf(TimeOffRequest request) {
        return employeeDirectory.getSchedule(request.getCompanyId(), request.getEmployeeId());
    }

    private static BalanceKey balanceKeyOf(TimeOffRequest request) {
        return BalanceKey.of(request.getCompanyId(), request.getEmployeeId(), request.getPolicyId());
    }

    private static Instant resolveInstant(Instant instant, LocalDateTime local, ZoneId zone, String field) {
        if (instant != null) {
            return instant;
        }
        if (local != null) {
            return local.atZone(zone).toInstant();
        }
        throw new ValidationException("Request " + field + " time is required");
    }

    private static void validate(NewTimeOffRequest input) {
        if (input == null || input.getCompanyId() == null || input.getEmployeeId() == null
                || input.getPolicyId() == null) {
            throw new ValidationException("Request requires companyId, employeeId and policyId");
        }
        if (input.getReason() != null && input.getReason().length() > 2000) {
            throw new ValidationException("Request reason is limited to 2000 characters");
        }
    }

    private static AuditAction auditActionFor(RequestStatus target) {
        return switch (target) {
            case SUBMITTED -> AuditAction.SUBMIT;
            case APPROVED -> AuditAction.APPROVE;
            case DENIED -> AuditAction.DENY;
            case CANCELLED -> AuditAction.CANCEL;
            case DRAFT -> AuditAction.UPDATE;
        };
    }

    private static String outcomeOf(RuntimeException e) {
        return e instanceof TimeOffException timeOff ? timeOff.getErrorCode().toLowerCase() : "error";
    }
}
