package com.flagship.pto_ledger.ledger;

import com.flagship.pto_ledger.event.BalanceAdjustedEvent;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.observability.CorrelationContext;
import com.flagship.pto_ledger.outbox.OutboxService;
import com.flagship.pto_ledger.policy.PolicyService;
import com.flagship.pto_ledger.policy.PolicyVersion;
import com.flagship.pto_ledger.policy.PolicyVersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Manual corrections by an administrator.
 *
 * An adjustment is a signed ADJUSTMENT entry with source ADMIN. A caller-supplied idempotency key
 * makes the adjustment safe to resend; without one every call posts a new entry. Negative
 * adjustments are subject to the balance invariant like any other reducing write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdjustmentService {

    static final String AGGREGATE_TYPE = "LedgerEntry";

    private final LedgerPostingService postingService;
    private final PolicyService policyService;
    private final PolicyVersionStore versionStore;
    private final OutboxService outboxService;
    private final Clock clock;

    @Transactional
    public AdjustmentResult createAdjustment(UUID companyId, UUID employeeId, UUID policyId, int amountMinutes,
                                             LocalDate effectiveDate, String reason, String idempotencyKey,
                                             UUID createdBy) {
        if (employeeId == null) {
            throw new ValidationException("Adjustment requires employeeId");
        }
        if (amountMinutes == 0) {
            throw new ValidationException("Adjustment amountMinutes must not be zero");
        }
        policyService.getPolicy(companyId, policyId);

        LocalDate onDate = effectiveDate != null ? effectiveDate : LocalDate.now(clock);
        PolicyVersion version = versionStore.resolveEffective(policyId, onDate);
        BalanceKey key = BalanceKey.of(companyId, employeeId, policyId);

        String sourceId = idempotencyKey != null && !idempotencyKey.isBlank()
            ? "adjustment:" + companyId + ":" + idempotencyKey
            : "adjustment:" + UUID.randomUUID();

        Map<String, Object> metadata = new HashMap<>();
        if (reason != null) {
            metadata.put("reason", reason);
        }
        if (createdBy != null) {
            metadata.put("createdBy", createdBy.toString());
        }

        LedgerPosting posting = LedgerPosting.builder()
            .entryType(LedgerEntryType.ADJUSTMENT)
            .amountMinutes(amountMinutes)
            .sourceType(LedgerSourceType.ADMIN)
            .sourceId(sourceId)
            .effectiveAt(effectiveDate != null ? onDate.atStartOfDay(ZoneOffset.UTC).toInstant() : clock.instant())
            .policyVersionId(version.getId())
            .metadata(metadata)
            .build();

        MDC.put(CorrelationContext.EMPLOYEE_ID_MDC_KEY, employeeId.toString());
        MDC.put(CorrelationContext.POLICY_ID_MDC_KEY, policyId.toString());
        try {
            PostingResult result = postingService.post(key, version.getSettings().balanceRules(), List.of(posting));
            BalanceView balance = BalanceView.of(result.getSnapshot(), version);

            if (result.wroteAnything()) {
                LedgerEntry entry = result.getInserted().get(0);
                outboxService.saveEvent(AGGREGATE_TYPE, BalanceAdjustedEvent.fromEntry(entry, reason));
                log.info("Posted adjustment: entryId={}, amount={}, available={}",
                        entry.getId(), amountMinutes, balance.getAvailableMinutes());
                return new AdjustmentResult(entry, false, balance);
            }

            LedgerEntry existing = result.getReplayed().get(0);
            log.info("Adjustment replayed: entryId={}, sourceId={}", existing.getId(), sourceId);
            return new AdjustmentResult(existing, true, balance);
        } finally {
            MDC.remove(CorrelationContext.EMPLOYEE_ID_MDC_KEY);
            MDC.remove(CorrelationContext.POLICY_ID_MDC_KEY);
        }
    }
}
