package com.flagship.pto_ledger.policy;

import com.flagship.pto_ledger.audit.AuditAction;
import com.flagship.pto_ledger.audit.AuditEntityType;
import com.flagship.pto_ledger.audit.AuditService;
import com.flagship.pto_ledger.exception.InvalidEffectiveDateException;
import com.flagship.pto_ledger.exception.NoEffectiveVersionException;
import com.flagship.pto_ledger.exception.NotFoundException;
import com.flagship.pto_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store of policy versions.
 *
 * Creating a version end-dates the current one and inserts the next number in the same
 * transaction, under a lock on the policy header, so concurrent edits cannot produce two
 * versions with the same number or overlapping open intervals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyVersionStore {

    private final TimeOffPolicyRepository policyRepository;
    private final PolicyVersionRepository versionRepository;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Creates the next version of a policy.
     *
     * @throws InvalidEffectiveDateException if {@code effectiveFrom} precedes the current version's start
     */
    @Transactional
    public PolicyVersion create(UUID policyId, NewPolicyVersion input) {
        validate(input);
        TimeOffPolicyEntity policy = policyRepository.findByIdForUpdate(policyId)
            .orElseThrow(() -> new NotFoundException("Policy not found: " + policyId));

        PolicyVersionEntity current = versionRepository.findTopByPolicyIdOrderByVersionDesc(policyId)
            .orElse(null);

        PolicyVersion created;
        if (current == null) {
            created = PolicyVersion.first(policyId, input, clock.instant());
        } else {
            if (input.getEffectiveFrom().isBefore(current.getEffectiveFrom())) {
                throw new InvalidEffectiveDateException(String.format(
                    "New version effectiveFrom %s precedes current version %d effectiveFrom %s",
                    input.getEffectiveFrom(), current.getVersion(), current.getEffectiveFrom()));
            }
            if (current.getEffectiveTo() == null) {
                PolicyVersion open = current.toDomain();
                current.closeAt(input.getEffectiveFrom());
                versionRepository.saveAndFlush(current);
                auditService.record(policy.getCompanyId(), input.getCreatedBy(), AuditEntityType.POLICY_VERSION,
                        open.getId(), AuditAction.UPDATE, open, current.toDomain());
            }
            created = current.toDomain().successor(input, clock.instant());
        }

        PolicyVersionEntity saved = versionRepository.save(PolicyVersionEntity.fromDomain(created));
        auditService.record(policy.getCompanyId(), input.getCreatedBy(), AuditEntityType.POLICY_VERSION,
                saved.getId(), AuditAction.CREATE, null, created);
        log.info("Created policy version: policyId={}, version={}, kind={}, effectiveFrom={}",
                policyId, saved.getVersion(), saved.getKind(), saved.getEffectiveFrom());
        return saved.toDomain();
    }

    /**
     * Returns the version whose interval contains {@code onDate}.
     *
     * @throws NoEffectiveVersionException when no version covers the date
     */
    @Transactional(readOnly = true)
    public PolicyVersion resolveEffective(UUID policyId, LocalDate onDate) {
        return findEffective(policyId, onDate)
            .orElseThrow(() -> new NoEffectiveVersionException(
                String.format("No version of policy %s is effective on %s", policyId, onDate)));
    }

    @Transactional(readOnly = true)
    public Optional<PolicyVersion> findEffective(UUID policyId, LocalDate onDate) {
        return versionRepository.findCovering(policyId, onDate).stream()
            .findFirst()
            .map(PolicyVersionEntity::toDomain);
    }

    /**
     * Returns the highest-numbered version, the one any new change would replace.
     */
    @Transactional(readOnly = true)
    public PolicyVersion current(UUID policyId) {
        return versionRepository.findTopByPolicyIdOrderByVersionDesc(policyId)
            .map(PolicyVersionEntity::toDomain)
            .orElseThrow(() -> new NoEffectiveVersionException("Policy has no versions: " + policyId));
    }

    @Transactional(readOnly = true)
    public List<PolicyVersion> listVersions(UUID policyId) {
        return versionRepository.findByPolicyIdOrderByVersionDesc(policyId).stream()
            .map(PolicyVersionEntity::toDomain)
            .toList();
    }

    private void validate(NewPolicyVersion input) {
        if (input == null || input.getEffectiveFrom() == null) {
            throw new ValidationException("Policy version requires effectiveFrom");
        }
        if (input.getSettings() == null) {
            throw new ValidationException("Policy version requires settings");
        }
    }
}
