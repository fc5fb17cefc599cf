package com.flagship.pto_ledger.policy;

import com.flagship.pto_ledger.audit.AuditAction;
import com.flagship.pto_ledger.audit.AuditEntityType;
import com.flagship.pto_ledger.audit.AuditService;
import com.flagship.pto_ledger.exception.NotFoundException;
import com.flagship.pto_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Policy headers and their first version.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyService {

    private final TimeOffPolicyRepository policyRepository;
    private final PolicyVersionStore versionStore;
    private final AuditService auditService;
    private final Clock clock;

    @Transactional
    public TimeOffPolicy createPolicy(UUID companyId, String key, String name, PolicyCategory category,
                                      NewPolicyVersion firstVersion) {
        if (companyId == null || key == null || key.isBlank()) {
            throw new ValidationException("Policy requires companyId and a non-blank key");
        }
        if (policyRepository.existsByCompanyIdAndPolicyKey(companyId, key)) {
            throw new ValidationException("Policy key already exists for company: " + key);
        }

        TimeOffPolicy policy = TimeOffPolicy.create(companyId, key,
                name != null ? name : key,
                category != null ? category : PolicyCategory.OTHER,
                firstVersion.getCreatedBy(),
                clock.instant());
        TimeOffPolicyEntity saved = policyRepository.saveAndFlush(TimeOffPolicyEntity.fromDomain(policy));
        auditService.record(companyId, firstVersion.getCreatedBy(), AuditEntityType.POLICY, saved.getId(),
                AuditAction.CREATE, null, saved.toDomain());
        versionStore.create(saved.getId(), firstVersion);

        log.info("Created policy: policyId={}, companyId={}, key={}", saved.getId(), companyId, key);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public TimeOffPolicy getPolicy(UUID companyId, UUID policyId) {
        return policyRepository.findById(policyId)
            .filter(p -> p.getCompanyId().equals(companyId))
            .map(TimeOffPolicyEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Policy not found: " + policyId));
    }

    /**
     * Row-locks the policy header until the caller's transaction ends. Writers that must see each
     * other's rows for the same policy take this lock first.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TimeOffPolicy lockPolicy(UUID companyId, UUID policyId) {
        return policyRepository.findByIdForUpdate(policyId)
            .filter(p -> p.getCompanyId().equals(companyId))
            .map(TimeOffPolicyEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Policy not found: " + policyId));
    }

    @Transactional(readOnly = true)
    public List<TimeOffPolicy> listPolicies(UUID companyId) {
        return policyRepository.findByCompanyIdOrderByPolicyKeyAsc(companyId).stream()
            .map(TimeOffPolicyEntity::toDomain)
            .toList();
    }
}
