package com.flagship.pto_ledger.policy;

import com.flagship.pto_ledger.policy.dto.CreatePolicyBody;
import com.flagship.pto_ledger.policy.dto.PolicyResponse;
import com.flagship.pto_ledger.policy.dto.PolicyVersionBody;
import com.flagship.pto_ledger.policy.dto.PolicyVersionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Policies and their versions. A rule change is a new version, never an edit.
 */
@RestController
@RequestMapping("/api/companies/{companyId}/policies")
@RequiredArgsConstructor
public class PolicyController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final PolicyService policyService;
    private final PolicyVersionStore versionStore;

    @PostMapping
    public ResponseEntity<PolicyResponse> createPolicy(
            @PathVariable("companyId") UUID companyId,
            @Valid @RequestBody CreatePolicyBody body,
            @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
        TimeOffPolicy policy = policyService.createPolicy(companyId, body.getKey(), body.getName(),
                body.getCategory(), body.getVersion().toCommand(actorId));
        return ResponseEntity.status(HttpStatus.CREATED).body(withCurrentVersion(policy));
    }

    @GetMapping
    public List<PolicyResponse> listPolicies(@PathVariable("companyId") UUID companyId) {
        return policyService.listPolicies(companyId).stream()
            .map(this::withCurrentVersion)
            .toList();
    }

    @GetMapping("/{policyId}")
    public PolicyResponse getPolicy(@PathVariable("companyId") UUID companyId,
                                    @PathVariable("policyId") UUID policyId) {
        return withCurrentVersion(policyService.getPolicy(companyId, policyId));
    }

    @PostMapping("/{policyId}/versions")
    public ResponseEntity<PolicyVersionResponse> createVersion(
            @PathVariable("companyId") UUID companyId,
            @PathVariable("policyId") UUID policyId,
            @Valid @RequestBody PolicyVersionBody body,
            @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
        policyService.getPolicy(companyId, policyId);
        PolicyVersion created = versionStore.create(policyId, body.toCommand(actorId));
        return ResponseEntity.status(HttpStatus.CREATED).body(PolicyVersionResponse.from(created));
    }

    @GetMapping("/{policyId}/versions")
    public List<PolicyVersionResponse> listVersions(@PathVariable("companyId") UUID companyId,
                                                    @PathVariable("policyId") UUID policyId) {
        policyService.getPolicy(companyId, policyId);
        return versionStore.listVersions(policyId).stream()
            .map(PolicyVersionResponse::from)
            .toList();
    }

    @GetMapping("/{policyId}/versions/effective")
    public PolicyVersionResponse effectiveVersion(
            @PathVariable("companyId") UUID companyId,
            @PathVariable("policyId") UUID policyId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        policyService.getPolicy(companyId, policyId);
        return PolicyVersionResponse.from(versionStore.resolveEffective(policyId, date));
    }

    private PolicyResponse withCurrentVersion(TimeOffPolicy policy) {
        return PolicyResponse.from(policy, PolicyVersionResponse.from(versionStore.current(policy.getId())));
    }
}
