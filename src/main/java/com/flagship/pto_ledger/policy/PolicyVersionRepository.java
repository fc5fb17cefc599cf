package com.flagship.pto_ledger.policy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PolicyVersionRepository extends JpaRepository<PolicyVersionEntity, UUID> {

    Optional<PolicyVersionEntity> findTopByPolicyIdOrderByVersionDesc(UUID policyId);

    List<PolicyVersionEntity> findByPolicyIdOrderByVersionDesc(UUID policyId);

    /**
     * Versions whose half-open interval contains {@code onDate}, highest version first.
     * Normally at most one row; a same-day replacement leaves the older version with an empty
     * interval, which never matches.
     */
    @Query("""
        SELECT v FROM PolicyVersionEntity v
        WHERE v.policyId = :policyId
          AND v.effectiveFrom <= :onDate
          AND (v.effectiveTo IS NULL OR v.effectiveTo > :onDate)
        ORDER BY v.version DESC
        """)
    List<PolicyVersionEntity> findCovering(@Param("policyId") UUID policyId, @Param("onDate") LocalDate onDate);
}
