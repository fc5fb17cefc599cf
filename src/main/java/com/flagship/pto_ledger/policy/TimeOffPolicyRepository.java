package com.flagship.pto_ledger.policy;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TimeOffPolicyRepository extends JpaRepository<TimeOffPolicyEntity, UUID> {

    boolean existsByCompanyIdAndPolicyKey(UUID companyId, String policyKey);

    List<TimeOffPolicyEntity> findByCompanyIdOrderByPolicyKeyAsc(UUID companyId);

    /**
     * Locks the policy header. Version creation serializes on this row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM TimeOffPolicyEntity p WHERE p.id = :id")
    Optional<TimeOffPolicyEntity> findByIdForUpdate(@Param("id") UUID id);
}
