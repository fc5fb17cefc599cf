package com.flagship.pto_ledger.assignment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface AssignmentRepository extends JpaRepository<AssignmentEntity, UUID> {

    @Query("""
        SELECT a FROM AssignmentEntity a
        WHERE a.effectiveFrom <= :onDate
          AND (a.effectiveTo IS NULL OR a.effectiveTo > :onDate)
        ORDER BY a.companyId, a.employeeId, a.policyId
        """)
    List<AssignmentEntity> findActiveOn(@Param("onDate") LocalDate onDate);

    @Query("""
        SELECT a FROM AssignmentEntity a
        WHERE a.companyId = :companyId
          AND a.effectiveFrom <= :onDate
          AND (a.effectiveTo IS NULL OR a.effectiveTo > :onDate)
        ORDER BY a.employeeId, a.policyId
        """)
    List<AssignmentEntity> findActiveOnForCompany(@Param("companyId") UUID companyId,
                                                  @Param("onDate") LocalDate onDate);

    @Query("""
        SELECT a FROM AssignmentEntity a
        WHERE a.companyId = :companyId
          AND a.employeeId = :employeeId
          AND a.effectiveFrom <= :onDate
          AND (a.effectiveTo IS NULL OR a.effectiveTo > :onDate)
        ORDER BY a.policyId
        """)
    List<AssignmentEntity> findActiveOnForEmployee(@Param("companyId") UUID companyId,
                                                   @Param("employeeId") UUID employeeId,
                                                   @Param("onDate") LocalDate onDate);

    List<AssignmentEntity> findByCompanyIdAndEmployeeIdAndPolicyId(UUID companyId, UUID employeeId, UUID policyId);

    List<AssignmentEntity> findByCompanyIdAndEmployeeIdOrderByEffectiveFromAsc(UUID companyId, UUID employeeId);
}
