package com.flagship.pto_ledger.request;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TimeOffRequestRepository extends JpaRepository<TimeOffRequestEntity, UUID> {

    /**
     * Row lock taken before the balance lock by every transition.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM TimeOffRequestEntity r WHERE r.id = :id")
    Optional<TimeOffRequestEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<TimeOffRequestEntity> findByCompanyIdAndEmployeeIdAndIdempotencyKey(
            UUID companyId, UUID employeeId, String idempotencyKey);

    long countByStatus(RequestStatus status);

    List<TimeOffRequestEntity> findByCompanyIdAndEmployeeIdOrderByStartAtDesc(UUID companyId, UUID employeeId);

    List<TimeOffRequestEntity> findByCompanyIdAndEmployeeIdAndStatusOrderByStartAtDesc(
            UUID companyId, UUID employeeId, RequestStatus status);

    /**
     * Whether another request of the same employee and policy, in one of {@code statuses},
     * intersects {@code [startAt, endAt)}.
     */
    @Query("""
            SELECT CASE WHEN COUNT(r) > 0 THEN true ELSE false END
            FROM TimeOffRequestEntity r
            WHERE r.companyId = :companyId
              AND r.employeeId = :employeeId
              AND r.policyId = :policyId
              AND r.id <> :excludeId
              AND r.status IN :statuses
              AND r.startAt < :endAt
              AND r.endAt > :startAt
            """)
    boolean existsOverlapping(@Param("companyId") UUID companyId,
                              @Param("employeeId") UUID employeeId,
                              @Param("policyId") UUID policyId,
                              @Param("excludeId") UUID excludeId,
                              @Param("statuses") Collection<RequestStatus> statuses,
                              @Param("startAt") Instant startAt,
                              @Param("endAt") Instant endAt);
}
