package com.aera.backend.modules.household.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.aera.backend.modules.household.domain.HouseholdJoinRequest;
import com.aera.backend.modules.household.domain.JoinRequestStatus;

public interface HouseholdJoinRequestRepository extends JpaRepository<HouseholdJoinRequest, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from HouseholdJoinRequest r where r.id = :id")
    Optional<HouseholdJoinRequest> findByIdForUpdate(@Param("id") UUID id);

    @Query("select r.household.id from HouseholdJoinRequest r where r.id = :id")
    Optional<UUID> findHouseholdIdById(@Param("id") UUID id);

    @Query("""
            select r from HouseholdJoinRequest r
             where r.household.id = :householdId
               and r.requesterUserId = :requesterUserId
               and r.status = com.aera.backend.modules.household.domain.JoinRequestStatus.PENDING
            """)
    Optional<HouseholdJoinRequest> findPending(
            @Param("householdId") UUID householdId,
            @Param("requesterUserId") UUID requesterUserId);

    @Query("""
            select r from HouseholdJoinRequest r
             where r.household.id = :householdId
               and r.status = :status
             order by r.createdAt asc, r.id asc
            """)
    List<HouseholdJoinRequest> findByHouseholdIdAndStatus(
            @Param("householdId") UUID householdId,
            @Param("status") JoinRequestStatus status);

    @Query("""
            select r from HouseholdJoinRequest r
              join fetch r.household
             where r.requesterUserId = :requesterUserId
             order by r.createdAt desc, r.id desc
            """)
    List<HouseholdJoinRequest> findAllByRequesterWithHousehold(@Param("requesterUserId") UUID requesterUserId);
}
