package com.aera.backend.modules.invitation.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.aera.backend.modules.invitation.domain.HouseholdInvitation;
import com.aera.backend.modules.invitation.domain.InvitationStatus;

public interface HouseholdInvitationRepository extends JpaRepository<HouseholdInvitation, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from HouseholdInvitation i where i.id = :id")
    Optional<HouseholdInvitation> findByIdForUpdate(@Param("id") UUID id);

    @Query("select i.household.id from HouseholdInvitation i where i.id = :id")
    Optional<UUID> findHouseholdIdById(@Param("id") UUID id);

    /**
     * Codes are reused once released, so the newest row wins.
     */
    Optional<HouseholdInvitation> findFirstByCodeOrderByCreatedAtDesc(String code);

    @Query("""
            select i.code from HouseholdInvitation i
             where i.household.id = :householdId
               and i.status = :status
            """)
    List<String> findCodesByHouseholdIdAndStatus(
            @Param("householdId") UUID householdId,
            @Param("status") InvitationStatus status);

    @Query("""
            select i.id from HouseholdInvitation i
             where i.status = com.aera.backend.modules.invitation.domain.InvitationStatus.PENDING
               and i.expiresAt <= :now
             order by i.expiresAt asc
            """)
    List<UUID> findOverduePendingIds(@Param("now") OffsetDateTime now, Pageable pageable);

    @Modifying(flushAutomatically = true)
    @Query("delete from HouseholdInvitation i where i.household.id = :householdId")
    int deleteByHouseholdId(@Param("householdId") UUID householdId);
}
