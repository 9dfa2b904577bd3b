package com.aera.backend.modules.household.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.aera.backend.modules.household.domain.HouseholdMembership;
import com.aera.backend.modules.household.domain.HouseholdRole;

public interface HouseholdMembershipRepository extends JpaRepository<HouseholdMembership, UUID> {

    Optional<HouseholdMembership> findByHouseholdIdAndUserId(UUID householdId, UUID userId);

    Optional<HouseholdMembership> findByHouseholdIdAndRole(UUID householdId, HouseholdRole role);

    boolean existsByHouseholdIdAndUserId(UUID householdId, UUID userId);

    boolean existsByUserIdAndRole(UUID userId, HouseholdRole role);

    long countByHouseholdId(UUID householdId);

    @Query("""
            select m from HouseholdMembership m
              join fetch m.household h
             where m.userId = :userId
             order by m.joinedAt asc, m.id asc
            """)
    List<HouseholdMembership> findAllByUserIdWithHousehold(@Param("userId") UUID userId);

    @Query("""
            select m from HouseholdMembership m
             where m.household.id = :householdId
             order by m.joinedAt asc, m.id asc
            """)
    List<HouseholdMembership> findAllByHouseholdIdOrderByJoinedAt(@Param("householdId") UUID householdId);

    @Query("""
            select m.household.id from HouseholdMembership m
             where m.userId = :userId
             order by m.joinedAt asc, m.id asc
            """)
    List<UUID> findHouseholdIdsByUserId(@Param("userId") UUID userId);
}
