package com.aera.backend.modules.profile.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.aera.backend.modules.profile.domain.UserProfile;

public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {

    @Query("select p.activeHouseholdId from UserProfile p where p.id = :userId")
    Optional<UUID> findActiveHouseholdId(@Param("userId") UUID userId);

    @Query("select p.organizationId from UserProfile p where p.id = :userId")
    Optional<UUID> findOrganizationId(@Param("userId") UUID userId);
}
