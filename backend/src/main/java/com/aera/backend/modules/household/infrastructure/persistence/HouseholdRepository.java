package com.aera.backend.modules.household.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.aera.backend.modules.household.domain.Household;

public interface HouseholdRepository extends JpaRepository<Household, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select h from Household h where h.id = :id")
    Optional<Household> findByIdForUpdate(@Param("id") UUID id);

    @Query("select h.id from Household h where h.code = :code")
    Optional<UUID> findIdByCode(@Param("code") String code);
}
