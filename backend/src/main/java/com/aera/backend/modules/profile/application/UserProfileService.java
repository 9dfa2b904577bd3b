package com.aera.backend.modules.profile.application;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.aera.backend.modules.profile.domain.UserProfile;
import com.aera.backend.modules.profile.infrastructure.persistence.UserProfileRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class UserProfileService {

    private final UserProfileRepository userProfileRepository;

    public UserProfileService(UserProfileRepository userProfileRepository) {
        this.userProfileRepository = userProfileRepository;
    }

    public UserProfile getOrCreate(UUID userId) {
        Objects.requireNonNull(userId, "userId is required");
        return userProfileRepository.findById(userId)
                .orElseGet(() -> userProfileRepository.save(new UserProfile(userId)));
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findActiveHouseholdId(UUID userId) {
        return userProfileRepository.findActiveHouseholdId(userId);
    }

    @Transactional(readOnly = true)
    public UUID findOrganizationId(UUID userId) {
        return userProfileRepository.findOrganizationId(userId).orElse(null);
    }

    /**
     * Points the user at {@code householdId} unless another household is already active.
     */
    public void fillActiveHouseholdIfEmpty(UUID userId, UUID householdId) {
        UserProfile profile = getOrCreate(userId);
        if (profile.getActiveHouseholdId() == null) {
            profile.setActiveHouseholdId(householdId);
        }
    }

    public void switchActiveHousehold(UUID userId, UUID householdId) {
        getOrCreate(userId).setActiveHouseholdId(householdId);
    }

    public void clearActiveHousehold(UUID userId, UUID householdId) {
        userProfileRepository.findById(userId)
                .filter(profile -> householdId.equals(profile.getActiveHouseholdId()))
                .ifPresent(profile -> profile.setActiveHouseholdId(null));
    }
}
