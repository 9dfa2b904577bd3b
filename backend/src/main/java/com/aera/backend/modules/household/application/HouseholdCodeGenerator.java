package com.aera.backend.modules.household.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.random.RandomGenerator;

import com.aera.backend.global.error.RetryableProblemException;
import com.aera.backend.modules.household.domain.ShareCodeKind;
import com.aera.backend.modules.household.infrastructure.persistence.ShareCodeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Draws short join codes and reserves them in {@code share_code}. Household and invitation
 * codes share one namespace.
 */
@Component
public class HouseholdCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(HouseholdCodeGenerator.class);

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int CODE_LENGTH = 6;
    static final int MAX_ATTEMPTS = 32;

    private final ShareCodeRepository shareCodeRepository;
    private final RandomGenerator random;
    private final Clock clock;

    @Autowired
    public HouseholdCodeGenerator(ShareCodeRepository shareCodeRepository, Clock clock) {
        this(shareCodeRepository, new SecureRandom(), clock);
    }

    HouseholdCodeGenerator(ShareCodeRepository shareCodeRepository, RandomGenerator random, Clock clock) {
        this.shareCodeRepository = shareCodeRepository;
        this.random = random;
        this.clock = clock;
    }

    @Transactional
    public String generate(ShareCodeKind kind) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String candidate = draw();
            if (shareCodeRepository.reserve(candidate, kind.name(), now) == 1) {
                return candidate;
            }
            log.debug("Share code collision on attempt {}", attempt);
        }
        log.warn("No free share code after {} attempts (kind={})", MAX_ATTEMPTS, kind);
        throw new RetryableProblemException(
                HttpStatus.SERVICE_UNAVAILABLE,
                "CODE_SPACE_EXHAUSTED",
                "could not allocate a unique code",
                1
        );
    }

    @Transactional
    public void release(String code) {
        if (code != null) {
            shareCodeRepository.release(code);
        }
    }

    String draw() {
        StringBuilder builder = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }
}
