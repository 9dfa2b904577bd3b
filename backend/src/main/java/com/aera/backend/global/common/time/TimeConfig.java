package com.aera.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * One UTC clock for services, schedulers and JPA auditing. Invitation expiry checks and the
 * {@code created_at}/{@code updated_at} stamps therefore read the same time source.
 */
@Configuration
public class TimeConfig {

    public static final String AUDITING_DATE_TIME_PROVIDER = "auditingDateTimeProvider";

    @Bean
    public Clock householdClock() {
        return Clock.systemUTC();
    }

    @Bean(AUDITING_DATE_TIME_PROVIDER)
    public DateTimeProvider auditingDateTimeProvider(Clock householdClock) {
        return () -> Optional.of(OffsetDateTime.now(householdClock));
    }
}
