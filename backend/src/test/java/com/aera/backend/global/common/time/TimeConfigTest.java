package com.aera.backend.global.common.time;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class TimeConfigTest {

    @Test
    void auditingTimestampsComeFromTheSharedClock() {
        Instant pinned = Instant.parse("2025-06-01T09:30:00Z");
        TimeConfig config = new TimeConfig();

        assertThat(config.auditingDateTimeProvider(Clock.fixed(pinned, ZoneOffset.UTC)).getNow())
                .contains(OffsetDateTime.ofInstant(pinned, ZoneOffset.UTC));
    }

    @Test
    void householdClockIsUtc() {
        assertThat(new TimeConfig().householdClock().getZone()).isEqualTo(ZoneOffset.UTC);
    }
}
