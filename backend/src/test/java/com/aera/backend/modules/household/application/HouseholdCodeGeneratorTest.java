package com.aera.backend.modules.household.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.SplittableRandom;

import com.aera.backend.global.error.RetryableProblemException;
import com.aera.backend.modules.household.domain.ShareCodeKind;
import com.aera.backend.modules.household.infrastructure.persistence.ShareCodeRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class HouseholdCodeGeneratorTest {

    @Mock
    private ShareCodeRepository shareCodeRepository;

    private HouseholdCodeGenerator generator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        generator = new HouseholdCodeGenerator(shareCodeRepository, new SplittableRandom(42), clock);
    }

    @Test
    void drawsFromUnambiguousAlphabet() {
        for (int i = 0; i < 500; i++) {
            String code = generator.draw();
            assertThat(code).hasSize(HouseholdCodeGenerator.CODE_LENGTH);
            assertThat(code).matches("[ABCDEFGHJKLMNPQRSTUVWXYZ2-9]{6}");
            assertThat(code).doesNotContain("0", "O", "1", "I");
        }
    }

    @Test
    void retriesUntilReservationSucceeds() {
        when(shareCodeRepository.reserve(anyString(), eq("HOUSEHOLD"), any(OffsetDateTime.class)))
                .thenReturn(0, 0, 1);

        String code = generator.generate(ShareCodeKind.HOUSEHOLD);

        assertThat(code).hasSize(6);
        verify(shareCodeRepository, times(3)).reserve(anyString(), eq("HOUSEHOLD"), any(OffsetDateTime.class));
    }

    @Test
    void failsWithRetryableProblemWhenCodeSpaceIsExhausted() {
        when(shareCodeRepository.reserve(anyString(), eq("INVITATION"), any(OffsetDateTime.class))).thenReturn(0);

        assertThatThrownBy(() -> generator.generate(ShareCodeKind.INVITATION))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("CODE_SPACE_EXHAUSTED");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                });
        verify(shareCodeRepository, times(HouseholdCodeGenerator.MAX_ATTEMPTS))
                .reserve(anyString(), eq("INVITATION"), any(OffsetDateTime.class));
    }

    @Test
    void releaseIgnoresMissingCode() {
        generator.release(null);
        generator.release("ABC234");

        verify(shareCodeRepository, times(1)).release("ABC234");
    }
}
