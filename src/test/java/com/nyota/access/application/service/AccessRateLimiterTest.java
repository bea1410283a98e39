package com.nyota.access.application.service;

import com.nyota.access.config.AccessRecoveryProperties;
import com.nyota.access.domain.AccessAttempt;
import com.nyota.access.domain.AccessOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AccessRateLimiter 테스트")
class AccessRateLimiterTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 10, 12, 0);
    private static final String PHONE = "254711000000";
    private static final String ORIGIN = "10.0.0.1";

    private final AtomicLong ids = new AtomicLong();
    private InMemoryAccessAttemptRepository repository;
    private AccessRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAccessAttemptRepository();
        rateLimiter = new AccessRateLimiter(repository,
                new AccessRecoveryProperties(Duration.ofMinutes(15), 3, Duration.ofDays(365)));
    }

    private void attempt(String phone, String origin, AccessOutcome outcome, LocalDateTime at) {
        repository.save(AccessAttempt.record(ids.incrementAndGet(), phone, phone, origin,
                LocalDate.of(2026, 3, 1), outcome, outcome == AccessOutcome.SUCCESS ? "PUR-1" : null, at));
    }

    @Test
    @DisplayName("윈도우 내 시도 3회 미만 - 허용")
    void checkLockout_BelowLimit_Allowed() {
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0);
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0.plusMinutes(1));

        assertThat(rateLimiter.checkLockout(PHONE, ORIGIN, T0.plusMinutes(2))).isEmpty();
    }

    @Test
    @DisplayName("윈도우 내 시도 3회 - 가장 오래된 시도가 윈도우를 벗어날 때까지 잠금")
    void checkLockout_AtLimit_LockedUntilOldestExpires() {
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0);
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0.plusMinutes(1));
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0.plusMinutes(2));

        assertThat(rateLimiter.checkLockout(PHONE, ORIGIN, T0.plusMinutes(3)))
                .contains(Duration.ofMinutes(12));
        assertThat(rateLimiter.checkLockout(PHONE, ORIGIN, T0.plusMinutes(15))).isEmpty();
    }

    @Test
    @DisplayName("잠금 중 시도는 잠금 시간을 늘리지 않음")
    void checkLockout_RateLimitedAttemptsNotCounted() {
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0);
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0.plusMinutes(1));
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0.plusMinutes(2));
        attempt(PHONE, ORIGIN, AccessOutcome.RATE_LIMITED, T0.plusMinutes(10));
        attempt(PHONE, ORIGIN, AccessOutcome.RATE_LIMITED, T0.plusMinutes(14));

        assertThat(rateLimiter.checkLockout(PHONE, ORIGIN, T0.plusMinutes(14)))
                .contains(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("성공한 시도도 횟수에 포함")
    void checkLockout_SuccessCounts() {
        attempt(PHONE, ORIGIN, AccessOutcome.SUCCESS, T0);
        attempt(PHONE, ORIGIN, AccessOutcome.SUCCESS, T0.plusMinutes(1));
        attempt(PHONE, ORIGIN, AccessOutcome.SUCCESS, T0.plusMinutes(2));

        assertThat(rateLimiter.checkLockout(PHONE, ORIGIN, T0.plusMinutes(3))).isPresent();
    }

    @Test
    @DisplayName("번호 또는 출발지가 다르면 별도 카운트")
    void checkLockout_KeyedByPhoneAndOrigin() {
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0);
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0.plusMinutes(1));
        attempt(PHONE, ORIGIN, AccessOutcome.NOT_FOUND, T0.plusMinutes(2));

        assertThat(rateLimiter.checkLockout(PHONE, "10.0.0.2", T0.plusMinutes(3))).isEmpty();
        assertThat(rateLimiter.checkLockout("254722000000", ORIGIN, T0.plusMinutes(3))).isEmpty();
    }
}
