package com.nyota.access.application.service;

import com.nyota.access.application.port.out.AccessAttemptRepository;
import com.nyota.access.config.AccessRecoveryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * (정규화 번호, 출발지) 조합의 슬라이딩 윈도우 잠금 판단.
 * 잠금 중 시도(RATE_LIMITED)는 세지 않으므로 잠금은 가장 오래된 시도가 윈도우를 벗어나면 풀린다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessRateLimiter {

    private final AccessAttemptRepository accessAttemptRepository;
    private final AccessRecoveryProperties accessRecoveryProperties;

    /**
     * @return 잠금 상태면 해제까지 남은 시간
     */
    public Optional<Duration> checkLockout(String phoneNumber, String originAddress, LocalDateTime now) {
        Duration window = accessRecoveryProperties.window();
        int maxAttempts = accessRecoveryProperties.maxAttempts();

        List<LocalDateTime> attempts = accessAttemptRepository.findCountedAttemptTimesSince(
                phoneNumber, originAddress, now.minus(window));
        if (attempts.size() < maxAttempts) {
            return Optional.empty();
        }

        // 윈도우 내 시도 수가 maxAttempts 미만이 되는 시점
        LocalDateTime unlockAt = attempts.get(attempts.size() - maxAttempts).plus(window);
        Duration retryAfter = Duration.between(now, unlockAt);
        log.debug("접근 복구 잠금 판단 - attempts: {}, unlockAt: {}", attempts.size(), unlockAt);
        return Optional.of(retryAfter.isNegative() ? Duration.ZERO : retryAfter);
    }
}
