package com.nyota.access.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 접근 복구 잠금 정책. (번호, 출발지) 조합당 window 안에서 maxAttempts 회까지 시도할 수 있다.
 */
@ConfigurationProperties(prefix = "nyota.access")
public record AccessRecoveryProperties(
        @DefaultValue("15m") Duration window,
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("365d") Duration sessionLifetime
) {
}
