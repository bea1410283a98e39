package com.nyota.purchase.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 체크아웃 대기 정책
 *
 * @param pendingTimeout       콜백 없이 PENDING 으로 머물 수 있는 최대 시간 (초과 시 FAILED)
 * @param clientWait           클라이언트 대기 시간, SSE 연결 수명으로도 사용
 * @param currency             결제 통화
 * @param callbackUrl          게이트웨이에 전달할 웹훅 URL
 * @param expirySweepBatchSize 만료 스캔 1회당 최대 처리 건수
 */
@ConfigurationProperties(prefix = "nyota.checkout")
public record CheckoutProperties(
        @DefaultValue("10m") Duration pendingTimeout,
        @DefaultValue("60s") Duration clientWait,
        @DefaultValue("KES") String currency,
        @DefaultValue("http://localhost:8080/api/v1/webhooks/gateway") String callbackUrl,
        @DefaultValue("100") int expirySweepBatchSize
) {
}
