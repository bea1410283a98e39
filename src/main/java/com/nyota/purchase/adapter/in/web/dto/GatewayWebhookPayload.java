package com.nyota.purchase.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 게이트웨이 결제 결과 콜백 본문
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayWebhookPayload(
        String gatewayReference,
        // SUCCESS | FAILED
        String outcome,
        Long amount,
        String transactionId,
        String resultDescription,
        // 서명 헤더를 보낼 수 없는 게이트웨이용 공유 secret
        String secret
) {
    @Override
    public String toString() {
        return "GatewayWebhookPayload[gatewayReference=" + gatewayReference + ", outcome=" + outcome
                + ", amount=" + amount + ", transactionId=" + transactionId + "]";
    }
}
