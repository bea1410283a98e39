package com.nyota.purchase.adapter.out.gateway.dto;

public record GatewayPushResponse(
        // 가맹점 거래 참조
        String reference,

        // 게이트웨이 측 요청 ID
        String requestId,

        // 접수 상태 (ACCEPTED 등)
        String status
) {
}
