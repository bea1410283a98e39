package com.nyota.purchase.adapter.in.web.dto;

import com.nyota.purchase.application.dto.PurchaseStatusEvent;
import com.nyota.purchase.domain.Purchase;

public record RetryResponse(
        String purchaseId,

        // 새 게이트웨이 참조
        String gatewayReference,

        // 새 채널 ID, 이 채널로 다시 구독해야 한다
        String channelId,

        String status,

        String message,

        int attemptCount
) {
    public static RetryResponse from(Purchase purchase, PurchaseStatusEvent statusEvent) {
        return new RetryResponse(
                purchase.getPurchaseId(),
                purchase.getGatewayReference(),
                purchase.getChannelId(),
                purchase.getStatus().name(),
                statusEvent.message(),
                purchase.getAttemptCount()
        );
    }
}
