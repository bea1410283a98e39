package com.nyota.purchase.adapter.in.web.dto;

import com.nyota.purchase.application.dto.PurchaseStatusEvent;
import com.nyota.purchase.domain.Purchase;

public record CheckoutResponse(
        String purchaseId,

        // 재시도 시 소유 확인용
        String gatewayReference,

        String channelId,

        String status,

        String message
) {
    public static CheckoutResponse from(Purchase purchase, PurchaseStatusEvent statusEvent) {
        return new CheckoutResponse(
                purchase.getPurchaseId(),
                purchase.getGatewayReference(),
                purchase.getChannelId(),
                purchase.getStatus().name(),
                statusEvent.message()
        );
    }
}
