package com.nyota.purchase.application.dto;

import com.nyota.purchase.domain.Purchase;
import com.nyota.purchase.domain.PurchaseStatus;

/**
 * 구매가 COMPLETED/FAILED 로 전이되었음을 알리는 애플리케이션 이벤트 (커밋 후 브로드캐스트)
 */
public record PurchaseResolvedEvent(
        String purchaseId,
        String channelId,
        PurchaseStatus status
) {
    public static PurchaseResolvedEvent from(Purchase purchase) {
        return new PurchaseResolvedEvent(
                purchase.getPurchaseId(),
                purchase.getChannelId(),
                purchase.getStatus()
        );
    }
}
