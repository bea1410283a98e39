package com.nyota.purchase.application.dto;

/**
 * 구매자 취소로 채널을 이벤트 없이 닫아야 함을 알리는 애플리케이션 이벤트
 */
public record PurchaseChannelClosedEvent(
        String purchaseId,
        String channelId
) {
}
