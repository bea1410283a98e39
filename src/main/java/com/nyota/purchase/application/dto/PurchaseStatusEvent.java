package com.nyota.purchase.application.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nyota.purchase.domain.PurchaseStatus;

/**
 * 구매자에게 전달되는 상태 메시지 (SSE 이벤트 본문, 폴링 응답 공통)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PurchaseStatusEvent(
        String purchaseId,
        String channelId,
        PurchaseStatus status,
        String message,
        // COMPLETED 일 때만 설정
        String redirectUrl
) {
}
