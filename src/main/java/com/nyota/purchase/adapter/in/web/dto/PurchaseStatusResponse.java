package com.nyota.purchase.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.nyota.purchase.application.dto.PurchaseStatusEvent;
import com.nyota.purchase.domain.Purchase;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PurchaseStatusResponse(
        String purchaseId,

        String channelId,

        String status,

        String message,

        // COMPLETED 일 때만 포함
        String redirectUrl,

        int attemptCount,

        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime updatedAt
) {
    public static PurchaseStatusResponse from(Purchase purchase, PurchaseStatusEvent statusEvent) {
        return new PurchaseStatusResponse(
                purchase.getPurchaseId(),
                purchase.getChannelId(),
                purchase.getStatus().name(),
                statusEvent.message(),
                statusEvent.redirectUrl(),
                purchase.getAttemptCount(),
                purchase.getUpdatedAt()
        );
    }
}
