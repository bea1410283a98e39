package com.nyota.purchase.adapter.in.web.dto;

import com.nyota.purchase.domain.CallbackResolution;

public record WebhookAckResponse(
        boolean acknowledged,
        CallbackResolution result
) {
    public static WebhookAckResponse from(CallbackResolution resolution) {
        return new WebhookAckResponse(true, resolution);
    }
}
