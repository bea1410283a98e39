package com.nyota.access.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

public record PurchaseSessionRequest(
        // 완료된 시도의 게이트웨이 참조
        @NotBlank(message = "게이트웨이 참조는 필수입니다")
        String gatewayReference,

        @NotBlank(message = "휴대폰 번호는 필수입니다")
        String phoneNumber
) {
}
