package com.nyota.purchase.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CheckoutRequest(
        // 구매자 휴대폰 번호
        @NotBlank(message = "휴대폰 번호는 필수입니다")
        String phoneNumber,

        // 자산 slug 또는 구독 등급
        @NotBlank(message = "자산 참조는 필수입니다")
        @Size(max = 220, message = "자산 참조는 220자를 넘을 수 없습니다")
        String assetReference,

        // 결제 금액
        @NotNull(message = "결제 금액은 필수입니다")
        @Positive(message = "결제 금액은 0보다 커야 합니다")
        Long amount,

        // 클라이언트가 생성한 채널 ID (스트림 구독 키, 멱등성 키)
        @NotBlank(message = "채널 ID는 필수입니다")
        @Size(max = 64, message = "채널 ID는 64자를 넘을 수 없습니다")
        String channelId
) {
}
