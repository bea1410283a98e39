package com.nyota.purchase.adapter.out.gateway.dto;

public record GatewayPushRequest(
        // 가맹점 거래 참조 (콜백에 그대로 돌아옴)
        String reference,

        // 결제 요청을 받을 휴대폰 번호 (정규화된 MSISDN)
        String phoneNumber,

        // 결제 금액
        Long amount,

        // 통화
        String currency,

        // 휴대폰에 표시될 설명
        String description,

        // 결과 콜백 URL
        String callbackUrl
) {
}
