package com.nyota.purchase.application.port.out;

import com.nyota.purchase.adapter.out.gateway.dto.GatewayPushRequest;
import com.nyota.purchase.adapter.out.gateway.dto.GatewayPushResponse;

public interface MobilePaymentGateway {

    // 구매자 휴대폰으로 결제 승인 요청(푸시) 전송, 최종 결과는 웹훅으로 비동기 수신
    GatewayPushResponse pushPayment(GatewayPushRequest request);
}
