package com.nyota.purchase.domain;

public enum PurchaseStatus {
    PENDING,     // 게이트웨이 콜백 대기 (구매자 휴대폰으로 결제 요청 전송됨)
    COMPLETED,   // 결제 완료 (성공 콜백 반영)
    FAILED,      // 결제 실패 (실패 콜백 또는 대기 시간 초과), 재시도 가능
    CANCELLED,   // 구매자 취소
    TIMED_OUT    // 클라이언트 측 대기 만료, 재시도 가능
}
