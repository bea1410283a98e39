package com.nyota.purchase.domain;

/**
 * 게이트웨이 콜백이 원장에 반영된 방식
 */
public enum CallbackResolution {
    APPLIED,                // 상태 전이 발생
    DUPLICATE,              // 이미 처리된 결과, 변경 없음
    RECORDED_AFTER_CANCEL   // 취소된 구매에 대한 늦은 콜백, 감사용으로만 기록
}
