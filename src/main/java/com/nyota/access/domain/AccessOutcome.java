package com.nyota.access.domain;

public enum AccessOutcome {
    SUCCESS,      // 구매 확인, 세션 발급
    NOT_FOUND,    // 일치하는 구매 없음
    RATE_LIMITED, // 잠금 상태에서 시도 (잠금 시간 계산에서 제외)
    INVALID;      // 번호 형식 오류 (원장 조회 전 거절, 잠금 계산에서 제외)

    // 잠금 판단에 포함되는 시도인지
    public boolean countsTowardLimit() {
        return this == SUCCESS || this == NOT_FOUND;
    }
}
