package com.nyota.access.domain;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 라이브러리 접근 권한. 세션은 구매자 휴대폰 번호에 묶인다.
 *
 * @param phoneNumber         정규화된 구매자 번호
 * @param purchaseIds         접근 가능한 완료 구매 목록
 * @param expiresAt           세션 만료 시각
 */
public record AccessGrant(
        String phoneNumber,
        List<String> purchaseIds,
        LocalDateTime expiresAt
) {
}
