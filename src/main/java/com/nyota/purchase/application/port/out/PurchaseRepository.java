package com.nyota.purchase.application.port.out;

import com.nyota.purchase.domain.PhoneNumber;
import com.nyota.purchase.domain.Purchase;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface PurchaseRepository {

    // 구매 저장
    Purchase save(Purchase purchase);

    // 구매 ID로 조회 (읽기 전용 경로)
    Optional<Purchase> findById(String purchaseId);

    // 구매 ID로 조회 + 행 잠금 (상태 전이 경로)
    Optional<Purchase> findByIdForUpdate(String purchaseId);

    // 게이트웨이 참조로 조회 + 행 잠금 (웹훅 경로)
    Optional<Purchase> findByGatewayReferenceForUpdate(String gatewayReference);

    // 채널 ID로 조회 (스트리밍 연결 시 원장 상태 재확인, 체크아웃 멱등성)
    Optional<Purchase> findByChannelId(String channelId);

    // 구매자의 완료된 구매 목록 (접근 복구)
    List<Purchase> findCompletedByPhoneNumber(PhoneNumber phoneNumber);

    // 콜백 없이 대기 시간을 넘긴 PENDING 구매 ID 목록
    List<String> findPendingIdsUpdatedBefore(LocalDateTime cutoff, int limit);
}
