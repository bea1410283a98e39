package com.nyota.purchase.application.service;

import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.common.exception.PurchaseException;
import com.nyota.purchase.domain.Purchase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseQueryService {

    private final PurchaseRepository purchaseRepository;

    // 폴링 경로 - 원장의 현재 상태를 그대로 반환
    @Transactional(readOnly = true)
    public Purchase getPurchase(String purchaseId) {
        log.debug("구매 조회 - purchaseId: {}", purchaseId);

        return purchaseRepository.findById(purchaseId)
                .orElseThrow(() -> PurchaseException.notFound(purchaseId));
    }
}
