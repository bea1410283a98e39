package com.nyota.purchase.application.service;

import com.nyota.purchase.application.dto.PurchaseChannelClosedEvent;
import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.common.exception.PurchaseException;
import com.nyota.purchase.domain.Purchase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseCancelService {

    private final PurchaseRepository purchaseRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * PENDING 구매 취소. 커밋 후 채널을 이벤트 없이 닫는다.
     * 이후 도착하는 콜백은 결과만 기록된다.
     */
    @Transactional
    public Purchase cancel(String purchaseId) {
        log.info("구매 취소 시작 - purchaseId: {}", purchaseId);

        Purchase purchase = purchaseRepository.findByIdForUpdate(purchaseId)
                .orElseThrow(() -> PurchaseException.notFound(purchaseId));

        purchase.cancel(LocalDateTime.now(clock));
        Purchase saved = purchaseRepository.save(purchase);
        eventPublisher.publishEvent(new PurchaseChannelClosedEvent(saved.getPurchaseId(), saved.getChannelId()));

        log.info("구매 취소 완료 - purchaseId: {}, status: {}", saved.getPurchaseId(), saved.getStatus());
        return saved;
    }
}
