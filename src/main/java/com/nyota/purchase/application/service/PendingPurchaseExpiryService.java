package com.nyota.purchase.application.service;

import com.nyota.purchase.application.dto.PurchaseResolvedEvent;
import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.common.exception.PurchaseException;
import com.nyota.purchase.config.CheckoutProperties;
import com.nyota.purchase.domain.Purchase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 무한 대기 방지.
 * 클라이언트가 보고한 대기 초과는 TIMED_OUT(재시도 가능, 늦은 콜백 반영 가능)으로,
 * 서버 대기 한도를 넘긴 PENDING 은 FAILED(NO_CALLBACK) 로 확정한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PendingPurchaseExpiryService {

    private final PurchaseRepository purchaseRepository;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final CheckoutProperties checkoutProperties;
    private final Clock clock;

    @Transactional
    public Purchase reportClientTimeout(String purchaseId) {
        Purchase purchase = purchaseRepository.findByIdForUpdate(purchaseId)
                .orElseThrow(() -> PurchaseException.notFound(purchaseId));

        if (!purchase.isPending()) {
            log.info("대기 초과 보고 무시 - purchaseId: {}, status: {}", purchaseId, purchase.getStatus());
            return purchase;
        }

        purchase.markTimedOut(LocalDateTime.now(clock));
        log.info("클라이언트 대기 초과 - purchaseId: {}", purchaseId);
        return purchaseRepository.save(purchase);
    }

    @Scheduled(fixedDelayString = "${nyota.checkout.expiry-sweep-interval:PT30S}")
    public void expireStalePurchases() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(checkoutProperties.pendingTimeout());
        List<String> staleIds = purchaseRepository.findPendingIdsUpdatedBefore(
                cutoff, checkoutProperties.expirySweepBatchSize());
        if (staleIds.isEmpty()) {
            return;
        }

        log.info("콜백 미수신 구매 만료 처리 시작 - count: {}, cutoff: {}", staleIds.size(), cutoff);
        int expired = 0;
        for (String purchaseId : staleIds) {
            try {
                if (expire(purchaseId, cutoff)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("구매 만료 처리 실패 - purchaseId: {}", purchaseId, e);
            }
        }
        log.info("콜백 미수신 구매 만료 처리 완료 - expired: {}/{}", expired, staleIds.size());
    }

    boolean expire(String purchaseId, LocalDateTime cutoff) {
        Boolean expired = transactionTemplate.execute(status -> {
            Purchase purchase = purchaseRepository.findByIdForUpdate(purchaseId).orElse(null);
            // 조회 이후 콜백이 먼저 반영된 경우
            if (purchase == null || !purchase.isPending() || !purchase.getUpdatedAt().isBefore(cutoff)) {
                return false;
            }
            purchase.fail(Purchase.REASON_NO_CALLBACK, LocalDateTime.now(clock));
            Purchase saved = purchaseRepository.save(purchase);
            eventPublisher.publishEvent(PurchaseResolvedEvent.from(saved));
            return true;
        });
        return Boolean.TRUE.equals(expired);
    }
}
