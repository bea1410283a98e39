package com.nyota.purchase.application.service;

import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.common.exception.PurchaseException;
import com.nyota.purchase.domain.PhoneNumber;
import com.nyota.purchase.domain.Purchase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseRetryService {

    private final PurchaseRepository purchaseRepository;
    private final PaymentPushDispatcher paymentPushDispatcher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * FAILED/TIMED_OUT 구매를 새 채널, 새 게이트웨이 참조로 다시 시도한다.
     * 요청의 휴대폰 번호와 게이트웨이 참조가 현재 시도와 일치해야 한다.
     */
    public Purchase retry(String purchaseId, String gatewayReference, String rawPhoneNumber) {
        PhoneNumber phoneNumber = PhoneNumber.of(rawPhoneNumber);
        log.info("결제 재시도 요청 - purchaseId: {}", purchaseId);

        Purchase retried = transactionTemplate.execute(status -> {
            Purchase purchase = purchaseRepository.findByIdForUpdate(purchaseId)
                    .orElseThrow(() -> PurchaseException.notFound(purchaseId));

            if (!purchase.isOwnedBy(phoneNumber) || !purchase.getGatewayReference().equals(gatewayReference)) {
                log.warn("재시도 요청 정보 불일치 - purchaseId: {}, phone: {}", purchaseId, phoneNumber.masked());
                throw PurchaseException.ownershipMismatch(purchaseId);
            }

            String previousReference = purchase.getGatewayReference();
            purchase.retry(UUID.randomUUID().toString(), LocalDateTime.now(clock));
            Purchase saved = purchaseRepository.save(purchase);

            log.info("재시도 준비 완료 - purchaseId: {}, attempt: {}, previousReference: {}, gatewayReference: {}",
                    saved.getPurchaseId(), saved.getAttemptCount(), previousReference, saved.getGatewayReference());
            return saved;
        });

        return paymentPushDispatcher.dispatch(retried);
    }
}
