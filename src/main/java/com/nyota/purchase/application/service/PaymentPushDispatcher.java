package com.nyota.purchase.application.service;

import com.nyota.purchase.adapter.out.gateway.dto.GatewayPushRequest;
import com.nyota.purchase.adapter.out.gateway.dto.GatewayPushResponse;
import com.nyota.purchase.application.dto.PurchaseResolvedEvent;
import com.nyota.purchase.application.port.out.MobilePaymentGateway;
import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.common.exception.PaymentGatewayException;
import com.nyota.purchase.config.CheckoutProperties;
import com.nyota.purchase.domain.Purchase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 구매자 휴대폰으로 결제 승인 요청(푸시)을 보낸다. 트랜잭션 밖에서 호출해야 한다.
 * 게이트웨이가 요청 자체를 거부하면 해당 시도를 FAILED 로 확정한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentPushDispatcher {

    private final MobilePaymentGateway mobilePaymentGateway;
    private final PurchaseRepository purchaseRepository;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final CheckoutProperties checkoutProperties;
    private final Clock clock;

    public Purchase dispatch(Purchase purchase) {
        GatewayPushRequest request = new GatewayPushRequest(
                purchase.getGatewayReference(),
                purchase.getPhoneNumber().getValue(),
                purchase.getAmount().longValue(),
                purchase.getAmount().getCurrency(),
                purchase.getAssetReference(),
                checkoutProperties.callbackUrl()
        );

        try {
            GatewayPushResponse response = mobilePaymentGateway.pushPayment(request);
            log.info("결제 푸시 요청 완료 - purchaseId: {}, gatewayReference: {}, requestId: {}",
                    purchase.getPurchaseId(), purchase.getGatewayReference(), response.requestId());
            return purchase;
        } catch (PaymentGatewayException e) {
            log.warn("결제 푸시 요청 실패 - purchaseId: {}, error: {}", purchase.getPurchaseId(), e.getMessage());
            return markPushFailed(purchase.getPurchaseId(), purchase.getGatewayReference());
        }
    }

    private Purchase markPushFailed(String purchaseId, String gatewayReference) {
        return transactionTemplate.execute(status -> {
            Purchase locked = purchaseRepository.findByIdForUpdate(purchaseId)
                    .orElseThrow(() -> new IllegalStateException("푸시 실패 처리 중 구매 조회 실패 - purchaseId: " + purchaseId));

            // 그 사이 콜백이 먼저 도착했거나 다른 시도로 넘어간 경우 그대로 둔다
            if (!locked.isPending() || !locked.getGatewayReference().equals(gatewayReference)) {
                return locked;
            }

            locked.fail(Purchase.REASON_GATEWAY_PUSH_FAILED, LocalDateTime.now(clock));
            Purchase saved = purchaseRepository.save(locked);
            eventPublisher.publishEvent(PurchaseResolvedEvent.from(saved));
            return saved;
        });
    }
}
