package com.nyota.purchase.application.service;

import com.nyota.purchase.application.port.out.PurchaseRepository;
import com.nyota.purchase.common.exception.PurchaseException;
import com.nyota.purchase.config.CheckoutProperties;
import com.nyota.purchase.domain.Money;
import com.nyota.purchase.domain.PhoneNumber;
import com.nyota.purchase.domain.Purchase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseCheckoutService {

    private final PurchaseRepository purchaseRepository;
    private final PaymentPushDispatcher paymentPushDispatcher;
    private final TransactionTemplate transactionTemplate;
    private final CheckoutProperties checkoutProperties;
    private final Clock clock;

    /**
     * PENDING 구매를 만들고 결제 푸시를 보낸다. 같은 channelId 로 같은 번호, 상품, 금액을 다시 요청하면
     * 기존 구매를 그대로 반환하고, 내용이 다르면 CHANNEL_ALREADY_IN_USE 로 거절한다.
     */
    public Purchase checkout(String rawPhoneNumber, String assetReference, Long amount, String channelId) {
        PhoneNumber phoneNumber = PhoneNumber.of(rawPhoneNumber);
        Money price = Money.of(amount, checkoutProperties.currency());
        log.info("체크아웃 시작 - phone: {}, asset: {}, amount: {}, channelId: {}",
                phoneNumber.masked(), assetReference, amount, channelId);

        // 멱등성 체크 - 같은 채널로 이미 생성된 구매인지 확인
        Optional<Purchase> existing = purchaseRepository.findByChannelId(channelId);
        if (existing.isPresent()) {
            log.info("이미 생성된 구매입니다 - purchaseId: {}", existing.get().getPurchaseId());
            return requireSameCheckout(existing.get(), phoneNumber, assetReference, price);
        }

        Purchase created;
        try {
            created = transactionTemplate.execute(status -> purchaseRepository.save(Purchase.initiate(
                    phoneNumber,
                    assetReference,
                    price,
                    channelId,
                    LocalDateTime.now(clock)
            )));
        } catch (DataIntegrityViolationException e) {
            // 동일 채널 동시 요청 - unique 제약 위반 시 이미 저장된 레코드 조회
            log.warn("동시 체크아웃 감지 - channelId: {}. 기존 구매 조회 중...", channelId);
            Purchase concurrent = purchaseRepository.findByChannelId(channelId)
                    .orElseThrow(() -> new IllegalStateException(
                            "구매 저장 실패 및 재조회 실패 - channelId: " + channelId));
            return requireSameCheckout(concurrent, phoneNumber, assetReference, price);
        }

        log.info("구매 생성 완료 - purchaseId: {}, gatewayReference: {}",
                created.getPurchaseId(), created.getGatewayReference());
        return paymentPushDispatcher.dispatch(created);
    }

    private Purchase requireSameCheckout(Purchase existing, PhoneNumber phoneNumber,
                                         String assetReference, Money price) {
        if (!existing.matchesCheckout(phoneNumber, assetReference, price)) {
            log.warn("채널 재사용 거절 - channelId: {}, purchaseId: {}, phone: {}",
                    existing.getChannelId(), existing.getPurchaseId(), phoneNumber.masked());
            throw PurchaseException.channelConflict(existing.getChannelId());
        }
        return existing;
    }
}
