package com.nyota.purchase.domain;

import com.nyota.purchase.common.exception.PurchaseException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "purchases")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Purchase {

    public static final String REASON_GATEWAY_FAILED = "GATEWAY_FAILED";
    public static final String REASON_AMOUNT_MISMATCH = "AMOUNT_MISMATCH";
    public static final String REASON_NO_CALLBACK = "NO_CALLBACK";
    public static final String REASON_GATEWAY_PUSH_FAILED = "GATEWAY_PUSH_FAILED";

    private static final Set<PurchaseStatus> AWAITING_CALLBACK = EnumSet.of(PurchaseStatus.PENDING, PurchaseStatus.TIMED_OUT);
    private static final Set<PurchaseStatus> RETRYABLE = EnumSet.of(PurchaseStatus.FAILED, PurchaseStatus.TIMED_OUT);

    // 구매 ID (기본키)
    @Id
    @Column(name = "purchase_id", length = 50)
    private String purchaseId;

    // 게이트웨이 거래 참조 (재시도마다 새로 발급)
    @Column(name = "gateway_reference", nullable = false, length = 64, unique = true)
    private String gatewayReference;

    // 브로드캐스터 채널 ID (체크아웃 시 클라이언트 생성, 재시도 시 서버 생성)
    @Column(name = "channel_id", nullable = false, length = 64, unique = true)
    private String channelId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PurchaseStatus status;

    // 구매자 휴대폰 번호 (정규화)
    @Embedded
    private PhoneNumber phoneNumber;

    @Embedded
    private Money amount;

    // 자산 slug 또는 구독 등급 참조
    @Column(name = "asset_reference", nullable = false, length = 220)
    private String assetReference;

    // 게이트웨이 푸시 시도 횟수 (최초 1)
    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    // 게이트웨이 영수증 번호 (성공 콜백에서 수신)
    @Column(name = "gateway_transaction_id", length = 100)
    private String gatewayTransactionId;

    @Column(name = "failure_reason", length = 255)
    private String failureReason;

    // 취소 이후 도착한 콜백 결과 (정산 확인용)
    @Enumerated(EnumType.STRING)
    @Column(name = "late_outcome", length = 20)
    private GatewayOutcome lateOutcome;

    @Column(name = "late_outcome_at")
    private LocalDateTime lateOutcomeAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Builder
    private Purchase(String purchaseId, String gatewayReference, String channelId, PurchaseStatus status,
                     PhoneNumber phoneNumber, Money amount, String assetReference, int attemptCount,
                     LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.purchaseId = purchaseId;
        this.gatewayReference = gatewayReference;
        this.channelId = channelId;
        this.status = status;
        this.phoneNumber = phoneNumber;
        this.amount = amount;
        this.assetReference = assetReference;
        this.attemptCount = attemptCount;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Purchase initiate(PhoneNumber phoneNumber, String assetReference, Money amount,
                                    String channelId, LocalDateTime now) {
        validatePhoneNumber(phoneNumber);
        validateAssetReference(assetReference);
        validateAmount(amount);
        validateChannelId(channelId);

        return Purchase.builder()
                .purchaseId(generatePurchaseId())
                .gatewayReference(generateGatewayReference())
                .channelId(channelId)
                .status(PurchaseStatus.PENDING)
                .phoneNumber(phoneNumber)
                .amount(amount)
                .assetReference(assetReference)
                .attemptCount(1)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 게이트웨이 콜백 결과 반영.
     * PENDING/TIMED_OUT 에서만 상태가 바뀌고, CANCELLED 는 결과만 기록하며, 그 외는 no-op.
     */
    public CallbackResolution applyGatewayOutcome(GatewayOutcome outcome, Money reportedAmount,
                                                  String transactionId, LocalDateTime now) {
        if (this.status == PurchaseStatus.CANCELLED) {
            this.lateOutcome = outcome;
            this.lateOutcomeAt = now;
            this.updatedAt = now;
            return CallbackResolution.RECORDED_AFTER_CANCEL;
        }

        if (!isAwaitingCallback()) {
            return CallbackResolution.DUPLICATE;
        }

        if (outcome == GatewayOutcome.SUCCESS && this.amount.equals(reportedAmount)) {
            complete(transactionId, now);
        } else if (outcome == GatewayOutcome.SUCCESS) {
            fail(REASON_AMOUNT_MISMATCH, now);
        } else {
            fail(REASON_GATEWAY_FAILED, now);
        }
        return CallbackResolution.APPLIED;
    }

    public void complete(String transactionId, LocalDateTime now) {
        validateAwaitingCallback("complete");

        this.status = PurchaseStatus.COMPLETED;
        this.gatewayTransactionId = transactionId;
        this.failureReason = null;
        this.completedAt = now;
        this.updatedAt = now;
    }

    public void fail(String reason, LocalDateTime now) {
        validateAwaitingCallback("fail");

        this.status = PurchaseStatus.FAILED;
        this.failureReason = reason;
        this.updatedAt = now;
    }

    public void markTimedOut(LocalDateTime now) {
        validateStatus(PurchaseStatus.PENDING, "time out");

        this.status = PurchaseStatus.TIMED_OUT;
        this.updatedAt = now;
    }

    public void cancel(LocalDateTime now) {
        validateStatus(PurchaseStatus.PENDING, "cancel");

        this.status = PurchaseStatus.CANCELLED;
        this.cancelledAt = now;
        this.updatedAt = now;
    }

    /**
     * 재시도: 같은 구매 행을 재사용하되 게이트웨이 참조와 채널 ID를 새로 발급한다.
     */
    public void retry(String newChannelId, LocalDateTime now) {
        if (!RETRYABLE.contains(this.status)) {
            throw PurchaseException.invalidState(this.purchaseId, this.status, "retry");
        }
        validateChannelId(newChannelId);

        this.status = PurchaseStatus.PENDING;
        this.gatewayReference = generateGatewayReference();
        this.channelId = newChannelId;
        this.attemptCount++;
        this.failureReason = null;
        this.updatedAt = now;
    }

    public boolean isAwaitingCallback() {
        return AWAITING_CALLBACK.contains(this.status);
    }

    public boolean isPending() {
        return this.status == PurchaseStatus.PENDING;
    }

    public boolean isCompleted() {
        return this.status == PurchaseStatus.COMPLETED;
    }

    // 구매자에게 노출되는 최종 결과 (COMPLETED / FAILED)
    public boolean isResolved() {
        return this.status == PurchaseStatus.COMPLETED || this.status == PurchaseStatus.FAILED;
    }

    public boolean isOwnedBy(PhoneNumber phoneNumber) {
        return this.phoneNumber.equals(phoneNumber);
    }

    // 같은 채널로 다시 들어온 체크아웃이 최초 요청과 같은 구매인지
    public boolean matchesCheckout(PhoneNumber phoneNumber, String assetReference, Money amount) {
        return isOwnedBy(phoneNumber)
                && this.assetReference.equals(assetReference)
                && this.amount.equals(amount);
    }

    /**
     * 접근 복구 시 구매 날짜 대조 (생성일 또는 결제 완료일, 날짜 단위)
     */
    public boolean wasPurchasedOn(LocalDate date) {
        if (this.createdAt.toLocalDate().equals(date)) {
            return true;
        }
        return this.completedAt != null && this.completedAt.toLocalDate().equals(date);
    }

    private void validateAwaitingCallback(String action) {
        if (!isAwaitingCallback()) {
            throw PurchaseException.invalidState(this.purchaseId, this.status, action);
        }
    }

    private void validateStatus(PurchaseStatus expected, String action) {
        if (this.status != expected) {
            throw PurchaseException.invalidState(this.purchaseId, this.status, action);
        }
    }

    private static void validatePhoneNumber(PhoneNumber phoneNumber) {
        if (phoneNumber == null) {
            throw new IllegalArgumentException("Phone number는 필수입니다");
        }
    }

    private static void validateAssetReference(String assetReference) {
        if (assetReference == null || assetReference.isBlank()) {
            throw new IllegalArgumentException("Asset reference는 필수입니다");
        }
    }

    private static void validateAmount(Money amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount는 필수입니다");
        }
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Amount는 0보다 커야 합니다");
        }
    }

    private static void validateChannelId(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("Channel ID는 필수입니다");
        }
    }

    private static String generatePurchaseId() {
        return "PUR-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    private static String generateGatewayReference() {
        return "GW-" + UUID.randomUUID();
    }
}
