package com.nyota.access.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 접근 복구 시도 감사 기록. 생성 후 변경되지 않는다.
 */
@Entity
@Table(name = "access_attempts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccessAttempt {

    // 시도 ID (Snowflake)
    @Id
    @Column(name = "attempt_id")
    private Long attemptId;

    // 사용자가 입력한 번호 그대로
    @Column(name = "submitted_phone", nullable = false, length = 40)
    private String submittedPhone;

    // 정규화된 번호 (잠금 키)
    @Column(name = "phone_number", nullable = false, length = 20)
    private String phoneNumber;

    // 요청 출발지 주소 (잠금 키)
    @Column(name = "origin_address", nullable = false, length = 64)
    private String originAddress;

    @Column(name = "claimed_purchase_date", nullable = false)
    private LocalDate claimedPurchaseDate;

    @Column(name = "attempted_at", nullable = false)
    private LocalDateTime attemptedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    private AccessOutcome outcome;

    @Column(name = "matched_purchase_id", length = 50)
    private String matchedPurchaseId;

    @Builder
    private AccessAttempt(Long attemptId, String submittedPhone, String phoneNumber, String originAddress,
                          LocalDate claimedPurchaseDate, LocalDateTime attemptedAt, AccessOutcome outcome,
                          String matchedPurchaseId) {
        this.attemptId = attemptId;
        this.submittedPhone = submittedPhone;
        this.phoneNumber = phoneNumber;
        this.originAddress = originAddress;
        this.claimedPurchaseDate = claimedPurchaseDate;
        this.attemptedAt = attemptedAt;
        this.outcome = outcome;
        this.matchedPurchaseId = matchedPurchaseId;
    }

    public static AccessAttempt record(Long attemptId, String submittedPhone, String phoneNumber,
                                       String originAddress, LocalDate claimedPurchaseDate,
                                       AccessOutcome outcome, String matchedPurchaseId,
                                       LocalDateTime attemptedAt) {
        if (attemptId == null) {
            throw new IllegalArgumentException("Attempt ID는 필수입니다");
        }
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new IllegalArgumentException("Phone number는 필수입니다");
        }
        if (originAddress == null || originAddress.isBlank()) {
            throw new IllegalArgumentException("Origin address는 필수입니다");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("Outcome은 필수입니다");
        }
        if (outcome == AccessOutcome.SUCCESS && matchedPurchaseId == null) {
            throw new IllegalArgumentException("성공한 시도는 일치한 구매 ID가 필요합니다");
        }

        return AccessAttempt.builder()
                .attemptId(attemptId)
                .submittedPhone(submittedPhone)
                .phoneNumber(phoneNumber)
                .originAddress(originAddress)
                .claimedPurchaseDate(claimedPurchaseDate)
                .attemptedAt(attemptedAt)
                .outcome(outcome)
                .matchedPurchaseId(matchedPurchaseId)
                .build();
    }
}
