package com.nyota.access.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * (번호, 출발지) 조합마다 하나씩 존재하는 잠금 행.
 * 잠금 판단과 시도 기록은 이 행을 PESSIMISTIC_WRITE로 잡은 상태에서만 수행된다.
 */
@Entity
@Table(name = "access_rate_keys")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccessRateKey {

    private static final String SEPARATOR = "|";

    @Id
    @Column(name = "key_id", length = 100)
    private String keyId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private AccessRateKey(String keyId, LocalDateTime createdAt) {
        this.keyId = keyId;
        this.createdAt = createdAt;
    }

    public static AccessRateKey create(String phoneNumber, String originAddress, LocalDateTime now) {
        return new AccessRateKey(keyOf(phoneNumber, originAddress), now);
    }

    public static String keyOf(String phoneNumber, String originAddress) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new IllegalArgumentException("Phone number는 필수입니다");
        }
        if (originAddress == null || originAddress.isBlank()) {
            throw new IllegalArgumentException("Origin address는 필수입니다");
        }
        return phoneNumber + SEPARATOR + originAddress;
    }
}
