package com.nyota.purchase.domain;

import com.nyota.common.exceptions.application.InvalidRequestException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 구매자 식별자인 휴대폰 번호 (국가 코드 포함 MSISDN 형태로 정규화)
 * "0711 000 000", "+254711000000", "711000000" 모두 "254711000000"으로 저장된다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PhoneNumber {

    private static final String DEFAULT_COUNTRY_CODE = "254";
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-().]");
    private static final Pattern DIGITS = Pattern.compile("\\d{10,15}");

    @Column(name = "phone_number", nullable = false, length = 20)
    private String value;

    private PhoneNumber(String value) {
        this.value = value;
    }

    public static PhoneNumber of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw InvalidRequestException.requiredFieldMissing("phoneNumber");
        }

        String digits = SEPARATORS.matcher(raw.trim()).replaceAll("");
        if (digits.startsWith("+")) {
            digits = digits.substring(1);
        }

        // 국내 형식 (0 + 9자리) 또는 국가 코드 없는 9자리
        if (digits.length() == 10 && digits.startsWith("0")) {
            digits = DEFAULT_COUNTRY_CODE + digits.substring(1);
        } else if (digits.length() == 9) {
            digits = DEFAULT_COUNTRY_CODE + digits;
        }

        if (!DIGITS.matcher(digits).matches()) {
            throw InvalidRequestException.invalidFormat("phoneNumber");
        }
        return new PhoneNumber(digits);
    }

    /**
     * 로그 출력용 마스킹 (마지막 3자리만 노출)
     */
    public String masked() {
        return "*".repeat(value.length() - 3) + value.substring(value.length() - 3);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhoneNumber that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
