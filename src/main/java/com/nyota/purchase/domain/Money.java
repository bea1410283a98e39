package com.nyota.purchase.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Money {

    public static final String DEFAULT_CURRENCY = "KES";

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal value;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    private Money(BigDecimal value, String currency) {
        validateAmount(value);
        validateCurrency(currency);
        this.value = value.setScale(0, RoundingMode.DOWN);
        this.currency = currency;
    }

    public static Money of(long value) {
        return new Money(BigDecimal.valueOf(value), DEFAULT_CURRENCY);
    }

    public static Money of(long value, String currency) {
        return new Money(BigDecimal.valueOf(value), currency);
    }

    public long longValue() {
        return this.value.longValue();
    }

    public boolean isPositive() {
        return this.value.compareTo(BigDecimal.ZERO) > 0;
    }

    private void validateAmount(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (value.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + value);
        }
    }

    private void validateCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Currency cannot be null or empty");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Money money)) return false;
        return value.compareTo(money.value) == 0 && currency.equals(money.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value.stripTrailingZeros(), currency);
    }

    @Override
    public String toString() {
        return value + " " + currency;
    }
}
