package com.example.orchestrator.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Value Object representing a non-negative monetary amount.
 */
public final class Money {

    private static final int SCALE = 2;
    private static final int MAX_INTEGER_DIGITS = 17;

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * Creates Money with the specified amount.
     *
     * @param amount the monetary amount
     * @return new Money instance
     * @throws IllegalArgumentException if amount is negative, has more than two
     *                                  decimals or more than 17 integer digits
     */
    public static Money of(BigDecimal amount) {
        Objects.requireNonNull(amount, "Amount cannot be null");
        if (amount.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        if (normalized.scale() > SCALE) {
            throw new IllegalArgumentException("Amount has more than " + SCALE + " decimals: " + amount);
        }
        if (normalized.precision() - normalized.scale() > MAX_INTEGER_DIGITS) {
            throw new IllegalArgumentException("Amount is too large: " + amount);
        }
        return new Money(amount);
    }

    public BigDecimal getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount.compareTo(money.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
