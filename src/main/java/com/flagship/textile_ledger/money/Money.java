package com.flagship.textile_ledger.money;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fixed-point monetary amount with two decimal places.
 *
 * Every value is rounded HALF_UP to scale 2 on construction, so arithmetic
 * over amounts loaded from the store is stable across repeated loads.
 * Comparisons that must absorb rounding noise go through the epsilon helpers
 * instead of {@link #compareTo(Money)}.
 */
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;

    /**
     * Half a minor unit. Differences smaller than this are treated as zero.
     */
    public static final BigDecimal EPSILON = new BigDecimal("0.005");

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static Money of(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        return new Money(amount);
    }

    @JsonCreator
    public static Money of(String amount) {
        Objects.requireNonNull(amount, "amount");
        return new Money(new BigDecimal(amount.trim()));
    }

    /**
     * Lenient factory for nullable store columns: null becomes zero.
     */
    public static Money ofNullable(BigDecimal amount) {
        return amount == null ? ZERO : new Money(amount);
    }

    public Money plus(Money other) {
        return new Money(amount.add(other.amount));
    }

    public Money minus(Money other) {
        return new Money(amount.subtract(other.amount));
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    /**
     * True when {@code |this| < EPSILON}, i.e. the amount is zero for settlement purposes.
     */
    public boolean isNegligible() {
        return amount.abs().compareTo(EPSILON) < 0;
    }

    /**
     * True when this amount is below epsilon (including any negative amount).
     */
    public boolean isBelowEpsilon() {
        return amount.compareTo(EPSILON) < 0;
    }

    /**
     * True when this amount is strictly greater than epsilon.
     */
    public boolean isAboveEpsilon() {
        return amount.compareTo(EPSILON) > 0;
    }

    /**
     * True when {@code this > other + EPSILON}.
     */
    public boolean exceeds(Money other) {
        return amount.compareTo(other.amount.add(EPSILON)) > 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    @JsonValue
    public BigDecimal toBigDecimal() {
        return amount;
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money other)) {
            return false;
        }
        return amount.compareTo(other.amount) == 0;
    }

    @Override
    public int hashCode() {
        return amount.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
