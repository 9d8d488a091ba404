package com.flagship.bill_settlement.money;

import com.flagship.bill_settlement.exception.InvalidAllocationException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Fixed-precision monetary value.
 *
 * Key invariants:
 * - The amount is held as a whole number of minor units (cents for USD)
 * - No floating point representation is ever used for a monetary value
 * - Instances are immutable; every operation returns a new Money
 * - Operations never mix currencies
 */
@Value
public class Money implements Comparable<Money> {
    private static final BigDecimal MIN_MINOR = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal MAX_MINOR = BigDecimal.valueOf(Long.MAX_VALUE);

    long minorUnits;
    CurrencyCode currency;

    private Money(long minorUnits, CurrencyCode currency) {
        this.minorUnits = minorUnits;
        this.currency = Objects.requireNonNull(currency, "Currency is required");
    }

    public static Money ofMinor(long minorUnits, CurrencyCode currency) {
        return new Money(minorUnits, currency);
    }

    /**
     * Creates a Money from a decimal amount such as {@code 10.01}.
     *
     * @throws IllegalArgumentException if the amount has more fraction digits
     *         than the currency has minor-unit digits, or does not fit in minor units
     */
    public static Money of(BigDecimal amount, CurrencyCode currency) {
        Objects.requireNonNull(amount, "Amount is required");
        Objects.requireNonNull(currency, "Currency is required");
        BigDecimal minor;
        try {
            minor = amount.movePointRight(currency.getMinorDigits()).setScale(0, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                "Amount %s has more precision than %s allows (%d fraction digits)",
                amount.toPlainString(), currency, currency.getMinorDigits()));
        }
        if (minor.compareTo(MIN_MINOR) < 0 || minor.compareTo(MAX_MINOR) > 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                "Amount %s %s is out of range", amount.toPlainString(), currency));
        }
        return new Money(minor.longValueExact(), currency);
    }

    public static Money of(String amount, CurrencyCode currency) {
        return of(new BigDecimal(amount), currency);
    }

    public static Money zero(CurrencyCode currency) {
        return new Money(0L, currency);
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(Math.addExact(minorUnits, other.minorUnits), currency);
    }

    public Money subtract(Money other) {
        requireSameCurrency(other);
        return new Money(Math.subtractExact(minorUnits, other.minorUnits), currency);
    }

    public Money negate() {
        return new Money(Math.negateExact(minorUnits), currency);
    }

    public Money abs() {
        return minorUnits < 0 ? negate() : this;
    }

    /**
     * Multiplies by an exact decimal factor, rounding half-up to whole minor units.
     */
    public Money multiply(BigDecimal factor) {
        Objects.requireNonNull(factor, "Factor is required");
        BigDecimal product = BigDecimal.valueOf(minorUnits).multiply(factor);
        return new Money(product.setScale(0, RoundingMode.HALF_UP).longValueExact(), currency);
    }

    /**
     * Returns {@code rate} percent of this amount, rounded half-up.
     */
    public Money percentage(BigDecimal rate) {
        Objects.requireNonNull(rate, "Rate is required");
        return multiply(rate.movePointLeft(2));
    }

    /**
     * Splits this amount across the given weights using the largest-remainder method.
     *
     * Each part is {@code floor(|total| * w / sum(w))}; the minor units left over are
     * handed out one at a time to the largest fractional remainders, ties going to the
     * lower position. Callers that need ties broken by id pass weights in ascending id
     * order. Negative totals are split on their magnitude and negated.
     *
     * @param weights non-negative weights with a positive sum; need not sum to 1
     * @return one Money per weight, in the same order, summing exactly to this amount
     * @throws InvalidAllocationException if the weights are empty, negative or sum to zero
     */
    public List<Money> allocate(List<BigDecimal> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new InvalidAllocationException("Cannot allocate across an empty weight set");
        }

        int scale = 0;
        for (BigDecimal weight : weights) {
            if (weight == null) {
                throw new InvalidAllocationException("Weight must not be null");
            }
            if (weight.signum() < 0) {
                throw new InvalidAllocationException("Weight must not be negative: " + weight.toPlainString());
            }
            scale = Math.max(scale, weight.stripTrailingZeros().scale());
        }

        // Scale every weight to an integer so the whole computation stays exact
        List<BigInteger> units = new ArrayList<>(weights.size());
        BigInteger weightSum = BigInteger.ZERO;
        for (BigDecimal weight : weights) {
            BigInteger unit = weight.movePointRight(scale).setScale(0, RoundingMode.UNNECESSARY).toBigIntegerExact();
            units.add(unit);
            weightSum = weightSum.add(unit);
        }
        if (weightSum.signum() == 0) {
            throw new InvalidAllocationException("Cannot allocate across weights that sum to zero");
        }

        BigInteger magnitude = BigInteger.valueOf(minorUnits).abs();
        long[] parts = new long[units.size()];
        BigInteger[] remainders = new BigInteger[units.size()];
        long allocated = 0;
        for (int i = 0; i < units.size(); i++) {
            BigInteger[] quotientAndRemainder = magnitude.multiply(units.get(i)).divideAndRemainder(weightSum);
            parts[i] = quotientAndRemainder[0].longValueExact();
            remainders[i] = quotientAndRemainder[1];
            allocated += parts[i];
        }

        long leftover = magnitude.longValueExact() - allocated;
        List<Integer> order = new ArrayList<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.<Integer, BigInteger>comparing(i -> remainders[i]).reversed()
            .thenComparing(Comparator.naturalOrder()));
        for (int k = 0; k < leftover; k++) {
            parts[order.get(k)]++;
        }

        List<Money> result = new ArrayList<>(parts.length);
        for (long part : parts) {
            result.add(new Money(minorUnits < 0 ? -part : part, currency));
        }
        return Collections.unmodifiableList(result);
    }

    public boolean isZero() {
        return minorUnits == 0;
    }

    public boolean isNegative() {
        return minorUnits < 0;
    }

    public int signum() {
        return Long.signum(minorUnits);
    }

    /**
     * Decimal representation in major units, e.g. {@code 10.01}.
     */
    public BigDecimal toDecimal() {
        return BigDecimal.valueOf(minorUnits, currency.getMinorDigits());
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return Long.compare(minorUnits, other.minorUnits);
    }

    @Override
    public String toString() {
        return currency.name() + " " + toDecimal().toPlainString();
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "Money operand is required");
        if (other.currency != currency) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                "Currency mismatch: %s vs %s", currency, other.currency));
        }
    }
}
