package com.flagship.bill_settlement.money;

import com.flagship.bill_settlement.exception.InvalidAllocationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Money value type and its largest-remainder allocation.
 *
 * Goal: every allocation sums exactly to the amount it splits, and leftover
 * minor units land deterministically.
 */
class MoneyTest {

    private static final CurrencyCode USD = CurrencyCode.USD;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static List<BigDecimal> weights(String... values) {
        List<BigDecimal> result = new ArrayList<>();
        for (String value : values) {
            result.add(new BigDecimal(value));
        }
        return result;
    }

    private static List<BigDecimal> evenly(int count) {
        return Collections.nCopies(count, BigDecimal.ONE);
    }

    private static List<Long> minorUnits(List<Money> amounts) {
        List<Long> result = new ArrayList<>();
        for (Money amount : amounts) {
            result.add(amount.getMinorUnits());
        }
        return result;
    }

    @Test
    @DisplayName("$10.01 split three ways gives the extra cent to the first two")
    void testAllocateTenOhOneThreeWays() {
        printTestHeader("allocate($10.01, [1,1,1])");

        List<Money> parts = Money.of("10.01", USD).allocate(evenly(3));
        printOutput("Parts", parts);

        assertEquals(List.of(334L, 334L, 333L), minorUnits(parts));
    }

    @Test
    @DisplayName("Allocation follows weights that need not sum to one")
    void testAllocateByUnnormalizedWeights() {
        assertEquals(List.of(300L, 200L), minorUnits(Money.of("5.00", USD).allocate(weights("30", "20"))));
        assertEquals(List.of(600L, 400L), minorUnits(Money.of("10.00", USD).allocate(weights("3000", "2000"))));
    }

    @Test
    @DisplayName("Fractional weights are exact")
    void testAllocateFractionalWeights() {
        // 101 * 0.5 = 50.5, 101 * 0.25 = 25.25 twice: the largest remainder is the first
        List<Money> parts = Money.ofMinor(101, USD).allocate(weights("0.5", "0.25", "0.25"));

        assertEquals(List.of(51L, 25L, 25L), minorUnits(parts));
    }

    @Test
    @DisplayName("Largest remainder wins over position")
    void testLargestRemainderBeforePosition() {
        // 10 * 1/6 = 1.67, 10 * 2/6 = 3.33, 10 * 3/6 = 5.00
        List<Money> parts = Money.ofMinor(10, USD).allocate(weights("1", "2", "3"));

        assertEquals(List.of(2L, 3L, 5L), minorUnits(parts));
    }

    @Test
    @DisplayName("Equal remainders go to the lowest positions first")
    void testTiesBrokenByPosition() {
        List<Money> parts = Money.ofMinor(5, USD).allocate(evenly(7));

        assertEquals(List.of(1L, 1L, 1L, 1L, 1L, 0L, 0L), minorUnits(parts));
    }

    @Test
    @DisplayName("Negative amounts split on their magnitude")
    void testAllocateNegativeAmount() {
        List<Money> parts = Money.of("-10.01", USD).allocate(evenly(3));

        assertEquals(List.of(-334L, -334L, -333L), minorUnits(parts));
    }

    @Test
    @DisplayName("Zero weights receive nothing")
    void testZeroWeightReceivesNothing() {
        List<Money> parts = Money.ofMinor(101, USD).allocate(weights("0", "1", "1"));

        assertEquals(List.of(0L, 51L, 50L), minorUnits(parts));
    }

    @Test
    @DisplayName("Degenerate weight sets are rejected")
    void testDegenerateWeightsRejected() {
        Money amount = Money.of("1.00", USD);

        assertThrows(InvalidAllocationException.class, () -> amount.allocate(List.of()));
        assertThrows(InvalidAllocationException.class, () -> amount.allocate(weights("0", "0")));
        assertThrows(InvalidAllocationException.class, () -> amount.allocate(weights("1", "-1")));
        assertThrows(InvalidAllocationException.class, () -> amount.allocate(evenly(0)));
    }

    @Test
    @DisplayName("Allocation is exact and within one minor unit of the ideal share")
    void testAllocateExactnessProperty() {
        Random random = new Random(20240501L);

        for (int run = 0; run < 500; run++) {
            long total = random.nextInt(2_000_000) - 500_000;
            int count = 1 + random.nextInt(8);
            List<BigDecimal> weights = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                weights.add(BigDecimal.valueOf(1 + random.nextInt(10_000), random.nextInt(3)));
            }

            List<Money> parts = Money.ofMinor(total, USD).allocate(weights);

            long sum = parts.stream().mapToLong(Money::getMinorUnits).sum();
            assertEquals(total, sum, "Parts must sum to the total");

            BigDecimal weightSum = weights.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            for (int i = 0; i < count; i++) {
                BigDecimal ideal = BigDecimal.valueOf(Math.abs(total)).multiply(weights.get(i));
                BigInteger floor = ideal.divideToIntegralValue(weightSum).toBigInteger();
                long part = Math.abs(parts.get(i).getMinorUnits());
                assertTrue(part == floor.longValue() || part == floor.longValue() + 1,
                    "Part " + part + " is not within one minor unit of " + ideal.divide(weightSum, 4,
                        java.math.RoundingMode.HALF_UP));
            }
        }
    }

    @Test
    @DisplayName("Decimal amounts convert to minor units by currency digits")
    void testDecimalConversion() {
        assertEquals(1001L, Money.of("10.01", USD).getMinorUnits());
        assertEquals(1000L, Money.of("10", USD).getMinorUnits());
        assertEquals(500L, Money.of("500", CurrencyCode.JPY).getMinorUnits());
        assertEquals(new BigDecimal("10.01"), Money.ofMinor(1001, USD).toDecimal());
        assertEquals("USD 10.01", Money.ofMinor(1001, USD).toString());
    }

    @Test
    @DisplayName("Amounts finer than the currency allows are rejected")
    void testExcessPrecisionRejected() {
        assertThrows(IllegalArgumentException.class, () -> Money.of("10.001", USD));
        assertThrows(IllegalArgumentException.class, () -> Money.of("1.5", CurrencyCode.JPY));
    }

    @Test
    @DisplayName("Multiplication and percentages round half-up")
    void testMultiplyRoundsHalfUp() {
        assertEquals(5997L, Money.of("19.99", USD).multiply(BigDecimal.valueOf(3)).getMinorUnits());
        assertEquals(599L, Money.of("3.99", USD).multiply(new BigDecimal("1.5")).getMinorUnits());
        assertEquals(500L, Money.of("50.00", USD).percentage(BigDecimal.TEN).getMinorUnits());
        assertEquals(1L, Money.ofMinor(5, USD).percentage(BigDecimal.TEN).getMinorUnits());
    }

    @Test
    @DisplayName("Arithmetic never mixes currencies")
    void testCurrencyMismatchRejected() {
        Money dollars = Money.of("1.00", USD);
        Money euros = Money.of("1.00", CurrencyCode.EUR);

        assertThrows(IllegalArgumentException.class, () -> dollars.add(euros));
        assertThrows(IllegalArgumentException.class, () -> dollars.subtract(euros));
        assertThrows(IllegalArgumentException.class, () -> dollars.compareTo(euros));
    }

    @Test
    @DisplayName("Currency codes parse case-insensitively")
    void testCurrencyParse() {
        assertEquals(CurrencyCode.SGD, CurrencyCode.parse("sgd"));
        assertThrows(IllegalArgumentException.class, () -> CurrencyCode.parse("XYZ"));
        assertThrows(IllegalArgumentException.class, () -> CurrencyCode.parse(" "));
    }

    @Test
    @DisplayName("Amounts beyond the minor-unit range are reported as out of range")
    void testOutOfRangeAmountRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Money.of("100000000000000000000.00", USD));

        assertTrue(e.getMessage().contains("out of range"), e.getMessage());
    }

    @Test
    @DisplayName("Currency parsing does not depend on the default locale")
    void testCurrencyParseUnderTurkishLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));

            assertEquals(CurrencyCode.INR, CurrencyCode.parse("inr"));
        } finally {
            Locale.setDefault(original);
        }
    }
}
