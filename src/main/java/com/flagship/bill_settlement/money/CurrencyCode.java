package com.flagship.bill_settlement.money;

import java.util.Locale;

/**
 * Currency code enum following ISO-4217 standard.
 *
 * Each currency carries the number of minor-unit digits used when
 * converting between decimal amounts and minor units.
 */
public enum CurrencyCode {
    USD(2), // US Dollar
    EUR(2), // Euro
    GBP(2), // British Pound
    INR(2), // Indian Rupee
    JPY(0), // Japanese Yen
    SGD(2), // Singapore Dollar
    MYR(2); // Malaysian Ringgit

    private final int minorDigits;

    CurrencyCode(int minorDigits) {
        this.minorDigits = minorDigits;
    }

    public int getMinorDigits() {
        return minorDigits;
    }

    /**
     * Resolves a currency code, accepting lower case input.
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static CurrencyCode parse(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        try {
            return CurrencyCode.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid currency code: " + code);
        }
    }
}
