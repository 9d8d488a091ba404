package com.flagship.bill_settlement.exception;

/**
 * The nature of an input mismatch detected at ingestion.
 */
public enum Violation {
    MISSING_FIELD,
    AMOUNT_OUT_OF_RANGE,
    DUPLICATE_ID,
    CURRENCY_MISMATCH,
    NON_POSITIVE_QUANTITY,
    NEGATIVE_UNIT_PRICE,
    LINE_TOTAL_MISMATCH,
    CHARGE_SIGN_MISMATCH,
    CHARGE_RATE_MISSING,
    CHARGE_DERIVATION_MISMATCH,
    SUBTOTAL_MISMATCH,
    GRAND_TOTAL_MISMATCH,
    EMPTY_RECEIPT,
    EMPTY_PARTICIPANTS,
    UNKNOWN_PARTICIPANT,
    UNKNOWN_LINE,
    UNKNOWN_CHARGE,
    UNALLOCATED_LINE,
    DUPLICATE_LINE_ALLOCATION,
    EMPTY_SHARES,
    NON_POSITIVE_WEIGHT,
    FIXED_SHARES_EXCEED_LINE_TOTAL,
    MISSING_CHARGE_ASSIGNMENT
}
