package com.flagship.bill_settlement.trace;

/**
 * Kind of receipt entry a reasoning step is about.
 */
public enum SubjectType {
    LINE,
    CHARGE,
    RECEIPT
}
