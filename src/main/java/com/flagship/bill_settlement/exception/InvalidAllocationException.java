package com.flagship.bill_settlement.exception;

/**
 * Thrown when a weight set cannot be apportioned: no weights, a negative
 * weight, or weights summing to zero.
 */
public class InvalidAllocationException extends SettlementException {

    public InvalidAllocationException(String subjectId, String message) {
        super(subjectId, message);
    }

    public InvalidAllocationException(String message) {
        this(null, message);
    }
}
