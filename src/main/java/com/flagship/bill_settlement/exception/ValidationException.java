package com.flagship.bill_settlement.exception;

/**
 * Malformed or inconsistent receipt or allocation input.
 * Always caller-fixable; never retried.
 */
public class ValidationException extends SettlementException {

    private final Violation violation;

    public ValidationException(Violation violation, String subjectId, String message) {
        super(subjectId, message);
        this.violation = violation;
    }

    public Violation getViolation() {
        return violation;
    }
}
