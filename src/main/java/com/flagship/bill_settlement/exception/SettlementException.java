package com.flagship.bill_settlement.exception;

/**
 * Base type for every failure raised by the settlement engine.
 *
 * The subject id names the receipt line, charge line or participant that
 * caused the failure, and is null when the failure concerns the receipt as
 * a whole.
 */
public abstract class SettlementException extends RuntimeException {

    private final String subjectId;

    protected SettlementException(String subjectId, String message) {
        super(message);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
