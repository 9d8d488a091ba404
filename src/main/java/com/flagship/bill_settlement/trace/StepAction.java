package com.flagship.bill_settlement.trace;

/**
 * What a reasoning step records.
 */
public enum StepAction {
    LINE_APPORTIONED,
    CHARGE_APPORTIONED,
    RESIDUAL_ADJUSTED
}
