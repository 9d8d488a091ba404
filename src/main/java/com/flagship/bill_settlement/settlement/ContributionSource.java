package com.flagship.bill_settlement.settlement;

/**
 * Where a participant's sub-amount came from.
 */
public enum ContributionSource {
    LINE,
    CHARGE,
    RESIDUAL
}
