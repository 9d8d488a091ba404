package com.flagship.bill_settlement.settlement;

import lombok.Value;

import java.util.List;

/**
 * Apportionment after the residual check, with the adjustment that was applied.
 */
@Value
public class ReconciliationOutcome {
    ApportionmentResult result;
    ResidualAdjustment residualAdjustment;
    List<ReconciliationWarning> warnings;
}
