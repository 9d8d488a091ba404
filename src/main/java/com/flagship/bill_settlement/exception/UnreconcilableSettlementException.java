package com.flagship.bill_settlement.exception;

import java.util.Locale;

/**
 * Thrown when the residual between the apportioned totals and the declared
 * grand total is larger than the reconciliation tolerance.
 * Signals an upstream data problem rather than an engine fault.
 */
public class UnreconcilableSettlementException extends SettlementException {

    private final long residualMinorUnits;
    private final long toleranceMinorUnits;

    public UnreconcilableSettlementException(String receiptId, long residualMinorUnits, long toleranceMinorUnits) {
        super(receiptId, String.format(Locale.ROOT,
            "Residual of %d minor units exceeds reconciliation tolerance of %d minor units",
            residualMinorUnits, toleranceMinorUnits));
        this.residualMinorUnits = residualMinorUnits;
        this.toleranceMinorUnits = toleranceMinorUnits;
    }

    public long getResidualMinorUnits() {
        return residualMinorUnits;
    }

    public long getToleranceMinorUnits() {
        return toleranceMinorUnits;
    }
}
