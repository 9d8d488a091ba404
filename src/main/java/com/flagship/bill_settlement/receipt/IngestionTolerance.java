package com.flagship.bill_settlement.receipt;

import lombok.Value;

/**
 * Rounding tolerances, in minor units, accepted when checking a receipt's
 * printed figures against the figures re-derived from it.
 */
@Value
public class IngestionTolerance {
    long lineMinorUnits;
    long chargeMinorUnits;
    long grandTotalMinorUnits;

    public IngestionTolerance(long lineMinorUnits, long chargeMinorUnits, long grandTotalMinorUnits) {
        if (lineMinorUnits < 0 || chargeMinorUnits < 0 || grandTotalMinorUnits < 0) {
            throw new IllegalArgumentException("Tolerances must not be negative");
        }
        this.lineMinorUnits = lineMinorUnits;
        this.chargeMinorUnits = chargeMinorUnits;
        this.grandTotalMinorUnits = grandTotalMinorUnits;
    }

    /**
     * One minor unit everywhere.
     */
    public static IngestionTolerance standard() {
        return new IngestionTolerance(1, 1, 1);
    }
}
