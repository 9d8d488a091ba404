package com.flagship.bill_settlement.receipt;

/**
 * How a charge value was derived on the receipt.
 */
public enum ChargeBasis {
    FLAT,
    PERCENTAGE_OF_SUBTOTAL
}
