package com.flagship.bill_settlement.receipt;

/**
 * Kind of a non-item line on a receipt.
 */
public enum ChargeKind {
    /**
     * Sales tax, GST, VAT. Never negative.
     */
    TAX,

    /**
     * Service charge or tip printed on the receipt. Never negative.
     */
    SERVICE_CHARGE,

    /**
     * Discount or voucher. Never positive.
     */
    DISCOUNT;

    public boolean isDiscount() {
        return this == DISCOUNT;
    }
}
