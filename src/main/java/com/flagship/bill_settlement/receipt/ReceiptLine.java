package com.flagship.bill_settlement.receipt;

import com.flagship.bill_settlement.money.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One item line on a receipt.
 *
 * Invariant (checked by {@link Receipt#create}): the printed line total is within
 * the line tolerance of {@code unitPrice * quantity} rounded half-up.
 */
@Value
public class ReceiptLine {
    String id;
    String description;
    BigDecimal quantity;
    Money unitPrice;
    Money lineTotal;

    public static ReceiptLine of(String id, String description, BigDecimal quantity,
                                 Money unitPrice, Money lineTotal) {
        return new ReceiptLine(id, description, quantity, unitPrice, lineTotal);
    }

    /**
     * A line whose total is exactly {@code unitPrice * quantity}.
     */
    public static ReceiptLine priced(String id, String description, int quantity, Money unitPrice) {
        BigDecimal qty = BigDecimal.valueOf(quantity);
        return new ReceiptLine(id, description, qty, unitPrice, unitPrice.multiply(qty));
    }

    public Money expectedTotal() {
        return unitPrice.multiply(quantity);
    }
}
