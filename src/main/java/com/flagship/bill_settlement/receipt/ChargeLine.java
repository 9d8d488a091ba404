package com.flagship.bill_settlement.receipt;

import com.flagship.bill_settlement.money.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A tax, service charge or discount line.
 *
 * The value is signed: discounts are zero or negative, everything else zero or
 * positive. {@code rate} is the printed percentage and is only present when the
 * basis is {@link ChargeBasis#PERCENTAGE_OF_SUBTOTAL}.
 */
@Value
public class ChargeLine {
    String id;
    ChargeKind kind;
    Money value;
    ChargeBasis basis;
    BigDecimal rate;

    public static ChargeLine flat(String id, ChargeKind kind, Money value) {
        return new ChargeLine(id, kind, value, ChargeBasis.FLAT, null);
    }

    public static ChargeLine percentage(String id, ChargeKind kind, BigDecimal rate, Money value) {
        return new ChargeLine(id, kind, value, ChargeBasis.PERCENTAGE_OF_SUBTOTAL, rate);
    }
}
