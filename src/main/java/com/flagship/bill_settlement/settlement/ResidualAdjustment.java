package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.money.CurrencyCode;
import com.flagship.bill_settlement.money.Money;
import lombok.Value;

/**
 * Which participant absorbed the rounding remainder between the apportioned
 * totals and the declared grand total, and how much. The participant id is
 * null when no adjustment was needed.
 */
@Value
public class ResidualAdjustment {
    String participantId;
    Money amount;

    public static ResidualAdjustment none(CurrencyCode currency) {
        return new ResidualAdjustment(null, Money.zero(currency));
    }

    public boolean isApplied() {
        return participantId != null;
    }
}
