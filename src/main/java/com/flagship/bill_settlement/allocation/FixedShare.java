package com.flagship.bill_settlement.allocation;

import com.flagship.bill_settlement.money.Money;
import lombok.Value;

/**
 * Flat adjustment: a fixed amount of a line charged to one participant before
 * the rest of the line is split by weight.
 */
@Value
public class FixedShare {
    String participantId;
    Money amount;

    public static FixedShare of(String participantId, Money amount) {
        return new FixedShare(participantId, amount);
    }
}
