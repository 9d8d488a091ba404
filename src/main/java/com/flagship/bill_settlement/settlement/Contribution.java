package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.money.Money;
import lombok.Value;

/**
 * The exact sub-amount attributed to a participant from one receipt line,
 * one charge line, or the residual adjustment.
 */
@Value
public class Contribution {
    ContributionSource source;
    String sourceId;
    Money amount;
}
