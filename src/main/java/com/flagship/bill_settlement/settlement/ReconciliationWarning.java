package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.money.Money;
import lombok.Value;

/**
 * Non-fatal notice that a residual was absorbed by one participant.
 * Returned alongside a valid settlement.
 */
@Value
public class ReconciliationWarning {
    String receiptId;
    String participantId;
    Money residual;
    String message;
}
