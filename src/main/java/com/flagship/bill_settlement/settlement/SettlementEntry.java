package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.allocation.Participant;
import com.flagship.bill_settlement.money.Money;
import lombok.Value;

import java.util.List;

/**
 * What one participant owes and the contributions that add up to it.
 */
@Value
public class SettlementEntry {
    Participant participant;
    Money owedAmount;
    List<Contribution> contributions;

    public Money contributionTotal() {
        return contributions.stream()
            .map(Contribution::getAmount)
            .reduce(Money.zero(owedAmount.getCurrency()), Money::add);
    }
}
