package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.money.Money;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-participant running totals after apportionment, keyed by participant id
 * in declaration order.
 */
@Value
public class ApportionmentResult {
    Map<String, List<Contribution>> contributions;
    Map<String, Money> totals;
    Map<String, Money> itemTotals;

    public Money apportionedTotal(Money zero) {
        return totals.values().stream().reduce(zero, Money::add);
    }

    /**
     * Returns a copy with one more contribution added to a participant's total.
     */
    public ApportionmentResult withContribution(String participantId, Contribution contribution) {
        Map<String, List<Contribution>> newContributions = new LinkedHashMap<>();
        contributions.forEach((id, list) -> newContributions.put(id, list));
        List<Contribution> updated = new ArrayList<>(contributions.get(participantId));
        updated.add(contribution);
        newContributions.put(participantId, Collections.unmodifiableList(updated));

        Map<String, Money> newTotals = new LinkedHashMap<>(totals);
        newTotals.put(participantId, totals.get(participantId).add(contribution.getAmount()));

        return new ApportionmentResult(
            Collections.unmodifiableMap(newContributions),
            Collections.unmodifiableMap(newTotals),
            itemTotals);
    }
}
