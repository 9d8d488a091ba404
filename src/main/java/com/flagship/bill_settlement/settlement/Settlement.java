package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.money.CurrencyCode;
import com.flagship.bill_settlement.money.Money;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Per-participant result of a settlement run.
 *
 * Core invariant: the owed amounts sum to the receipt grand total exactly,
 * in minor units. {@link SettlementValidator} re-checks it on every run.
 */
@Value
public class Settlement {
    String receiptId;
    CurrencyCode currency;
    Money grandTotal;
    List<SettlementEntry> entries;
    ResidualAdjustment residualAdjustment;

    public Money totalOwed() {
        return entries.stream()
            .map(SettlementEntry::getOwedAmount)
            .reduce(Money.zero(currency), Money::add);
    }

    public Optional<SettlementEntry> entryFor(String participantId) {
        return entries.stream()
            .filter(entry -> entry.getParticipant().getId().equals(participantId))
            .findFirst();
    }
}
