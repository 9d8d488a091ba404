package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.allocation.Allocation;
import com.flagship.bill_settlement.allocation.Participant;
import com.flagship.bill_settlement.money.Money;
import com.flagship.bill_settlement.receipt.Receipt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Final gate of a settlement run.
 *
 * Checks:
 * 1. Owed amounts sum to the grand total, zero tolerance
 * 2. Every participant appears exactly once, and nobody else appears
 * 3. No owed amount is negative unless the receipt carries a discount
 * 4. Each entry's contributions sum to its owed amount
 *
 * Never throws for a failed check; reasons are collected and returned.
 */
public class SettlementValidator {

    public ValidationResult validate(Receipt receipt, Allocation allocation, Settlement settlement) {
        List<String> reasons = new ArrayList<>();

        for (SettlementEntry entry : settlement.getEntries()) {
            if (entry.getOwedAmount().getCurrency() != receipt.getCurrency()) {
                reasons.add(String.format(Locale.ROOT, "Entry for %s is in %s, receipt is in %s",
                    entry.getParticipant().getId(), entry.getOwedAmount().getCurrency(), receipt.getCurrency()));
            }
        }
        if (!reasons.isEmpty()) {
            return ValidationResult.invalid(reasons);
        }

        Money total = settlement.totalOwed();
        if (!total.equals(receipt.getGrandTotal())) {
            reasons.add(String.format(Locale.ROOT, "Settlement sums to %s but grand total is %s", total, receipt.getGrandTotal()));
        }

        Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (SettlementEntry entry : settlement.getEntries()) {
            occurrences.merge(entry.getParticipant().getId(), 1, Integer::sum);
        }
        for (Participant participant : allocation.getParticipants()) {
            int count = occurrences.getOrDefault(participant.getId(), 0);
            if (count != 1) {
                reasons.add(String.format(Locale.ROOT, "Participant %s appears %d times in the settlement", participant.getId(), count));
            }
            occurrences.remove(participant.getId());
        }
        for (String unknown : occurrences.keySet()) {
            reasons.add("Settlement contains unknown participant " + unknown);
        }

        boolean discounted = receipt.hasDiscount();
        for (SettlementEntry entry : settlement.getEntries()) {
            if (entry.getOwedAmount().isNegative() && !discounted) {
                reasons.add(String.format(Locale.ROOT, "Participant %s owes a negative amount %s without any discount",
                    entry.getParticipant().getId(), entry.getOwedAmount()));
            }
            Money contributed = entry.contributionTotal();
            if (!contributed.equals(entry.getOwedAmount())) {
                reasons.add(String.format(Locale.ROOT, "Contributions for %s sum to %s but owed amount is %s",
                    entry.getParticipant().getId(), contributed, entry.getOwedAmount()));
            }
        }

        return reasons.isEmpty() ? ValidationResult.valid() : ValidationResult.invalid(reasons);
    }
}
