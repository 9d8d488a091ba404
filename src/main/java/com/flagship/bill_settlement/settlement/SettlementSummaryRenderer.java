package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.money.Money;

/**
 * Short plain-text summary of a settlement, suitable for pasting into a chat
 * message. One line per participant, then the total and any residual note.
 */
public class SettlementSummaryRenderer {

    public String render(Settlement settlement) {
        StringBuilder out = new StringBuilder();
        out.append("Bill split for receipt ").append(settlement.getReceiptId()).append('\n');
        for (SettlementEntry entry : settlement.getEntries()) {
            out.append("- ")
                .append(entry.getParticipant().getDisplayName())
                .append(": ")
                .append(format(entry.getOwedAmount()))
                .append('\n');
        }
        out.append("Total: ").append(format(settlement.getGrandTotal())).append('\n');

        ResidualAdjustment residual = settlement.getResidualAdjustment();
        if (residual.isApplied()) {
            String name = settlement.entryFor(residual.getParticipantId())
                .map(entry -> entry.getParticipant().getDisplayName())
                .orElse(residual.getParticipantId());
            out.append("(").append(name).append(" covers a rounding difference of ")
                .append(format(residual.getAmount())).append(")\n");
        }
        return out.toString();
    }

    private static String format(Money amount) {
        return amount.getCurrency().name() + " " + amount.toDecimal().toPlainString();
    }
}
