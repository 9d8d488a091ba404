package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.allocation.Allocation;
import com.flagship.bill_settlement.exception.UnreconcilableSettlementException;
import com.flagship.bill_settlement.money.Money;
import com.flagship.bill_settlement.receipt.Receipt;
import com.flagship.bill_settlement.trace.ReasoningTraceBuilder;
import com.flagship.bill_settlement.trace.StepAction;
import com.flagship.bill_settlement.trace.SubjectType;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares the apportioned totals with the declared grand total.
 *
 * Apportionment is exact, so the only residual that can appear is the
 * difference the receipt itself carries between its grand total and
 * subtotal plus charges (tolerated at ingestion). A residual within
 * {@code tolerancePerParticipant * participants} minor units goes entirely to
 * the participant with the largest total, ties to the lowest id, and is logged
 * as the last reasoning step. Anything larger fails the run.
 */
@Slf4j
public class ReconciliationPass {

    private final long tolerancePerParticipant;

    public ReconciliationPass(long tolerancePerParticipant) {
        if (tolerancePerParticipant < 0) {
            throw new IllegalArgumentException("Residual tolerance must not be negative");
        }
        this.tolerancePerParticipant = tolerancePerParticipant;
    }

    public ReconciliationOutcome reconcile(Receipt receipt, Allocation allocation,
                                           ApportionmentResult apportioned, ReasoningTraceBuilder trace) {
        Money apportionedTotal = apportioned.apportionedTotal(Money.zero(receipt.getCurrency()));
        Money residual = receipt.getGrandTotal().subtract(apportionedTotal);

        if (residual.isZero()) {
            return new ReconciliationOutcome(apportioned, ResidualAdjustment.none(receipt.getCurrency()), List.of());
        }

        long tolerance = tolerancePerParticipant * allocation.getParticipants().size();
        if (Math.abs(residual.getMinorUnits()) > tolerance) {
            log.error("Residual exceeds tolerance: receiptId={}, residual={}, toleranceMinorUnits={}",
                receipt.getId(), residual, tolerance);
            throw new UnreconcilableSettlementException(receipt.getId(), residual.getMinorUnits(), tolerance);
        }

        String absorber = largestTotal(apportioned.getTotals());
        ApportionmentResult adjusted = apportioned.withContribution(absorber,
            new Contribution(ContributionSource.RESIDUAL, receipt.getId(), residual));

        Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put("grand_total", receipt.getGrandTotal().toString());
        inputs.put("apportioned_total", apportionedTotal.toString());
        inputs.put("residual", residual.toString());
        inputs.put("tolerance_minor_units", String.valueOf(tolerance));
        trace.append(SubjectType.RECEIPT, receipt.getId(), StepAction.RESIDUAL_ADJUSTED,
            String.format(Locale.ROOT, "Assigned residual %s to %s, the participant with the largest total", residual, absorber),
            inputs, Map.of(absorber, residual));

        String message = String.format(Locale.ROOT,
            "Declared grand total %s differs from apportioned total %s; %s absorbed %s",
            receipt.getGrandTotal(), apportionedTotal, absorber, residual);
        log.warn("Residual adjusted: receiptId={}, participantId={}, residual={}", receipt.getId(), absorber, residual);

        return new ReconciliationOutcome(
            adjusted,
            new ResidualAdjustment(absorber, residual),
            List.of(new ReconciliationWarning(receipt.getId(), absorber, residual, message)));
    }

    private static String largestTotal(Map<String, Money> totals) {
        String best = null;
        Money bestTotal = null;
        for (Map.Entry<String, Money> entry : totals.entrySet()) {
            int comparison = bestTotal == null ? 1 : entry.getValue().compareTo(bestTotal);
            if (comparison > 0 || (comparison == 0 && entry.getKey().compareTo(best) < 0)) {
                best = entry.getKey();
                bestTotal = entry.getValue();
            }
        }
        return best;
    }
}
