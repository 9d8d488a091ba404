package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.allocation.Allocation;
import com.flagship.bill_settlement.allocation.Participant;
import com.flagship.bill_settlement.exception.InvalidAllocationException;
import com.flagship.bill_settlement.exception.UnreconcilableSettlementException;
import com.flagship.bill_settlement.exception.ValidationException;
import com.flagship.bill_settlement.exception.Violation;
import com.flagship.bill_settlement.receipt.Receipt;
import com.flagship.bill_settlement.trace.ReasoningTraceBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Settlement reconciliation engine.
 *
 * Converts a receipt and its splitting instructions into a settlement, the
 * reasoning trace behind it, and a validation verdict:
 *
 *   allocation cross-check -> apportionment -> reconciliation -> validation
 *
 * The engine is stateless and re-entrant. A run allocates its own trace and
 * result graph, performs no I/O and uses no clock or randomness, so the same
 * input always yields an equal outcome.
 */
public class SettlementEngine {

    private final ApportionmentCalculator calculator;
    private final ReconciliationPass reconciliationPass;
    private final SettlementValidator validator;

    public SettlementEngine(ApportionmentCalculator calculator, ReconciliationPass reconciliationPass,
                            SettlementValidator validator) {
        this.calculator = calculator;
        this.reconciliationPass = reconciliationPass;
        this.validator = validator;
    }

    /**
     * Engine with a residual tolerance of one minor unit per participant.
     */
    public static SettlementEngine withDefaults() {
        return new SettlementEngine(new ApportionmentCalculator(), new ReconciliationPass(1), new SettlementValidator());
    }

    /**
     * Settles a receipt.
     *
     * @return settlement, reasoning trace, verdict and any reconciliation warnings
     * @throws ValidationException if the allocation does not fit the receipt
     * @throws InvalidAllocationException if a weight set cannot be apportioned
     * @throws UnreconcilableSettlementException if the residual exceeds tolerance
     */
    public SettlementOutcome settle(Receipt receipt, Allocation allocation) {
        if (receipt == null) {
            throw new ValidationException(Violation.MISSING_FIELD, null, "Receipt is required");
        }
        if (allocation == null) {
            throw new ValidationException(Violation.MISSING_FIELD, receipt.getId(), "Allocation is required");
        }
        allocation.validateAgainst(receipt);

        ReasoningTraceBuilder trace = new ReasoningTraceBuilder();
        ApportionmentResult apportioned = calculator.apportion(receipt, allocation, trace);
        ReconciliationOutcome reconciled = reconciliationPass.reconcile(receipt, allocation, apportioned, trace);

        List<SettlementEntry> entries = new ArrayList<>();
        ApportionmentResult result = reconciled.getResult();
        for (Participant participant : allocation.getParticipants()) {
            entries.add(new SettlementEntry(
                participant,
                result.getTotals().get(participant.getId()),
                result.getContributions().get(participant.getId())));
        }
        Settlement settlement = new Settlement(
            receipt.getId(),
            receipt.getCurrency(),
            receipt.getGrandTotal(),
            List.copyOf(entries),
            reconciled.getResidualAdjustment());

        ValidationResult verdict = validator.validate(receipt, allocation, settlement);
        return new SettlementOutcome(settlement, trace.build(), verdict, reconciled.getWarnings());
    }
}
