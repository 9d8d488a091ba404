package com.flagship.bill_settlement.api;

import com.flagship.bill_settlement.allocation.Allocation;
import com.flagship.bill_settlement.exception.SettlementException;
import com.flagship.bill_settlement.observability.CorrelationContext;
import com.flagship.bill_settlement.observability.SettlementMetrics;
import com.flagship.bill_settlement.receipt.Receipt;
import com.flagship.bill_settlement.settlement.SettlementEngine;
import com.flagship.bill_settlement.settlement.SettlementOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Request-side wrapper around the settlement engine.
 *
 * Adds around the pure engine:
 * - receipt id in the MDC for structured logging
 * - metrics for completed, rejected and residual-adjusted runs
 * - logging of invalid verdicts
 *
 * The engine's result and exceptions pass through unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private final SettlementEngine settlementEngine;
    private final SettlementMetrics settlementMetrics;

    public SettlementOutcome settle(Receipt receipt, Allocation allocation, String operation) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.RECEIPT_ID_MDC_KEY, receipt.getId());

        log.info("Settling receipt: lines={}, charges={}, participants={}, grandTotal={}",
                receipt.getLines().size(), receipt.getCharges().size(),
                allocation.getParticipants().size(), receipt.getGrandTotal());

        try {
            SettlementOutcome outcome = settlementEngine.settle(receipt, allocation);

            boolean valid = outcome.getValidationResult().isValid();
            settlementMetrics.recordSettlementCompleted(receipt.getCurrency().name(), valid);
            if (outcome.getSettlement().getResidualAdjustment().isApplied()) {
                settlementMetrics.recordResidualAdjusted(receipt.getCurrency().name());
            }
            if (!valid) {
                log.warn("Settlement failed validation: reasons={}", outcome.getValidationResult().getReasons());
            }

            long duration = System.currentTimeMillis() - startTime;
            settlementMetrics.recordLatency(operation, duration);
            log.info("Settlement completed: valid={}, steps={}, warnings={}, duration={}ms",
                    valid, outcome.getTrace().size(), outcome.getWarnings().size(), duration);

            return outcome;

        } catch (SettlementException e) {
            long duration = System.currentTimeMillis() - startTime;
            settlementMetrics.recordSettlementRejected(e.getClass().getSimpleName());
            settlementMetrics.recordLatency(operation, duration);
            log.warn("Settlement rejected: error={}, subjectId={}, duration={}ms",
                    e.getMessage(), e.getSubjectId(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.RECEIPT_ID_MDC_KEY);
        }
    }
}
