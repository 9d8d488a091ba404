package com.flagship.bill_settlement.config;

import com.flagship.bill_settlement.receipt.IngestionTolerance;
import com.flagship.bill_settlement.settlement.ApportionmentCalculator;
import com.flagship.bill_settlement.settlement.ReconciliationPass;
import com.flagship.bill_settlement.settlement.SettlementEngine;
import com.flagship.bill_settlement.settlement.SettlementSummaryRenderer;
import com.flagship.bill_settlement.settlement.SettlementValidator;
import com.flagship.bill_settlement.trace.ReasoningTraceRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the settlement engine and its tolerances.
 *
 * Tolerances are in minor units:
 * - settlement.tolerance.line-minor-units: printed line total vs unit price x quantity
 * - settlement.tolerance.charge-minor-units: percentage charge vs rate x subtotal
 * - settlement.tolerance.grand-total-minor-units: grand total vs subtotal + charges
 * - settlement.tolerance.residual-per-participant-minor-units: residual absorbed at reconciliation
 */
@Configuration
@Slf4j
public class SettlementConfig {

    @Value("${settlement.tolerance.line-minor-units:1}")
    private long lineToleranceMinorUnits;

    @Value("${settlement.tolerance.charge-minor-units:1}")
    private long chargeToleranceMinorUnits;

    @Value("${settlement.tolerance.grand-total-minor-units:1}")
    private long grandTotalToleranceMinorUnits;

    @Value("${settlement.tolerance.residual-per-participant-minor-units:1}")
    private long residualTolerancePerParticipant;

    @Bean
    public IngestionTolerance ingestionTolerance() {
        log.info("Ingestion tolerance: line={}, charge={}, grandTotal={} minor units",
            lineToleranceMinorUnits, chargeToleranceMinorUnits, grandTotalToleranceMinorUnits);
        return new IngestionTolerance(lineToleranceMinorUnits, chargeToleranceMinorUnits,
            grandTotalToleranceMinorUnits);
    }

    @Bean
    public SettlementEngine settlementEngine() {
        log.info("Residual tolerance: {} minor units per participant", residualTolerancePerParticipant);
        return new SettlementEngine(
            new ApportionmentCalculator(),
            new ReconciliationPass(residualTolerancePerParticipant),
            new SettlementValidator());
    }

    @Bean
    public ReasoningTraceRenderer reasoningTraceRenderer() {
        return new ReasoningTraceRenderer();
    }

    @Bean
    public SettlementSummaryRenderer settlementSummaryRenderer() {
        return new SettlementSummaryRenderer();
    }
}
