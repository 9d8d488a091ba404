package com.flagship.bill_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bill_settlement.money.Money;
import com.flagship.bill_settlement.settlement.Contribution;
import com.flagship.bill_settlement.settlement.ReconciliationWarning;
import com.flagship.bill_settlement.settlement.ResidualAdjustment;
import com.flagship.bill_settlement.settlement.Settlement;
import com.flagship.bill_settlement.settlement.SettlementEntry;
import com.flagship.bill_settlement.settlement.SettlementOutcome;
import com.flagship.bill_settlement.trace.ReasoningStep;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response DTO for a settlement run: the settlement, the verdict, warnings,
 * the structured reasoning trace, and two plain-text renderings.
 */
@Value
@Builder
public class SettlementResponse {

    @JsonProperty("receipt_id")
    String receiptId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("grand_total")
    BigDecimal grandTotal;

    @JsonProperty("entries")
    List<Entry> entries;

    @JsonProperty("residual_adjustment")
    Residual residualAdjustment;

    @JsonProperty("validation")
    Validation validation;

    @JsonProperty("warnings")
    List<Warning> warnings;

    @JsonProperty("trace")
    List<Step> trace;

    @JsonProperty("summary")
    String summary;

    @JsonProperty("explanation")
    String explanation;

    /**
     * Creates a SettlementResponse from an engine outcome and its text renderings.
     */
    public static SettlementResponse from(SettlementOutcome outcome, String summary, String explanation) {
        Settlement settlement = outcome.getSettlement();
        return SettlementResponse.builder()
            .receiptId(settlement.getReceiptId())
            .currency(settlement.getCurrency().name())
            .grandTotal(settlement.getGrandTotal().toDecimal())
            .entries(settlement.getEntries().stream().map(Entry::from).collect(Collectors.toList()))
            .residualAdjustment(Residual.from(settlement.getResidualAdjustment()))
            .validation(new Validation(outcome.getValidationResult().isValid(),
                outcome.getValidationResult().getReasons()))
            .warnings(outcome.getWarnings().stream().map(Warning::from).collect(Collectors.toList()))
            .trace(outcome.getTrace().getSteps().stream().map(Step::from).collect(Collectors.toList()))
            .summary(summary)
            .explanation(explanation)
            .build();
    }

    @Value
    public static class Entry {
        @JsonProperty("participant_id")
        String participantId;

        @JsonProperty("display_name")
        String displayName;

        @JsonProperty("owed")
        BigDecimal owed;

        @JsonProperty("contributions")
        List<Part> contributions;

        static Entry from(SettlementEntry entry) {
            return new Entry(
                entry.getParticipant().getId(),
                entry.getParticipant().getDisplayName(),
                entry.getOwedAmount().toDecimal(),
                entry.getContributions().stream().map(Part::from).collect(Collectors.toList()));
        }
    }

    @Value
    public static class Part {
        @JsonProperty("source")
        String source;

        @JsonProperty("source_id")
        String sourceId;

        @JsonProperty("amount")
        BigDecimal amount;

        static Part from(Contribution contribution) {
            return new Part(contribution.getSource().name(), contribution.getSourceId(),
                contribution.getAmount().toDecimal());
        }
    }

    @Value
    public static class Residual {
        @JsonProperty("participant_id")
        String participantId;

        @JsonProperty("amount")
        BigDecimal amount;

        static Residual from(ResidualAdjustment adjustment) {
            return new Residual(adjustment.getParticipantId(), adjustment.getAmount().toDecimal());
        }
    }

    @Value
    public static class Validation {
        @JsonProperty("valid")
        boolean valid;

        @JsonProperty("reasons")
        List<String> reasons;
    }

    @Value
    public static class Warning {
        @JsonProperty("participant_id")
        String participantId;

        @JsonProperty("residual")
        BigDecimal residual;

        @JsonProperty("message")
        String message;

        static Warning from(ReconciliationWarning warning) {
            return new Warning(warning.getParticipantId(), warning.getResidual().toDecimal(), warning.getMessage());
        }
    }

    @Value
    public static class Step {
        @JsonProperty("index")
        int index;

        @JsonProperty("subject_type")
        String subjectType;

        @JsonProperty("subject_id")
        String subjectId;

        @JsonProperty("action")
        String action;

        @JsonProperty("description")
        String description;

        @JsonProperty("inputs")
        Map<String, String> inputs;

        @JsonProperty("amounts")
        Map<String, BigDecimal> amounts;

        static Step from(ReasoningStep step) {
            Map<String, BigDecimal> amounts = new LinkedHashMap<>();
            for (Map.Entry<String, Money> amount : step.getAmounts().entrySet()) {
                amounts.put(amount.getKey(), amount.getValue().toDecimal());
            }
            return new Step(step.getIndex(), step.getSubjectType().name(), step.getSubjectId(),
                step.getAction().name(), step.getDescription(), step.getInputs(), amounts);
        }
    }
}
