package com.flagship.bill_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bill_settlement.allocation.ChargeAllocationPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured splitting instructions, typically produced by a language
 * understanding service from free-form text.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AllocationRequest {

    @NotEmpty(message = "At least one participant is required")
    @Valid
    @JsonProperty("participants")
    private List<Participant> participants = new ArrayList<>();

    @Valid
    @JsonProperty("lines")
    private List<Line> lines = new ArrayList<>();

    /**
     * Line ids split equally among every participant.
     */
    @JsonProperty("shared_lines")
    private List<String> sharedLines = new ArrayList<>();

    @Valid
    @JsonProperty("charges")
    private List<Charge> charges = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Participant {

        @NotBlank(message = "Participant id is required")
        @JsonProperty("id")
        private String id;

        @JsonProperty("display_name")
        private String displayName;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Line {

        @NotBlank(message = "Line id is required")
        @JsonProperty("line_id")
        private String lineId;

        @Valid
        @JsonProperty("shares")
        private List<Share> shares = new ArrayList<>();

        @Valid
        @JsonProperty("fixed")
        private List<Fixed> fixed = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Share {

        @NotBlank(message = "Participant id is required")
        @JsonProperty("participant_id")
        private String participantId;

        /**
         * Relative weight; one when absent.
         */
        @JsonProperty("weight")
        private BigDecimal weight;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Fixed {

        @NotBlank(message = "Participant id is required")
        @JsonProperty("participant_id")
        private String participantId;

        @NotNull(message = "Fixed amount is required")
        @JsonProperty("amount")
        private BigDecimal amount;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Charge {

        @NotBlank(message = "Charge id is required")
        @JsonProperty("charge_id")
        private String chargeId;

        @NotNull(message = "Charge policy is required")
        @JsonProperty("policy")
        private ChargeAllocationPolicy policy;

        @Valid
        @JsonProperty("weights")
        private List<Share> weights = new ArrayList<>();
    }
}
