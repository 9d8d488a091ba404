package com.flagship.bill_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bill_settlement.receipt.ChargeBasis;
import com.flagship.bill_settlement.receipt.ChargeKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured receipt as supplied by the caller. Amounts are decimal major
 * units, e.g. {@code 10.01}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptRequest {

    @NotBlank(message = "Receipt id is required")
    @JsonProperty("id")
    private String id;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    private String currency;

    @NotEmpty(message = "At least one item line is required")
    @Valid
    @JsonProperty("lines")
    private List<Line> lines = new ArrayList<>();

    @Valid
    @JsonProperty("charges")
    private List<Charge> charges = new ArrayList<>();

    @NotNull(message = "Grand total is required")
    @JsonProperty("grand_total")
    private BigDecimal grandTotal;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Line {

        @NotBlank(message = "Line id is required")
        @JsonProperty("id")
        private String id;

        @JsonProperty("description")
        private String description;

        @NotNull(message = "Quantity is required")
        @JsonProperty("quantity")
        private BigDecimal quantity;

        @NotNull(message = "Unit price is required")
        @JsonProperty("unit_price")
        private BigDecimal unitPrice;

        /**
         * Printed line total; derived from unit price and quantity when absent.
         */
        @JsonProperty("line_total")
        private BigDecimal lineTotal;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Charge {

        @NotBlank(message = "Charge id is required")
        @JsonProperty("id")
        private String id;

        @NotNull(message = "Charge kind is required")
        @JsonProperty("kind")
        private ChargeKind kind;

        @NotNull(message = "Charge value is required")
        @JsonProperty("value")
        private BigDecimal value;

        @JsonProperty("basis")
        private ChargeBasis basis = ChargeBasis.FLAT;

        @JsonProperty("rate")
        private BigDecimal rate;
    }
}
