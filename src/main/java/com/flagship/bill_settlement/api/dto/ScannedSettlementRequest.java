package com.flagship.bill_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for settling a receipt in the scanner's output shape.
 * Line ids are {@code item-1..n}; charge ids are {@code tax} and {@code service-charge}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScannedSettlementRequest {

    @NotNull(message = "Receipt is required")
    @Valid
    @JsonProperty("receipt")
    private ScannedReceiptRequest receipt;

    @NotNull(message = "Allocation is required")
    @Valid
    @JsonProperty("allocation")
    private AllocationRequest allocation;
}
