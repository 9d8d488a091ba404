package com.flagship.bill_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for settling a structured receipt.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettlementRequest {

    @NotNull(message = "Receipt is required")
    @Valid
    @JsonProperty("receipt")
    private ReceiptRequest receipt;

    @NotNull(message = "Allocation is required")
    @Valid
    @JsonProperty("allocation")
    private AllocationRequest allocation;
}
