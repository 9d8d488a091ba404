package com.flagship.bill_settlement.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
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
 * Receipt in the shape returned by the image-to-structured-data service:
 * flat item list plus optional subtotal, tax and service charge figures.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScannedReceiptRequest {

    @JsonProperty("id")
    private String id;

    @NotEmpty(message = "At least one item is required")
    @Valid
    @JsonProperty("items")
    private List<Item> items = new ArrayList<>();

    @JsonProperty("subtotal")
    private BigDecimal subtotal;

    @JsonProperty("tax")
    private BigDecimal tax;

    @JsonProperty("service_charge")
    private BigDecimal serviceCharge;

    @NotNull(message = "Total is required")
    @JsonProperty("total")
    private BigDecimal total;

    /**
     * ISO code or a common symbol such as "$".
     */
    @NotBlank(message = "Currency is required")
    @JsonProperty("currency")
    private String currency;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {

        @NotBlank(message = "Item name is required")
        @JsonProperty("name")
        private String name;

        /**
         * Unit price.
         */
        @NotNull(message = "Item price is required")
        @JsonProperty("price")
        private BigDecimal price;

        /**
         * One when absent.
         */
        @JsonProperty("quantity")
        private BigDecimal quantity;
    }
}
