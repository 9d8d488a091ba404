package com.flagship.bill_settlement.settlement;

import lombok.Value;

import java.util.List;

/**
 * Verdict of the final validation gate: valid, or invalid with reasons.
 */
@Value
public class ValidationResult {
    boolean valid;
    List<String> reasons;

    public static ValidationResult valid() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult invalid(List<String> reasons) {
        if (reasons == null || reasons.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one reason");
        }
        return new ValidationResult(false, List.copyOf(reasons));
    }
}
