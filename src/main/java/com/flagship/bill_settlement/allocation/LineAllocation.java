package com.flagship.bill_settlement.allocation;

import lombok.Value;

import java.util.List;

/**
 * Owners of one receipt line: a non-empty weighted owner list plus optional
 * fixed amounts taken off the top.
 */
@Value
public class LineAllocation {
    String lineId;
    List<ShareWeight> shares;
    List<FixedShare> fixedShares;

    public static LineAllocation of(String lineId, List<ShareWeight> shares) {
        return new LineAllocation(lineId, List.copyOf(shares), List.of());
    }

    public static LineAllocation of(String lineId, List<ShareWeight> shares, List<FixedShare> fixedShares) {
        return new LineAllocation(lineId, List.copyOf(shares), List.copyOf(fixedShares));
    }
}
