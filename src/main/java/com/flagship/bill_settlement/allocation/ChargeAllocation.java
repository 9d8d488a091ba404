package com.flagship.bill_settlement.allocation;

import lombok.Value;

import java.util.List;

/**
 * Policy for one charge line. Weights are only present for
 * {@link ChargeAllocationPolicy#ASSIGNED_TO_SPECIFIC_PARTICIPANTS}.
 */
@Value
public class ChargeAllocation {
    String chargeId;
    ChargeAllocationPolicy policy;
    List<ShareWeight> weights;

    public static ChargeAllocation proportional(String chargeId) {
        return new ChargeAllocation(chargeId, ChargeAllocationPolicy.PROPORTIONAL_TO_ITEM_SHARE, List.of());
    }

    public static ChargeAllocation equalSplit(String chargeId) {
        return new ChargeAllocation(chargeId, ChargeAllocationPolicy.EQUAL_SPLIT_ACROSS_PARTICIPANTS, List.of());
    }

    public static ChargeAllocation assigned(String chargeId, List<ShareWeight> weights) {
        return new ChargeAllocation(chargeId, ChargeAllocationPolicy.ASSIGNED_TO_SPECIFIC_PARTICIPANTS,
            List.copyOf(weights));
    }
}
