package com.flagship.bill_settlement.allocation;

/**
 * How a tax, service charge or discount is spread across participants.
 */
public enum ChargeAllocationPolicy {
    /**
     * Weighted by each participant's item total. Default.
     */
    PROPORTIONAL_TO_ITEM_SHARE,

    /**
     * Equal weight for every participant in the run.
     */
    EQUAL_SPLIT_ACROSS_PARTICIPANTS,

    /**
     * Explicit weight list supplied with the allocation.
     */
    ASSIGNED_TO_SPECIFIC_PARTICIPANTS
}
