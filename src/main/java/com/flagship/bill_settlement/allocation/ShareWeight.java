package com.flagship.bill_settlement.allocation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A participant's relative weight in a split. Weights of one split are
 * normalized against each other and need not sum to one.
 */
@Value
public class ShareWeight {
    String participantId;
    BigDecimal weight;

    public static ShareWeight of(String participantId, BigDecimal weight) {
        return new ShareWeight(participantId, weight);
    }

    public static ShareWeight of(String participantId, long weight) {
        return new ShareWeight(participantId, BigDecimal.valueOf(weight));
    }
}
