package com.flagship.bill_settlement.trace;

import lombok.Value;

import java.util.List;

/**
 * Ordered, immutable log of every apportionment and reconciliation decision of
 * one settlement run: item lines in receipt order, then charge lines in receipt
 * order, then the residual adjustment if there was one.
 */
@Value
public class ReasoningTrace {
    List<ReasoningStep> steps;

    public int size() {
        return steps.size();
    }
}
