package com.flagship.bill_settlement.trace;

import com.flagship.bill_settlement.money.Money;
import lombok.Value;

import java.util.Map;

/**
 * One entry of a reasoning trace.
 *
 * Inputs are the figures the step started from, rendered as plain strings;
 * amounts are the resulting per-participant sub-amounts in ascending
 * participant id order. Both maps keep insertion order.
 */
@Value
public class ReasoningStep {
    int index;
    SubjectType subjectType;
    String subjectId;
    StepAction action;
    String description;
    Map<String, String> inputs;
    Map<String, Money> amounts;
}
