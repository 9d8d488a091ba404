package com.flagship.bill_settlement.trace;

import com.flagship.bill_settlement.money.Money;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only collector of reasoning steps for a single run.
 * Step indexes are assigned densely from zero in append order.
 * Not shared between runs.
 */
public class ReasoningTraceBuilder {

    private final List<ReasoningStep> steps = new ArrayList<>();

    public ReasoningStep append(SubjectType subjectType, String subjectId, StepAction action,
                                String description, Map<String, String> inputs, Map<String, Money> amounts) {
        ReasoningStep step = new ReasoningStep(
            steps.size(),
            subjectType,
            subjectId,
            action,
            description,
            Collections.unmodifiableMap(new LinkedHashMap<>(inputs)),
            Collections.unmodifiableMap(new LinkedHashMap<>(amounts))
        );
        steps.add(step);
        return step;
    }

    public ReasoningTrace build() {
        return new ReasoningTrace(List.copyOf(steps));
    }
}
