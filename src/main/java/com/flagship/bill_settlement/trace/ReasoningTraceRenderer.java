package com.flagship.bill_settlement.trace;

import com.flagship.bill_settlement.money.Money;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a reasoning trace as plain text, one block per step.
 *
 * Uses only the trace content, so equal traces render to identical text.
 */
public class ReasoningTraceRenderer {

    public String render(ReasoningTrace trace) {
        StringBuilder out = new StringBuilder();
        for (ReasoningStep step : trace.getSteps()) {
            out.append(renderStep(step));
        }
        return out.toString();
    }

    public String renderStep(ReasoningStep step) {
        StringBuilder out = new StringBuilder();
        out.append(String.format(Locale.ROOT, "#%d %s %s [%s]\n", step.getIndex(), step.getSubjectType(),
            step.getSubjectId(), step.getAction()));
        out.append("  ").append(step.getDescription()).append('\n');
        for (Map.Entry<String, String> input : step.getInputs().entrySet()) {
            out.append("  ").append(input.getKey()).append(": ").append(input.getValue())
                .append('\n');
        }
        out.append("  => ").append(formatAmounts(step.getAmounts())).append('\n');
        return out.toString();
    }

    private static String formatAmounts(Map<String, Money> amounts) {
        return amounts.entrySet().stream()
            .map(entry -> entry.getKey() + " " + entry.getValue().toDecimal().toPlainString())
            .collect(Collectors.joining(", "));
    }
}
