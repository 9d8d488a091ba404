package com.flagship.bill_settlement.trace;

import com.flagship.bill_settlement.money.CurrencyCode;
import com.flagship.bill_settlement.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningTraceRendererTest {

    private final ReasoningTraceRenderer renderer = new ReasoningTraceRenderer();

    private static Money usd(String amount) {
        return Money.of(amount, CurrencyCode.USD);
    }

    @Test
    @DisplayName("Each step renders its header, description, inputs and amounts")
    void testRenderStep() {
        ReasoningTraceBuilder builder = new ReasoningTraceBuilder();
        Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put("line_total", "USD 30.00");
        inputs.put("weights", "a=1, b=1");
        Map<String, Money> amounts = new LinkedHashMap<>();
        amounts.put("a", usd("15.00"));
        amounts.put("b", usd("15.00"));
        builder.append(SubjectType.LINE, "pizza", StepAction.LINE_APPORTIONED, "Split pizza", inputs, amounts);
        builder.append(SubjectType.RECEIPT, "r-1", StepAction.RESIDUAL_ADJUSTED, "Residual to a",
            Map.of(), Map.of("a", usd("0.01")));

        String rendered = renderer.render(builder.build());

        assertEquals(
            "#0 LINE pizza [LINE_APPORTIONED]\n"
                + "  Split pizza\n"
                + "  line_total: USD 30.00\n"
                + "  weights: a=1, b=1\n"
                + "  => a 15.00, b 15.00\n"
                + "#1 RECEIPT r-1 [RESIDUAL_ADJUSTED]\n"
                + "  Residual to a\n"
                + "  => a 0.01\n",
            rendered);
    }

    @Test
    @DisplayName("Step indexes are dense and the trace is immutable")
    void testIndexesAndFiltering() {
        ReasoningTraceBuilder builder = new ReasoningTraceBuilder();
        builder.append(SubjectType.LINE, "x", StepAction.LINE_APPORTIONED, "x", Map.of(), Map.of());
        builder.append(SubjectType.LINE, "y", StepAction.LINE_APPORTIONED, "y", Map.of(), Map.of());
        builder.append(SubjectType.CHARGE, "tax", StepAction.CHARGE_APPORTIONED, "tax", Map.of(), Map.of());

        ReasoningTrace trace = builder.build();

        assertEquals(3, trace.size());
        for (int i = 0; i < trace.size(); i++) {
            assertEquals(i, trace.getSteps().get(i).getIndex());
        }
        assertEquals("tax", trace.getSteps().get(2).getSubjectId());
        assertEquals(StepAction.CHARGE_APPORTIONED, trace.getSteps().get(2).getAction());
        assertThrows(UnsupportedOperationException.class, () -> trace.getSteps().clear());
    }

    @Test
    @DisplayName("Rendering is identical under a locale with non-Latin digits")
    void testRenderIgnoresDefaultLocale() {
        ReasoningTraceBuilder builder = new ReasoningTraceBuilder();
        for (int i = 0; i < 12; i++) {
            builder.append(SubjectType.LINE, "line-" + i, StepAction.LINE_APPORTIONED, "Split line " + i,
                Map.of("line_total", "USD 12.00"), Map.of("a", usd("12.00")));
        }
        ReasoningTrace trace = builder.build();

        Locale original = Locale.getDefault();
        String english;
        String arabic;
        try {
            Locale.setDefault(Locale.ENGLISH);
            english = renderer.render(trace);
            Locale.setDefault(Locale.forLanguageTag("ar-EG"));
            arabic = renderer.render(trace);
        } finally {
            Locale.setDefault(original);
        }

        assertEquals(english, arabic);
        assertTrue(arabic.startsWith("#0 LINE line-0"), arabic);
        assertTrue(arabic.contains("#11 LINE line-11"), arabic);
    }
}
