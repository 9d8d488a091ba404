package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.allocation.Allocation;
import com.flagship.bill_settlement.allocation.ChargeAllocation;
import com.flagship.bill_settlement.allocation.FixedShare;
import com.flagship.bill_settlement.allocation.LineAllocation;
import com.flagship.bill_settlement.allocation.Participant;
import com.flagship.bill_settlement.allocation.ShareWeight;
import com.flagship.bill_settlement.exception.InvalidAllocationException;
import com.flagship.bill_settlement.money.Money;
import com.flagship.bill_settlement.receipt.ChargeBasis;
import com.flagship.bill_settlement.receipt.ChargeLine;
import com.flagship.bill_settlement.receipt.Receipt;
import com.flagship.bill_settlement.receipt.ReceiptLine;
import com.flagship.bill_settlement.trace.ReasoningTraceBuilder;
import com.flagship.bill_settlement.trace.StepAction;
import com.flagship.bill_settlement.trace.SubjectType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Distributes every receipt line and every charge line across participants.
 *
 * Two passes:
 * 1. Item lines in receipt order. Fixed amounts come off the top, the rest is
 *    split by {@link Money#allocate} over the owners in ascending id order.
 * 2. Charge lines in receipt order, weighted according to the charge policy.
 *    The proportional policy weights by the item totals from pass 1.
 *
 * Every split is exact, so the running totals already sum to subtotal plus
 * charges. Each line and charge appends one reasoning step.
 */
@Slf4j
public class ApportionmentCalculator {

    public ApportionmentResult apportion(Receipt receipt, Allocation allocation, ReasoningTraceBuilder trace) {
        Money zero = Money.zero(receipt.getCurrency());
        Map<String, List<Contribution>> contributions = new LinkedHashMap<>();
        Map<String, Money> totals = new LinkedHashMap<>();
        Map<String, Money> itemTotals = new LinkedHashMap<>();
        for (Participant participant : allocation.getParticipants()) {
            contributions.put(participant.getId(), new ArrayList<>());
            totals.put(participant.getId(), zero);
            itemTotals.put(participant.getId(), zero);
        }

        for (ReceiptLine line : receipt.getLines()) {
            Map<String, Money> amounts = apportionLine(line, allocation.lineAllocation(line.getId()), trace);
            amounts.forEach((participantId, amount) -> {
                contributions.get(participantId).add(new Contribution(ContributionSource.LINE, line.getId(), amount));
                totals.merge(participantId, amount, Money::add);
                itemTotals.merge(participantId, amount, Money::add);
            });
        }

        for (ChargeLine charge : receipt.getCharges()) {
            Map<String, Money> amounts = apportionCharge(charge, allocation, itemTotals, trace);
            amounts.forEach((participantId, amount) -> {
                contributions.get(participantId).add(new Contribution(ContributionSource.CHARGE, charge.getId(), amount));
                totals.merge(participantId, amount, Money::add);
            });
        }

        Map<String, List<Contribution>> frozen = new LinkedHashMap<>();
        contributions.forEach((id, list) -> frozen.put(id, Collections.unmodifiableList(list)));
        log.debug("Apportioned {} lines and {} charges across {} participants",
            receipt.getLines().size(), receipt.getCharges().size(), totals.size());

        return new ApportionmentResult(
            Collections.unmodifiableMap(frozen),
            Collections.unmodifiableMap(totals),
            Collections.unmodifiableMap(itemTotals));
    }

    private Map<String, Money> apportionLine(ReceiptLine line, LineAllocation lineAllocation,
                                             ReasoningTraceBuilder trace) {
        Map<String, Money> amounts = new TreeMap<>();
        Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put("unit_price", line.getUnitPrice().toString());
        inputs.put("quantity", line.getQuantity().toPlainString());
        inputs.put("line_total", line.getLineTotal().toString());

        Money remaining = line.getLineTotal();
        if (!lineAllocation.getFixedShares().isEmpty()) {
            for (FixedShare fixed : lineAllocation.getFixedShares()) {
                amounts.merge(fixed.getParticipantId(), fixed.getAmount(), Money::add);
                remaining = remaining.subtract(fixed.getAmount());
            }
            inputs.put("fixed", formatFixed(lineAllocation.getFixedShares()));
            inputs.put("remaining", remaining.toString());
        }

        List<ShareWeight> owners = sortedById(lineAllocation.getShares());
        inputs.put("weights", formatWeights(owners));
        List<Money> parts = allocate(line.getId(), remaining, owners);
        for (int i = 0; i < owners.size(); i++) {
            amounts.merge(owners.get(i).getParticipantId(), parts.get(i), Money::add);
        }

        trace.append(SubjectType.LINE, line.getId(), StepAction.LINE_APPORTIONED,
            String.format(Locale.ROOT, "Split '%s' (%s) across %d owner(s) by weight",
                line.getDescription(), line.getLineTotal(), owners.size()),
            inputs, amounts);
        return amounts;
    }

    private Map<String, Money> apportionCharge(ChargeLine charge, Allocation allocation,
                                               Map<String, Money> itemTotals, ReasoningTraceBuilder trace) {
        ChargeAllocation chargeAllocation = allocation.chargeAllocation(charge.getId());
        List<ShareWeight> weights;
        switch (chargeAllocation.getPolicy()) {
            case PROPORTIONAL_TO_ITEM_SHARE:
                weights = itemTotals.entrySet().stream()
                    .filter(entry -> entry.getValue().signum() > 0)
                    .map(entry -> ShareWeight.of(entry.getKey(), entry.getValue().toDecimal()))
                    .collect(Collectors.toList());
                if (weights.isEmpty()) {
                    throw new InvalidAllocationException(charge.getId(),
                        "No participant has a positive item share to weight charge " + charge.getId());
                }
                break;
            case EQUAL_SPLIT_ACROSS_PARTICIPANTS:
                weights = allocation.getParticipants().stream()
                    .map(participant -> ShareWeight.of(participant.getId(), BigDecimal.ONE))
                    .collect(Collectors.toList());
                break;
            case ASSIGNED_TO_SPECIFIC_PARTICIPANTS:
                weights = chargeAllocation.getWeights();
                break;
            default:
                throw new IllegalStateException("Unhandled charge policy: " + chargeAllocation.getPolicy());
        }

        List<ShareWeight> owners = sortedById(weights);
        List<Money> parts = allocate(charge.getId(), charge.getValue(), owners);
        Map<String, Money> amounts = new TreeMap<>();
        for (int i = 0; i < owners.size(); i++) {
            amounts.put(owners.get(i).getParticipantId(), parts.get(i));
        }

        Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put("kind", charge.getKind().name());
        inputs.put("basis", charge.getBasis().name());
        if (charge.getBasis() == ChargeBasis.PERCENTAGE_OF_SUBTOTAL) {
            inputs.put("rate", charge.getRate().toPlainString() + "%");
        }
        inputs.put("value", charge.getValue().toString());
        inputs.put("policy", chargeAllocation.getPolicy().name());
        inputs.put("weights", formatWeights(owners));

        trace.append(SubjectType.CHARGE, charge.getId(), StepAction.CHARGE_APPORTIONED,
            String.format(Locale.ROOT, "Split %s %s across %d participant(s) using %s",
                charge.getKind(), charge.getValue(), owners.size(), chargeAllocation.getPolicy()),
            inputs, amounts);
        return amounts;
    }

    private static List<Money> allocate(String subjectId, Money amount, List<ShareWeight> owners) {
        List<BigDecimal> weights = owners.stream().map(ShareWeight::getWeight).collect(Collectors.toList());
        try {
            return amount.allocate(weights);
        } catch (InvalidAllocationException e) {
            throw new InvalidAllocationException(subjectId, subjectId + ": " + e.getMessage());
        }
    }

    private static List<ShareWeight> sortedById(List<ShareWeight> shares) {
        List<ShareWeight> sorted = new ArrayList<>(shares);
        sorted.sort(Comparator.comparing(ShareWeight::getParticipantId));
        return sorted;
    }

    private static String formatWeights(List<ShareWeight> weights) {
        return weights.stream()
            .map(share -> share.getParticipantId() + "=" + share.getWeight().stripTrailingZeros().toPlainString())
            .collect(Collectors.joining(", "));
    }

    private static String formatFixed(List<FixedShare> fixedShares) {
        return fixedShares.stream()
            .map(fixed -> fixed.getParticipantId() + "=" + fixed.getAmount())
            .collect(Collectors.joining(", "));
    }
}
