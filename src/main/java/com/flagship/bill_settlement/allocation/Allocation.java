package com.flagship.bill_settlement.allocation;

import com.flagship.bill_settlement.exception.ValidationException;
import com.flagship.bill_settlement.exception.Violation;
import com.flagship.bill_settlement.money.Money;
import com.flagship.bill_settlement.receipt.ChargeLine;
import com.flagship.bill_settlement.receipt.Receipt;
import com.flagship.bill_settlement.receipt.ReceiptLine;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validated splitting instructions: who owes which line, and how each charge
 * is spread.
 *
 * Standalone invariants are checked by {@link Builder#build()}:
 * - The participant set is non-empty with unique ids
 * - Each line is allocated at most once, to a non-empty owner list
 * - Every weight is positive and every referenced participant is declared
 * - Assigned charges carry a non-empty weight list
 *
 * Invariants that need the receipt (every line covered, no unknown line or
 * charge ids, fixed amounts within the line total) are checked by
 * {@link #validateAgainst(Receipt)}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Allocation {
    List<Participant> participants;
    Map<String, LineAllocation> lineAllocations;
    Map<String, ChargeAllocation> chargeAllocations;

    public static Builder builder() {
        return new Builder();
    }

    public LineAllocation lineAllocation(String lineId) {
        return lineAllocations.get(lineId);
    }

    /**
     * The policy for a charge, {@link ChargeAllocationPolicy#PROPORTIONAL_TO_ITEM_SHARE}
     * when none was given.
     */
    public ChargeAllocation chargeAllocation(String chargeId) {
        ChargeAllocation allocation = chargeAllocations.get(chargeId);
        return allocation != null ? allocation : ChargeAllocation.proportional(chargeId);
    }

    /**
     * Cross-checks this allocation against the receipt it is meant to split.
     *
     * @throws ValidationException naming the first offending line or charge id
     */
    public void validateAgainst(Receipt receipt) {
        for (String lineId : lineAllocations.keySet()) {
            if (receipt.findLine(lineId).isEmpty()) {
                throw new ValidationException(Violation.UNKNOWN_LINE, lineId,
                    "Allocation references unknown receipt line: " + lineId);
            }
        }
        for (String chargeId : chargeAllocations.keySet()) {
            if (receipt.findCharge(chargeId).isEmpty()) {
                throw new ValidationException(Violation.UNKNOWN_CHARGE, chargeId,
                    "Allocation references unknown charge line: " + chargeId);
            }
        }

        for (ReceiptLine line : receipt.getLines()) {
            LineAllocation allocation = lineAllocations.get(line.getId());
            if (allocation == null) {
                throw new ValidationException(Violation.UNALLOCATED_LINE, line.getId(),
                    "Receipt line is not allocated to anyone: " + line.getId());
            }
            validateFixedShares(line, allocation);
        }

        for (ChargeLine charge : receipt.getCharges()) {
            ChargeAllocation allocation = chargeAllocation(charge.getId());
            if (allocation.getPolicy() == ChargeAllocationPolicy.ASSIGNED_TO_SPECIFIC_PARTICIPANTS
                    && allocation.getWeights().isEmpty()) {
                throw new ValidationException(Violation.MISSING_CHARGE_ASSIGNMENT, charge.getId(),
                    "Assigned charge has no participants: " + charge.getId());
            }
        }
    }

    private static void validateFixedShares(ReceiptLine line, LineAllocation allocation) {
        Money fixedTotal = Money.zero(line.getLineTotal().getCurrency());
        for (FixedShare fixed : allocation.getFixedShares()) {
            if (fixed.getAmount().getCurrency() != line.getLineTotal().getCurrency()) {
                throw new ValidationException(Violation.CURRENCY_MISMATCH, line.getId(), String.format(Locale.ROOT,
                    "Fixed amount %s is not in receipt currency", fixed.getAmount()));
            }
            if (fixed.getAmount().isNegative()) {
                throw new ValidationException(Violation.FIXED_SHARES_EXCEED_LINE_TOTAL, line.getId(),
                    "Fixed amount must not be negative: " + fixed.getAmount());
            }
            try {
                fixedTotal = fixedTotal.add(fixed.getAmount());
            } catch (ArithmeticException e) {
                throw new ValidationException(Violation.AMOUNT_OUT_OF_RANGE, line.getId(),
                    "Fixed amounts for " + line.getId() + " exceed the representable range");
            }
        }
        if (fixedTotal.compareTo(line.getLineTotal()) > 0) {
            throw new ValidationException(Violation.FIXED_SHARES_EXCEED_LINE_TOTAL, line.getId(), String.format(Locale.ROOT,
                "Fixed amounts %s exceed line total %s", fixedTotal, line.getLineTotal()));
        }
    }

    /**
     * Collects splitting instructions and validates them on {@link #build()}.
     */
    public static final class Builder {

        private final List<Participant> participants = new ArrayList<>();
        private final List<String> sharedLines = new ArrayList<>();
        private final List<LineAllocation> lines = new ArrayList<>();
        private final Map<String, List<FixedShare>> fixedShares = new LinkedHashMap<>();
        private final List<ChargeAllocation> charges = new ArrayList<>();

        private Builder() {
        }

        public Builder participant(String id, String displayName) {
            participants.add(Participant.of(id, displayName));
            return this;
        }

        public Builder participant(Participant participant) {
            participants.add(participant);
            return this;
        }

        /**
         * Splits a line equally between the given participants.
         */
        public Builder assign(String lineId, String... participantIds) {
            List<ShareWeight> shares = new ArrayList<>();
            for (String participantId : participantIds) {
                shares.add(ShareWeight.of(participantId, BigDecimal.ONE));
            }
            lines.add(LineAllocation.of(lineId, shares));
            return this;
        }

        /**
         * Splits a line by explicit weights.
         */
        public Builder share(String lineId, List<ShareWeight> shares) {
            lines.add(LineAllocation.of(lineId, shares));
            return this;
        }

        public Builder line(LineAllocation allocation) {
            lines.add(allocation);
            return this;
        }

        /**
         * Splits a line equally among every participant of the run.
         */
        public Builder sharedByAll(String lineId) {
            sharedLines.add(lineId);
            return this;
        }

        /**
         * Charges a fixed part of a line to one participant before the weighted split.
         */
        public Builder fixed(String lineId, String participantId, Money amount) {
            fixedShares.computeIfAbsent(lineId, key -> new ArrayList<>())
                .add(FixedShare.of(participantId, amount));
            return this;
        }

        public Builder charge(ChargeAllocation allocation) {
            charges.add(allocation);
            return this;
        }

        public Builder chargePolicy(String chargeId, ChargeAllocationPolicy policy) {
            if (policy == ChargeAllocationPolicy.ASSIGNED_TO_SPECIFIC_PARTICIPANTS) {
                throw new IllegalArgumentException("Use assignCharge to supply weights for " + chargeId);
            }
            charges.add(policy == ChargeAllocationPolicy.EQUAL_SPLIT_ACROSS_PARTICIPANTS
                ? ChargeAllocation.equalSplit(chargeId)
                : ChargeAllocation.proportional(chargeId));
            return this;
        }

        public Builder assignCharge(String chargeId, List<ShareWeight> weights) {
            charges.add(ChargeAllocation.assigned(chargeId, weights));
            return this;
        }

        public Allocation build() {
            if (participants.isEmpty()) {
                throw new ValidationException(Violation.EMPTY_PARTICIPANTS, null,
                    "At least one participant is required");
            }
            Set<String> participantIds = new HashSet<>();
            for (Participant participant : participants) {
                if (participant == null || participant.getId() == null || participant.getId().isBlank()) {
                    throw new ValidationException(Violation.MISSING_FIELD, null, "Participant id is required");
                }
                if (!participantIds.add(participant.getId())) {
                    throw new ValidationException(Violation.DUPLICATE_ID, participant.getId(),
                        "Duplicate participant: " + participant.getId());
                }
            }

            List<LineAllocation> allLines = new ArrayList<>(lines);
            for (String lineId : sharedLines) {
                List<ShareWeight> shares = new ArrayList<>();
                for (Participant participant : participants) {
                    shares.add(ShareWeight.of(participant.getId(), BigDecimal.ONE));
                }
                allLines.add(LineAllocation.of(lineId, shares));
            }

            Map<String, LineAllocation> lineMap = new LinkedHashMap<>();
            for (LineAllocation line : allLines) {
                String lineId = line.getLineId();
                if (lineId == null || lineId.isBlank()) {
                    throw new ValidationException(Violation.MISSING_FIELD, null, "Line allocation requires a line id");
                }
                if (lineMap.containsKey(lineId)) {
                    throw new ValidationException(Violation.DUPLICATE_LINE_ALLOCATION, lineId,
                        "Receipt line is allocated more than once: " + lineId);
                }
                if (line.getShares() == null || line.getShares().isEmpty()) {
                    throw new ValidationException(Violation.EMPTY_SHARES, lineId,
                        "Receipt line has no owners: " + lineId);
                }
                validateWeights(lineId, line.getShares(), participantIds);

                List<FixedShare> fixed = new ArrayList<>(line.getFixedShares());
                fixed.addAll(fixedShares.getOrDefault(lineId, List.of()));
                for (FixedShare share : fixed) {
                    requireParticipant(lineId, share.getParticipantId(), participantIds);
                    if (share.getAmount() == null) {
                        throw new ValidationException(Violation.MISSING_FIELD, lineId, "Fixed amount is required");
                    }
                }
                lineMap.put(lineId, LineAllocation.of(lineId, line.getShares(), fixed));
            }
            for (String lineId : fixedShares.keySet()) {
                if (!lineMap.containsKey(lineId)) {
                    throw new ValidationException(Violation.EMPTY_SHARES, lineId,
                        "Fixed amounts given for a line with no owners: " + lineId);
                }
            }

            Map<String, ChargeAllocation> chargeMap = new LinkedHashMap<>();
            for (ChargeAllocation charge : charges) {
                String chargeId = charge.getChargeId();
                if (chargeId == null || chargeId.isBlank() || charge.getPolicy() == null) {
                    throw new ValidationException(Violation.MISSING_FIELD, chargeId,
                        "Charge allocation requires a charge id and a policy");
                }
                if (chargeMap.containsKey(chargeId)) {
                    throw new ValidationException(Violation.DUPLICATE_ID, chargeId,
                        "Charge is allocated more than once: " + chargeId);
                }
                if (charge.getPolicy() == ChargeAllocationPolicy.ASSIGNED_TO_SPECIFIC_PARTICIPANTS) {
                    if (charge.getWeights().isEmpty()) {
                        throw new ValidationException(Violation.MISSING_CHARGE_ASSIGNMENT, chargeId,
                            "Assigned charge has no participants: " + chargeId);
                    }
                    validateWeights(chargeId, charge.getWeights(), participantIds);
                }
                chargeMap.put(chargeId, charge);
            }

            return new Allocation(
                List.copyOf(participants),
                Collections.unmodifiableMap(lineMap),
                Collections.unmodifiableMap(chargeMap));
        }

        private static void validateWeights(String subjectId, List<ShareWeight> shares, Set<String> participantIds) {
            Set<String> seen = new HashSet<>();
            for (ShareWeight share : shares) {
                requireParticipant(subjectId, share.getParticipantId(), participantIds);
                if (!seen.add(share.getParticipantId())) {
                    throw new ValidationException(Violation.DUPLICATE_ID, subjectId, String.format(Locale.ROOT,
                        "Participant %s is listed twice for %s", share.getParticipantId(), subjectId));
                }
                if (share.getWeight() == null || share.getWeight().signum() <= 0) {
                    throw new ValidationException(Violation.NON_POSITIVE_WEIGHT, subjectId, String.format(Locale.ROOT,
                        "Weight for %s on %s must be positive", share.getParticipantId(), subjectId));
                }
            }
        }

        private static void requireParticipant(String subjectId, String participantId, Set<String> participantIds) {
            if (!participantIds.contains(participantId)) {
                throw new ValidationException(Violation.UNKNOWN_PARTICIPANT, participantId, String.format(Locale.ROOT,
                    "Unknown participant %s referenced by %s", participantId, subjectId));
            }
        }
    }
}
