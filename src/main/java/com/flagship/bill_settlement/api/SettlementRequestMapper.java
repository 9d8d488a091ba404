package com.flagship.bill_settlement.api;

import com.flagship.bill_settlement.allocation.Allocation;
import com.flagship.bill_settlement.allocation.ChargeAllocation;
import com.flagship.bill_settlement.allocation.ChargeAllocationPolicy;
import com.flagship.bill_settlement.allocation.FixedShare;
import com.flagship.bill_settlement.allocation.LineAllocation;
import com.flagship.bill_settlement.allocation.Participant;
import com.flagship.bill_settlement.allocation.ShareWeight;
import com.flagship.bill_settlement.api.dto.AllocationRequest;
import com.flagship.bill_settlement.api.dto.ReceiptRequest;
import com.flagship.bill_settlement.money.CurrencyCode;
import com.flagship.bill_settlement.money.Money;
import com.flagship.bill_settlement.receipt.ChargeBasis;
import com.flagship.bill_settlement.receipt.ChargeLine;
import com.flagship.bill_settlement.receipt.IngestionTolerance;
import com.flagship.bill_settlement.receipt.Receipt;
import com.flagship.bill_settlement.receipt.ReceiptLine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts request DTOs into validated domain objects.
 * All invariant checks happen in the domain factories; this class only
 * translates decimal amounts into Money of the receipt currency.
 */
@Component
@RequiredArgsConstructor
public class SettlementRequestMapper {

    private final IngestionTolerance ingestionTolerance;

    public Receipt toReceipt(ReceiptRequest request) {
        CurrencyCode currency = CurrencyCode.parse(request.getCurrency());

        List<ReceiptLine> lines = new ArrayList<>();
        for (ReceiptRequest.Line line : request.getLines()) {
            Money unitPrice = Money.of(line.getUnitPrice(), currency);
            Money lineTotal = line.getLineTotal() != null
                ? Money.of(line.getLineTotal(), currency)
                : unitPrice.multiply(line.getQuantity());
            String description = line.getDescription() != null ? line.getDescription() : line.getId();
            lines.add(ReceiptLine.of(line.getId(), description, line.getQuantity(), unitPrice, lineTotal));
        }

        List<ChargeLine> charges = new ArrayList<>();
        if (request.getCharges() != null) {
            for (ReceiptRequest.Charge charge : request.getCharges()) {
                ChargeBasis basis = charge.getBasis() != null ? charge.getBasis() : ChargeBasis.FLAT;
                charges.add(new ChargeLine(charge.getId(), charge.getKind(),
                    Money.of(charge.getValue(), currency), basis, charge.getRate()));
            }
        }

        return Receipt.create(request.getId(), currency, lines, charges,
            Money.of(request.getGrandTotal(), currency), ingestionTolerance);
    }

    public Allocation toAllocation(AllocationRequest request, CurrencyCode currency) {
        Allocation.Builder builder = Allocation.builder();
        for (AllocationRequest.Participant participant : request.getParticipants()) {
            String displayName = participant.getDisplayName() != null
                ? participant.getDisplayName()
                : participant.getId();
            builder.participant(Participant.of(participant.getId(), displayName));
        }

        if (request.getLines() != null) {
            for (AllocationRequest.Line line : request.getLines()) {
                List<FixedShare> fixed = line.getFixed() == null ? List.of() : line.getFixed().stream()
                    .map(share -> FixedShare.of(share.getParticipantId(), Money.of(share.getAmount(), currency)))
                    .collect(Collectors.toList());
                builder.line(LineAllocation.of(line.getLineId(), toWeights(line.getShares()), fixed));
            }
        }

        if (request.getSharedLines() != null) {
            request.getSharedLines().forEach(builder::sharedByAll);
        }

        if (request.getCharges() != null) {
            for (AllocationRequest.Charge charge : request.getCharges()) {
                if (charge.getPolicy() == ChargeAllocationPolicy.ASSIGNED_TO_SPECIFIC_PARTICIPANTS) {
                    builder.charge(ChargeAllocation.assigned(charge.getChargeId(), toWeights(charge.getWeights())));
                } else {
                    builder.chargePolicy(charge.getChargeId(), charge.getPolicy());
                }
            }
        }

        return builder.build();
    }

    private static List<ShareWeight> toWeights(List<AllocationRequest.Share> shares) {
        if (shares == null) {
            return List.of();
        }
        return shares.stream()
            .map(share -> ShareWeight.of(share.getParticipantId(),
                share.getWeight() != null ? share.getWeight() : BigDecimal.ONE))
            .collect(Collectors.toList());
    }
}
