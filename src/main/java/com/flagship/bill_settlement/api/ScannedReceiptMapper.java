package com.flagship.bill_settlement.api;

import com.flagship.bill_settlement.api.dto.ScannedReceiptRequest;
import com.flagship.bill_settlement.exception.ValidationException;
import com.flagship.bill_settlement.exception.Violation;
import com.flagship.bill_settlement.money.CurrencyCode;
import com.flagship.bill_settlement.money.Money;
import com.flagship.bill_settlement.receipt.ChargeKind;
import com.flagship.bill_settlement.receipt.ChargeLine;
import com.flagship.bill_settlement.receipt.IngestionTolerance;
import com.flagship.bill_settlement.receipt.Receipt;
import com.flagship.bill_settlement.receipt.ReceiptLine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the scanner's receipt shape onto a {@link Receipt}.
 *
 * Items become lines {@code item-1..n} in scan order with the price read as a
 * unit price. Non-zero tax and service charge become flat charges {@code tax}
 * and {@code service-charge}. A printed subtotal, when present, must match
 * the item lines within the line tolerance.
 */
@Component
@RequiredArgsConstructor
public class ScannedReceiptMapper {

    public static final String TAX_CHARGE_ID = "tax";
    public static final String SERVICE_CHARGE_ID = "service-charge";

    private static final String DEFAULT_RECEIPT_ID = "scanned-receipt";

    private static final Map<String, CurrencyCode> SYMBOLS = Map.of(
        "$", CurrencyCode.USD,
        "US$", CurrencyCode.USD,
        "€", CurrencyCode.EUR,
        "£", CurrencyCode.GBP,
        "¥", CurrencyCode.JPY,
        "₹", CurrencyCode.INR,
        "S$", CurrencyCode.SGD,
        "RM", CurrencyCode.MYR
    );

    private final IngestionTolerance ingestionTolerance;

    public Receipt toReceipt(ScannedReceiptRequest scanned) {
        CurrencyCode currency = resolveCurrency(scanned.getCurrency());
        String receiptId = scanned.getId() != null && !scanned.getId().isBlank()
            ? scanned.getId()
            : DEFAULT_RECEIPT_ID;

        List<ReceiptLine> lines = new ArrayList<>();
        Money subtotal = Money.zero(currency);
        int position = 1;
        for (ScannedReceiptRequest.Item item : scanned.getItems()) {
            BigDecimal quantity = item.getQuantity() != null ? item.getQuantity() : BigDecimal.ONE;
            Money unitPrice = Money.of(item.getPrice(), currency);
            ReceiptLine line = ReceiptLine.of("item-" + position++, item.getName(), quantity,
                unitPrice, unitPrice.multiply(quantity));
            lines.add(line);
            subtotal = subtotal.add(line.getLineTotal());
        }

        if (scanned.getSubtotal() != null) {
            Money printed = Money.of(scanned.getSubtotal(), currency);
            if (Math.abs(printed.subtract(subtotal).getMinorUnits()) > ingestionTolerance.getLineMinorUnits()) {
                throw new ValidationException(Violation.SUBTOTAL_MISMATCH, receiptId, String.format(Locale.ROOT,
                    "Printed subtotal %s does not match item total %s", printed, subtotal));
            }
        }

        List<ChargeLine> charges = new ArrayList<>();
        addCharge(charges, TAX_CHARGE_ID, ChargeKind.TAX, scanned.getTax(), currency);
        addCharge(charges, SERVICE_CHARGE_ID, ChargeKind.SERVICE_CHARGE, scanned.getServiceCharge(), currency);

        return Receipt.create(receiptId, currency, lines, charges,
            Money.of(scanned.getTotal(), currency), ingestionTolerance);
    }

    private static void addCharge(List<ChargeLine> charges, String id, ChargeKind kind,
                                  BigDecimal value, CurrencyCode currency) {
        if (value != null && value.signum() != 0) {
            charges.add(ChargeLine.flat(id, kind, Money.of(value, currency)));
        }
    }

    static CurrencyCode resolveCurrency(String currency) {
        if (currency != null) {
            CurrencyCode bySymbol = SYMBOLS.get(currency.trim().toUpperCase(Locale.ROOT));
            if (bySymbol != null) {
                return bySymbol;
            }
        }
        return CurrencyCode.parse(currency);
    }
}
