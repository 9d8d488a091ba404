package com.flagship.bill_settlement.receipt;

import com.flagship.bill_settlement.exception.ValidationException;
import com.flagship.bill_settlement.exception.Violation;
import com.flagship.bill_settlement.money.CurrencyCode;
import com.flagship.bill_settlement.money.Money;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Validated representation of a receipt.
 *
 * Construction goes through {@link #create} which checks every invariant eagerly:
 * 1. Ids are present and unique across lines and charges
 * 2. Every amount is in the receipt currency
 * 3. Quantities are positive, unit prices are not negative
 * 4. Line totals match unit price times quantity
 * 5. Charge signs match their kind, percentage charges re-derive from the subtotal
 * 6. The grand total equals subtotal plus charges
 *
 * Any violation fails with a ValidationException naming the offending id,
 * including amounts whose sums overflow the minor-unit range.
 * Nothing is repaired.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Receipt {
    String id;
    CurrencyCode currency;
    List<ReceiptLine> lines;
    List<ChargeLine> charges;
    Money grandTotal;

    public static Receipt create(String id, CurrencyCode currency, List<ReceiptLine> lines,
                                 List<ChargeLine> charges, Money grandTotal) {
        return create(id, currency, lines, charges, grandTotal, IngestionTolerance.standard());
    }

    public static Receipt create(String id, CurrencyCode currency, List<ReceiptLine> lines,
                                 List<ChargeLine> charges, Money grandTotal, IngestionTolerance tolerance) {
        if (id == null || id.isBlank()) {
            throw new ValidationException(Violation.MISSING_FIELD, null, "Receipt id is required");
        }
        if (currency == null) {
            throw new ValidationException(Violation.MISSING_FIELD, id, "Receipt currency is required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException(Violation.EMPTY_RECEIPT, id, "Receipt must have at least one item line");
        }
        if (grandTotal == null) {
            throw new ValidationException(Violation.MISSING_FIELD, id, "Grand total is required");
        }
        requireCurrency(id, grandTotal, currency);
        List<ChargeLine> chargeList = charges == null ? List.of() : List.copyOf(charges);

        Set<String> ids = new HashSet<>();
        Money subtotal = Money.zero(currency);
        for (ReceiptLine line : lines) {
            validateLine(line, currency, tolerance, ids);
            subtotal = addWithinRange(subtotal, line.getLineTotal(), line.getId());
        }

        Money total = subtotal;
        for (ChargeLine charge : chargeList) {
            validateCharge(charge, currency, subtotal, tolerance, ids);
            total = addWithinRange(total, charge.getValue(), charge.getId());
        }

        long difference = differenceWithinRange(grandTotal, total, id);
        if (Math.abs(difference) > tolerance.getGrandTotalMinorUnits()) {
            throw new ValidationException(Violation.GRAND_TOTAL_MISMATCH, id, String.format(Locale.ROOT,
                "Declared grand total %s does not match subtotal plus charges %s", grandTotal, total));
        }

        return new Receipt(id, currency, List.copyOf(lines), chargeList, grandTotal);
    }

    private static void validateLine(ReceiptLine line, CurrencyCode currency,
                                     IngestionTolerance tolerance, Set<String> ids) {
        if (line == null) {
            throw new ValidationException(Violation.MISSING_FIELD, null, "Receipt line must not be null");
        }
        String lineId = requireId(line.getId(), ids, "Receipt line");
        if (line.getQuantity() == null || line.getUnitPrice() == null || line.getLineTotal() == null) {
            throw new ValidationException(Violation.MISSING_FIELD, lineId,
                "Quantity, unit price and line total are required");
        }
        if (line.getQuantity().signum() <= 0) {
            throw new ValidationException(Violation.NON_POSITIVE_QUANTITY, lineId,
                "Quantity must be positive: " + line.getQuantity().toPlainString());
        }
        requireCurrency(lineId, line.getUnitPrice(), currency);
        requireCurrency(lineId, line.getLineTotal(), currency);
        if (line.getUnitPrice().isNegative()) {
            throw new ValidationException(Violation.NEGATIVE_UNIT_PRICE, lineId,
                "Unit price must not be negative: " + line.getUnitPrice());
        }
        Money expected;
        try {
            expected = line.expectedTotal();
        } catch (ArithmeticException e) {
            throw outOfRange(lineId);
        }
        long difference = differenceWithinRange(line.getLineTotal(), expected, lineId);
        if (Math.abs(difference) > tolerance.getLineMinorUnits()) {
            throw new ValidationException(Violation.LINE_TOTAL_MISMATCH, lineId, String.format(Locale.ROOT,
                "Line total %s does not match %s x %s = %s",
                line.getLineTotal(), line.getUnitPrice(), line.getQuantity().toPlainString(), expected));
        }
    }

    private static void validateCharge(ChargeLine charge, CurrencyCode currency, Money subtotal,
                                       IngestionTolerance tolerance, Set<String> ids) {
        if (charge == null) {
            throw new ValidationException(Violation.MISSING_FIELD, null, "Charge line must not be null");
        }
        String chargeId = requireId(charge.getId(), ids, "Charge line");
        if (charge.getKind() == null || charge.getValue() == null || charge.getBasis() == null) {
            throw new ValidationException(Violation.MISSING_FIELD, chargeId, "Kind, value and basis are required");
        }
        requireCurrency(chargeId, charge.getValue(), currency);

        boolean signMismatch = charge.getKind().isDiscount()
            ? charge.getValue().signum() > 0
            : charge.getValue().signum() < 0;
        if (signMismatch) {
            throw new ValidationException(Violation.CHARGE_SIGN_MISMATCH, chargeId, String.format(Locale.ROOT,
                "%s value %s has the wrong sign", charge.getKind(), charge.getValue()));
        }

        if (charge.getBasis() == ChargeBasis.PERCENTAGE_OF_SUBTOTAL) {
            BigDecimal rate = charge.getRate();
            if (rate == null || rate.signum() < 0) {
                throw new ValidationException(Violation.CHARGE_RATE_MISSING, chargeId,
                    "Percentage charge requires a non-negative rate");
            }
            Money derived;
            Money magnitude;
            try {
                derived = subtotal.percentage(rate);
                magnitude = charge.getValue().abs();
            } catch (ArithmeticException e) {
                throw outOfRange(chargeId);
            }
            long difference = differenceWithinRange(magnitude, derived, chargeId);
            if (Math.abs(difference) > tolerance.getChargeMinorUnits()) {
                throw new ValidationException(Violation.CHARGE_DERIVATION_MISMATCH, chargeId, String.format(Locale.ROOT,
                    "Charge %s is not %s%% of subtotal %s (expected %s)",
                    charge.getValue(), rate.toPlainString(), subtotal, derived));
            }
        }
    }

    private static String requireId(String id, Set<String> ids, String label) {
        if (id == null || id.isBlank()) {
            throw new ValidationException(Violation.MISSING_FIELD, null, label + " id is required");
        }
        if (!ids.add(id)) {
            throw new ValidationException(Violation.DUPLICATE_ID, id, "Duplicate receipt id: " + id);
        }
        return id;
    }

    private static Money addWithinRange(Money sum, Money amount, String subjectId) {
        try {
            return sum.add(amount);
        } catch (ArithmeticException e) {
            throw outOfRange(subjectId);
        }
    }

    private static long differenceWithinRange(Money amount, Money other, String subjectId) {
        long difference;
        try {
            difference = amount.subtract(other).getMinorUnits();
        } catch (ArithmeticException e) {
            throw outOfRange(subjectId);
        }
        // Math.abs cannot negate Long.MIN_VALUE
        if (difference == Long.MIN_VALUE) {
            throw outOfRange(subjectId);
        }
        return difference;
    }

    private static ValidationException outOfRange(String subjectId) {
        return new ValidationException(Violation.AMOUNT_OUT_OF_RANGE, subjectId,
            "Amounts for " + subjectId + " exceed the representable range");
    }

    private static void requireCurrency(String subjectId, Money amount, CurrencyCode currency) {
        if (amount.getCurrency() != currency) {
            throw new ValidationException(Violation.CURRENCY_MISMATCH, subjectId, String.format(Locale.ROOT,
                "Amount %s is not in receipt currency %s", amount, currency));
        }
    }

    /**
     * Sum of all item line totals.
     */
    public Money subtotal() {
        return lines.stream()
            .map(ReceiptLine::getLineTotal)
            .reduce(Money.zero(currency), Money::add);
    }

    public boolean hasDiscount() {
        return charges.stream().anyMatch(charge -> charge.getKind().isDiscount());
    }

    public Optional<ReceiptLine> findLine(String lineId) {
        return lines.stream().filter(line -> line.getId().equals(lineId)).findFirst();
    }

    public Optional<ChargeLine> findCharge(String chargeId) {
        return charges.stream().filter(charge -> charge.getId().equals(chargeId)).findFirst();
    }
}
