package com.flagship.bill_settlement.allocation;

import com.flagship.bill_settlement.exception.ValidationException;
import com.flagship.bill_settlement.exception.Violation;
import com.flagship.bill_settlement.money.CurrencyCode;
import com.flagship.bill_settlement.money.Money;
import com.flagship.bill_settlement.receipt.ChargeKind;
import com.flagship.bill_settlement.receipt.ChargeLine;
import com.flagship.bill_settlement.receipt.Receipt;
import com.flagship.bill_settlement.receipt.ReceiptLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Allocation model tests: standalone checks on build, coverage checks
 * against a receipt.
 */
class AllocationTest {

    private static final CurrencyCode USD = CurrencyCode.USD;

    private Receipt receipt;

    @BeforeEach
    void setUp() {
        receipt = Receipt.create("r-1", USD,
            List.of(
                ReceiptLine.priced("pizza", "Pizza", 1, Money.of("20.00", USD)),
                ReceiptLine.priced("wine", "Wine", 1, Money.of("30.00", USD))),
            List.of(ChargeLine.flat("tax", ChargeKind.TAX, Money.of("5.00", USD))),
            Money.of("55.00", USD));
    }

    private static Allocation.Builder twoPeople() {
        return Allocation.builder()
            .participant("alice", "Alice")
            .participant("bob", "Bob");
    }

    @Test
    @DisplayName("Shared lines expand to every participant with equal weight")
    void testSharedByAll() {
        Allocation allocation = twoPeople()
            .sharedByAll("pizza")
            .assign("wine", "alice")
            .build();

        LineAllocation pizza = allocation.lineAllocation("pizza");
        assertEquals(List.of(ShareWeight.of("alice", BigDecimal.ONE), ShareWeight.of("bob", BigDecimal.ONE)),
            pizza.getShares());
        assertDoesNotThrow(() -> allocation.validateAgainst(receipt));
    }

    @Test
    @DisplayName("Charges default to proportional apportionment")
    void testDefaultChargePolicy() {
        Allocation allocation = twoPeople().sharedByAll("pizza").sharedByAll("wine").build();

        assertEquals(ChargeAllocationPolicy.PROPORTIONAL_TO_ITEM_SHARE,
            allocation.chargeAllocation("tax").getPolicy());
    }

    @Test
    @DisplayName("An empty participant set is rejected")
    void testEmptyParticipants() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> Allocation.builder().assign("pizza", "alice").build());

        assertEquals(Violation.EMPTY_PARTICIPANTS, e.getViolation());
    }

    @Test
    @DisplayName("Duplicate participants are rejected")
    void testDuplicateParticipant() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> twoPeople().participant("alice", "Alice again").build());

        assertEquals(Violation.DUPLICATE_ID, e.getViolation());
        assertEquals("alice", e.getSubjectId());
    }

    @Test
    @DisplayName("Unknown participants are rejected with their id")
    void testUnknownParticipant() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> twoPeople().assign("pizza", "carol").build());

        assertEquals(Violation.UNKNOWN_PARTICIPANT, e.getViolation());
        assertEquals("carol", e.getSubjectId());
    }

    @Test
    @DisplayName("Weights must be positive")
    void testNonPositiveWeight() {
        ValidationException e = assertThrows(ValidationException.class, () -> twoPeople()
            .share("pizza", List.of(ShareWeight.of("alice", 1), ShareWeight.of("bob", 0)))
            .build());

        assertEquals(Violation.NON_POSITIVE_WEIGHT, e.getViolation());
        assertEquals("pizza", e.getSubjectId());
    }

    @Test
    @DisplayName("Lines with no owners are rejected")
    void testEmptyShares() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> twoPeople().share("pizza", List.of()).build());

        assertEquals(Violation.EMPTY_SHARES, e.getViolation());
    }

    @Test
    @DisplayName("A line may be allocated only once")
    void testDuplicateLineAllocation() {
        ValidationException e = assertThrows(ValidationException.class, () -> twoPeople()
            .assign("pizza", "alice")
            .sharedByAll("pizza")
            .build());

        assertEquals(Violation.DUPLICATE_LINE_ALLOCATION, e.getViolation());
        assertEquals("pizza", e.getSubjectId());
    }

    @Test
    @DisplayName("Assigned charges need weights")
    void testAssignedChargeWithoutWeights() {
        ValidationException e = assertThrows(ValidationException.class, () -> twoPeople()
            .assignCharge("tax", List.of())
            .build());

        assertEquals(Violation.MISSING_CHARGE_ASSIGNMENT, e.getViolation());
        assertEquals("tax", e.getSubjectId());
    }

    @Test
    @DisplayName("A receipt line absent from the allocation fails with its id")
    void testUnallocatedLine() {
        Allocation allocation = twoPeople().assign("pizza", "alice", "bob").build();

        ValidationException e = assertThrows(ValidationException.class, () -> allocation.validateAgainst(receipt));

        assertEquals(Violation.UNALLOCATED_LINE, e.getViolation());
        assertEquals("wine", e.getSubjectId());
    }

    @Test
    @DisplayName("Allocations for lines not on the receipt are rejected")
    void testUnknownLine() {
        Allocation allocation = twoPeople()
            .sharedByAll("pizza")
            .sharedByAll("wine")
            .assign("dessert", "bob")
            .build();

        ValidationException e = assertThrows(ValidationException.class, () -> allocation.validateAgainst(receipt));

        assertEquals(Violation.UNKNOWN_LINE, e.getViolation());
        assertEquals("dessert", e.getSubjectId());
    }

    @Test
    @DisplayName("Policies for charges not on the receipt are rejected")
    void testUnknownCharge() {
        Allocation allocation = twoPeople()
            .sharedByAll("pizza")
            .sharedByAll("wine")
            .chargePolicy("tip", ChargeAllocationPolicy.EQUAL_SPLIT_ACROSS_PARTICIPANTS)
            .build();

        ValidationException e = assertThrows(ValidationException.class, () -> allocation.validateAgainst(receipt));

        assertEquals(Violation.UNKNOWN_CHARGE, e.getViolation());
        assertEquals("tip", e.getSubjectId());
    }

    @Test
    @DisplayName("Fixed amounts may not exceed the line total")
    void testFixedSharesExceedLineTotal() {
        Allocation allocation = twoPeople()
            .sharedByAll("pizza")
            .assign("wine", "alice", "bob")
            .fixed("wine", "alice", Money.of("30.01", USD))
            .build();

        ValidationException e = assertThrows(ValidationException.class, () -> allocation.validateAgainst(receipt));

        assertEquals(Violation.FIXED_SHARES_EXCEED_LINE_TOTAL, e.getViolation());
        assertEquals("wine", e.getSubjectId());
    }

    @Test
    @DisplayName("Fixed amounts need a weighted owner list for the rest of the line")
    void testFixedSharesWithoutOwners() {
        ValidationException e = assertThrows(ValidationException.class, () -> twoPeople()
            .sharedByAll("pizza")
            .fixed("wine", "alice", Money.of("5.00", USD))
            .build());

        assertEquals(Violation.EMPTY_SHARES, e.getViolation());
        assertEquals("wine", e.getSubjectId());
    }
}
