package com.flagship.expense_ledger.transaction.validation;

import com.flagship.expense_ledger.transaction.SplitDetails;
import com.flagship.expense_ledger.transaction.SplitMethod;
import com.flagship.expense_ledger.transaction.TransactionDraft;
import com.flagship.expense_ledger.transaction.TransactionType;
import com.flagship.expense_ledger.transaction.exception.TransactionValidationException;
import com.flagship.expense_ledger.transaction.exception.TransactionValidationException.Violation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.flagship.expense_ledger.support.LedgerFixtures.money;
import static com.flagship.expense_ledger.support.LedgerFixtures.paidSettlementDraft;
import static com.flagship.expense_ledger.support.LedgerFixtures.payer;
import static com.flagship.expense_ledger.support.LedgerFixtures.personalDraft;
import static com.flagship.expense_ledger.support.LedgerFixtures.NOW;
import static com.flagship.expense_ledger.support.LedgerFixtures.share;
import static com.flagship.expense_ledger.support.LedgerFixtures.sharedDraft;
import static org.junit.jupiter.api.Assertions.*;

class TransactionValidatorTest {

    private static final UUID ALICE = UUID.randomUUID();
    private static final UUID BOB = UUID.randomUUID();

    private final TransactionValidator validator = new TransactionValidator();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private List<String> violatedFields(TransactionDraft draft) {
        return validator.collectViolations(ALICE, draft).stream().map(Violation::field).toList();
    }

    private static TransactionDraft validShared() {
        return sharedDraft("100.00",
            List.of(payer(ALICE, "100.00")),
            List.of(share(ALICE, "50.00"), share(BOB, "50.00")));
    }

    @Test
    @DisplayName("A balanced shared transaction passes")
    void validSharedPasses() {
        assertDoesNotThrow(() -> validator.validate(ALICE, validShared()));
    }

    @Nested
    @DisplayName("Sums")
    class Sums {

        @Test
        @DisplayName("Shares summing to 95 of 100 are rejected before any edge is computed")
        void sharesShortOfAmount() {
            printTestHeader("Share sum mismatch");

            TransactionDraft draft = sharedDraft("100.00",
                List.of(payer(ALICE, "100.00")),
                List.of(share(ALICE, "50.00"), share(BOB, "45.00")));

            TransactionValidationException e = assertThrows(TransactionValidationException.class,
                () -> validator.validate(ALICE, draft));
            System.out.println("Details: " + e.asDetails());

            assertTrue(e.asDetails().containsKey("split_details.participants"));
            printSuccess("Rejected with a participants violation");
        }

        @Test
        @DisplayName("Payers off by more than a cent are rejected")
        void payersMismatch() {
            TransactionDraft draft = sharedDraft("100.00",
                List.of(payer(ALICE, "60.00"), payer(BOB, "39.98")),
                List.of(share(ALICE, "50.00"), share(BOB, "50.00")));

            assertEquals(List.of("payers"), violatedFields(draft));
        }

        @Test
        @DisplayName("A difference of exactly one cent is tolerated")
        void oneCentTolerated() {
            TransactionDraft draft = sharedDraft("100.00",
                List.of(payer(ALICE, "99.99")),
                List.of(share(ALICE, "50.00"), share(BOB, "50.01")));

            assertTrue(violatedFields(draft).isEmpty());
        }

        @Test
        @DisplayName("Shares finer than a cent are rejected even when they sum to the amount")
        void subCentShares() {
            printTestHeader("Sub-cent shares");
            UUID carol = UUID.randomUUID();

            TransactionDraft draft = sharedDraft("100.00",
                List.of(payer(ALICE, "100.00")),
                List.of(share(ALICE, "33.335"), share(BOB, "33.335"), share(carol, "33.33")));

            assertEquals(List.of("split_details.participants[0].share_amount",
                "split_details.participants[1].share_amount"), violatedFields(draft));
            printSuccess("Each sub-cent share reported by position");
        }

        @Test
        @DisplayName("Amounts paid finer than a cent are rejected")
        void subCentPayers() {
            TransactionDraft draft = sharedDraft("100.00",
                List.of(payer(ALICE, "50.005"), payer(BOB, "49.995")),
                List.of(share(ALICE, "50.00"), share(BOB, "50.00")));

            assertEquals(List.of("payers[0].amount_paid", "payers[1].amount_paid"), violatedFields(draft));
        }

        @Test
        @DisplayName("Trailing zeros beyond two decimals are not extra precision")
        void trailingZerosAccepted() {
            TransactionDraft draft = sharedDraft("100.00",
                List.of(payer(ALICE, "100.000")),
                List.of(share(ALICE, "50.0000"), share(BOB, "50.00")));

            assertTrue(violatedFields(draft).isEmpty());
        }
    }

    @Nested
    @DisplayName("Required parts")
    class RequiredParts {

        @Test
        @DisplayName("Empty payers are rejected")
        void emptyPayers() {
            TransactionDraft draft = validShared().toBuilder().payers(List.of()).build();

            assertEquals(List.of("payers"), violatedFields(draft));
        }

        @Test
        @DisplayName("A shared transaction without participants is rejected")
        void emptyParticipants() {
            TransactionDraft draft = validShared()
                .withSplitDetails(new SplitDetails(SplitMethod.EQUALLY, List.of()));

            assertEquals(List.of("split_details.participants"), violatedFields(draft));
        }

        @Test
        @DisplayName("A shared transaction without split details is rejected")
        void missingSplit() {
            TransactionDraft draft = validShared().withSplitDetails(null);

            assertEquals(List.of("split_details"), violatedFields(draft));
        }

        @Test
        @DisplayName("Every missing field is reported at once")
        void allViolationsReported() {
            printTestHeader("All violations reported together");

            TransactionDraft draft = TransactionDraft.builder()
                .amount(money("-5"))
                .payers(List.of())
                .build();

            TransactionValidationException e = assertThrows(TransactionValidationException.class,
                () -> validator.validate(ALICE, draft));
            Map<String, String> details = e.asDetails();
            System.out.println("Details: " + details);

            assertTrue(details.keySet().containsAll(List.of("amount", "type", "payment_mode", "date", "payers")));
            printSuccess(details.size() + " violations in one response");
        }

        @Test
        @DisplayName("Amounts with more than two decimals are rejected")
        void tooManyDecimals() {
            TransactionDraft draft = personalDraft(ALICE, "10.00", NOW).toBuilder()
                .amount(money("10.005"))
                .payers(List.of(payer(ALICE, "10.005")))
                .build();

            assertTrue(violatedFields(draft).contains("amount"));
        }

        @Test
        @DisplayName("Personal transactions may not carry a split")
        void personalWithSplit() {
            TransactionDraft draft = personalDraft(ALICE, "10.00", NOW)
                .withSplitDetails(new SplitDetails(SplitMethod.EQUALLY, List.of(share(ALICE, "10.00"))));

            assertEquals(List.of("split_details"), violatedFields(draft));
        }
    }

    @Nested
    @DisplayName("Percentage splits")
    class Percentages {

        @Test
        @DisplayName("Percentages within 0.1 of 100 pass")
        void withinTolerance() {
            TransactionDraft draft = validShared().withSplitDetails(new SplitDetails(SplitMethod.PERCENTAGES,
                List.of(share(ALICE, "66.67", "66.67"), share(BOB, "33.33", "33.33"))));

            assertTrue(violatedFields(draft).isEmpty());
        }

        @Test
        @DisplayName("Percentages that do not reach 100 are rejected")
        void notHundred() {
            TransactionDraft draft = validShared().withSplitDetails(new SplitDetails(SplitMethod.PERCENTAGES,
                List.of(share(ALICE, "50.00", "50"), share(BOB, "50.00", "45"))));

            assertEquals(List.of("split_details.participants"), violatedFields(draft));
        }
    }

    @Nested
    @DisplayName("Settlements")
    class Settlements {

        @Test
        @DisplayName("A well-formed settlement passes")
        void validSettlement() {
            assertTrue(violatedFields(paidSettlementDraft(ALICE, BOB, "bob@example.com", "25.00")).isEmpty());
        }

        @Test
        @DisplayName("A 'Paid' settlement recorded as revenue is rejected")
        void wrongType() {
            TransactionDraft draft = paidSettlementDraft(ALICE, BOB, "bob@example.com", "25.00").toBuilder()
                .type(TransactionType.REVENUE)
                .build();

            assertEquals(List.of("type"), violatedFields(draft));
        }

        @Test
        @DisplayName("Settling with yourself is rejected")
        void selfSettlement() {
            TransactionDraft draft = paidSettlementDraft(ALICE, ALICE, "alice@example.com", "25.00");

            assertEquals(List.of("split_details.participants[0].user_id"), violatedFields(draft));
        }

        @Test
        @DisplayName("A malformed tag is rejected")
        void malformedTag() {
            TransactionDraft draft = paidSettlementDraft(ALICE, BOB, "bob@example.com", "25.00").toBuilder()
                .description("SETTLEMENT: gave bob some money")
                .build();

            assertEquals(List.of("description"), violatedFields(draft));
        }

        @Test
        @DisplayName("A settlement share different from the amount is rejected")
        void shareMismatch() {
            TransactionDraft draft = paidSettlementDraft(ALICE, BOB, "bob@example.com", "25.00")
                .withSplitDetails(SplitDetails.settlement(BOB, money("20.00")));

            assertEquals(List.of("split_details.participants[0].share_amount"), violatedFields(draft));
        }
    }
}
