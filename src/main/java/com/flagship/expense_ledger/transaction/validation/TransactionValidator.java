package com.flagship.expense_ledger.transaction.validation;

import com.flagship.expense_ledger.ledger.Amounts;
import com.flagship.expense_ledger.transaction.Payer;
import com.flagship.expense_ledger.transaction.SettlementTag;
import com.flagship.expense_ledger.transaction.SplitDetails;
import com.flagship.expense_ledger.transaction.SplitMethod;
import com.flagship.expense_ledger.transaction.SplitParticipant;
import com.flagship.expense_ledger.transaction.TransactionDraft;
import com.flagship.expense_ledger.transaction.TransactionType;
import com.flagship.expense_ledger.transaction.exception.TransactionValidationException;
import com.flagship.expense_ledger.transaction.exception.TransactionValidationException.Violation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Checks a draft against the ledger invariants before anything is written.
 *
 * Every rule is evaluated and all violations are reported together. Values are
 * never coerced: a payer total that is off by more than 0.01 is rejected, not adjusted.
 */
@Component
public class TransactionValidator {

    private static final String TOO_PRECISE = "must have at most two decimal places";

    /**
     * @throws TransactionValidationException if the draft breaks any invariant
     */
    public void validate(UUID creator, TransactionDraft draft) {
        List<Violation> violations = collectViolations(creator, draft);
        if (!violations.isEmpty()) {
            throw new TransactionValidationException(violations);
        }
    }

    public List<Violation> collectViolations(UUID creator, TransactionDraft draft) {
        List<Violation> violations = new ArrayList<>();

        checkRequiredFields(draft, violations);
        BigDecimal amount = positiveAmount(draft.getAmount());
        checkPayers(draft.getPayers(), amount, violations);

        boolean tagged = SettlementTag.isTagged(draft.getDescription());
        if (tagged) {
            checkSettlement(creator, draft, amount, violations);
        } else if (draft.getType() == TransactionType.SHARED) {
            checkSharedSplit(draft.getSplitDetails(), amount, violations);
        } else if (draft.getType() != null && draft.getSplitDetails() != null) {
            violations.add(new Violation("split_details",
                "only shared transactions and settlements may carry split details"));
        }
        return violations;
    }

    private void checkRequiredFields(TransactionDraft draft, List<Violation> violations) {
        if (draft.getAmount() == null) {
            violations.add(new Violation("amount", "is required"));
        } else if (draft.getAmount().signum() <= 0) {
            violations.add(new Violation("amount", "must be greater than 0"));
        } else if (!isCents(draft.getAmount())) {
            violations.add(new Violation("amount", TOO_PRECISE));
        }
        if (draft.getType() == null) {
            violations.add(new Violation("type", "is required"));
        }
        if (draft.getPaymentMode() == null) {
            violations.add(new Violation("payment_mode", "is required"));
        }
        if (draft.getDate() == null) {
            violations.add(new Violation("date", "is required"));
        }
    }

    private void checkPayers(List<Payer> payers, BigDecimal amount, List<Violation> violations) {
        if (payers.isEmpty()) {
            violations.add(new Violation("payers", "at least one payer is required"));
            return;
        }
        boolean complete = true;
        for (int i = 0; i < payers.size(); i++) {
            Payer payer = payers.get(i);
            if (payer == null || payer.userId() == null) {
                violations.add(new Violation("payers[" + i + "].user_id", "is required"));
                complete = false;
                continue;
            }
            if (payer.amountPaid() == null || payer.amountPaid().signum() < 0) {
                violations.add(new Violation("payers[" + i + "].amount_paid", "must be 0 or more"));
                complete = false;
            } else if (!isCents(payer.amountPaid())) {
                violations.add(new Violation("payers[" + i + "].amount_paid", TOO_PRECISE));
                complete = false;
            }
        }
        if (complete && amount != null) {
            BigDecimal paid = Amounts.sum(payers, Payer::amountPaid);
            if (!Amounts.matches(paid, amount)) {
                violations.add(new Violation("payers",
                    String.format("amounts paid sum to %s but the transaction amount is %s", paid, amount)));
            }
        }
    }

    private void checkSharedSplit(SplitDetails split, BigDecimal amount, List<Violation> violations) {
        if (split == null) {
            violations.add(new Violation("split_details", "is required for shared transactions"));
            return;
        }
        if (split.method() == null) {
            violations.add(new Violation("split_details.method", "is required"));
        } else if (split.method() == SplitMethod.SETTLEMENT) {
            violations.add(new Violation("split_details.method",
                "settlement splits require a SETTLEMENT description tag and a personal or revenue type"));
        }
        List<SplitParticipant> participants = split.participants();
        if (participants.isEmpty()) {
            violations.add(new Violation("split_details.participants", "at least one participant is required"));
            return;
        }

        boolean complete = checkParticipants(participants, violations);
        if (complete && amount != null) {
            BigDecimal shares = Amounts.sum(participants, SplitParticipant::shareAmount);
            if (!Amounts.matches(shares, amount)) {
                violations.add(new Violation("split_details.participants",
                    String.format("shares sum to %s but the transaction amount is %s", shares, amount)));
            }
        }
        if (complete && split.method() == SplitMethod.PERCENTAGES) {
            checkPercentages(participants, violations);
        }
    }

    private boolean checkParticipants(List<SplitParticipant> participants, List<Violation> violations) {
        boolean complete = true;
        for (int i = 0; i < participants.size(); i++) {
            SplitParticipant participant = participants.get(i);
            String field = "split_details.participants[" + i + "]";
            if (participant == null || participant.userId() == null) {
                violations.add(new Violation(field + ".user_id", "is required"));
                complete = false;
                continue;
            }
            if (participant.shareAmount() == null || participant.shareAmount().signum() < 0) {
                violations.add(new Violation(field + ".share_amount", "must be 0 or more"));
                complete = false;
            } else if (!isCents(participant.shareAmount())) {
                violations.add(new Violation(field + ".share_amount", TOO_PRECISE));
                complete = false;
            }
        }
        return complete;
    }

    private static boolean isCents(BigDecimal value) {
        return value.stripTrailingZeros().scale() <= Amounts.SCALE;
    }

    private void checkPercentages(List<SplitParticipant> participants, List<Violation> violations) {
        if (participants.stream().anyMatch(p -> p.sharePercentage() == null)) {
            violations.add(new Violation("split_details.participants",
                "every participant needs a share_percentage for percentage splits"));
            return;
        }
        BigDecimal total = Amounts.sum(participants, SplitParticipant::sharePercentage);
        if (total.subtract(Amounts.FULL_PERCENTAGE).abs().compareTo(Amounts.PERCENTAGE_TOLERANCE) > 0) {
            violations.add(new Violation("split_details.participants",
                "percentages sum to " + total + " instead of 100"));
        }
    }

    private void checkSettlement(UUID creator, TransactionDraft draft, BigDecimal amount,
                                 List<Violation> violations) {
        Optional<SettlementTag> tag = SettlementTag.parse(draft.getDescription());
        if (tag.isEmpty()) {
            violations.add(new Violation("description",
                "settlement tag must read 'SETTLEMENT: Paid <email>' or 'SETTLEMENT: Received from <email>'"));
        } else if (draft.getType() != null && draft.getType() != tag.get().direction().expectedType()) {
            violations.add(new Violation("type", String.format("a '%s' settlement must be of type %s",
                tag.get().direction(), tag.get().direction().expectedType().value())));
        }

        SplitDetails split = draft.getSplitDetails();
        if (split == null) {
            violations.add(new Violation("split_details", "a settlement must name its counterparty"));
            return;
        }
        if (split.method() != SplitMethod.SETTLEMENT) {
            violations.add(new Violation("split_details.method", "must be 'settlement' for settlements"));
        }
        if (split.participants().size() != 1) {
            violations.add(new Violation("split_details.participants",
                "a settlement has exactly one participant, found " + split.participants().size()));
            return;
        }
        SplitParticipant counterparty = split.participants().get(0);
        if (counterparty == null || counterparty.userId() == null) {
            violations.add(new Violation("split_details.participants[0].user_id", "is required"));
            return;
        }
        if (counterparty.userId().equals(creator)) {
            violations.add(new Violation("split_details.participants[0].user_id",
                "cannot settle with yourself"));
        }
        if (amount != null && (counterparty.shareAmount() == null
                || !Amounts.matches(counterparty.shareAmount(), amount))) {
            violations.add(new Violation("split_details.participants[0].share_amount",
                "must equal the settlement amount " + amount));
        }
    }

    private BigDecimal positiveAmount(BigDecimal amount) {
        return amount != null && amount.signum() > 0 ? amount : null;
    }
}
