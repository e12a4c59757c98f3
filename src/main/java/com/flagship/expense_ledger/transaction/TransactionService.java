package com.flagship.expense_ledger.transaction;

import com.flagship.expense_ledger.identity.UserDirectory;
import com.flagship.expense_ledger.identity.UserProfile;
import com.flagship.expense_ledger.ledger.LedgerStore;
import com.flagship.expense_ledger.observability.CorrelationContext;
import com.flagship.expense_ledger.observability.LedgerMetrics;
import com.flagship.expense_ledger.transaction.exception.TransactionNotFoundException;
import com.flagship.expense_ledger.transaction.exception.TransactionValidationException;
import com.flagship.expense_ledger.transaction.exception.UnresolvedCounterpartyException;
import com.flagship.expense_ledger.transaction.validation.TransactionValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for creating, editing and deleting transactions.
 *
 * Each write runs in three steps:
 * 1. resolve the settlement counterparty named in the description, if any
 * 2. validate the draft, collecting every violation, before any database transaction starts
 * 3. hand the draft to {@link TransactionPersistenceService}, which writes the row, its
 *    edges, the outbox events and the monthly balances atomically
 *
 * Creates are idempotent per {@code Idempotency-Key}: a repeated key returns the
 * transaction created the first time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final TransactionValidator validator;
    private final TransactionPersistenceService persistenceService;
    private final IdempotencyService idempotencyService;
    private final LedgerStore ledgerStore;
    private final UserDirectory userDirectory;
    private final LedgerMetrics metrics;

    /**
     * @param idempotencyKey may be null, in which case the create is not deduplicated
     */
    public CreateResult create(UUID actor, TransactionDraft draft, String idempotencyKey) {
        long start = System.nanoTime();
        CorrelationContext.putUserId(actor);
        try {
            if (idempotencyKey != null) {
                Optional<Transaction> existing = idempotencyService.findExisting(idempotencyKey);
                if (existing.isPresent()) {
                    metrics.recordIdempotencyHit();
                    log.info("Idempotency key {} already used, returning transaction {}",
                            idempotencyKey, existing.get().getId());
                    return new CreateResult(existing.get(), false);
                }
                metrics.recordIdempotencyMiss();
            }

            TransactionDraft resolved = resolveSettlement(draft);
            validate(actor, resolved);

            Transaction created;
            try {
                created = persistenceService.create(actor, resolved, idempotencyKey);
            } catch (DuplicateKeyException e) {
                // Lost a race with a concurrent request carrying the same key
                Transaction winner = ledgerStore.findTransactionByIdempotencyKey(idempotencyKey)
                    .orElseThrow(() -> e);
                log.info("Concurrent create with idempotency key {} resolved to transaction {}",
                        idempotencyKey, winner.getId());
                return new CreateResult(winner, false);
            }

            CorrelationContext.putTransactionId(created.getId());
            if (idempotencyKey != null) {
                idempotencyService.remember(idempotencyKey, created.getId());
            }
            metrics.recordWrite("create", "success", elapsedSince(start));
            log.info("Created {} transaction {} for amount {}", created.getType().value(),
                    created.getId(), created.getAmount());
            return new CreateResult(created, true);

        } catch (RuntimeException e) {
            metrics.recordWrite("create", outcomeOf(e), elapsedSince(start));
            throw e;
        }
    }

    public Transaction update(UUID actor, UUID transactionId, TransactionDraft draft) {
        long start = System.nanoTime();
        CorrelationContext.putUserId(actor);
        CorrelationContext.putTransactionId(transactionId);
        try {
            Transaction current = ledgerStore.findTransaction(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));

            TransactionDraft resolved = resolveSettlement(draft);
            validate(current.getUserId(), resolved);

            Transaction updated = persistenceService.update(actor, transactionId, resolved);
            metrics.recordWrite("update", "success", elapsedSince(start));
            log.info("Updated transaction {}", transactionId);
            return updated;

        } catch (RuntimeException e) {
            metrics.recordWrite("update", outcomeOf(e), elapsedSince(start));
            throw e;
        }
    }

    public Transaction delete(UUID actor, UUID transactionId) {
        long start = System.nanoTime();
        CorrelationContext.putUserId(actor);
        CorrelationContext.putTransactionId(transactionId);
        try {
            Transaction deleted = persistenceService.delete(actor, transactionId);
            metrics.recordWrite("delete", "success", elapsedSince(start));
            log.info("Deleted transaction {}", transactionId);
            return deleted;
        } catch (RuntimeException e) {
            metrics.recordWrite("delete", outcomeOf(e), elapsedSince(start));
            throw e;
        }
    }

    /**
     * Fills in the split of a settlement from the counterparty email in its description.
     * A split supplied by the caller must name that same counterparty.
     *
     * @throws UnresolvedCounterpartyException if the email belongs to no user
     */
    TransactionDraft resolveSettlement(TransactionDraft draft) {
        Optional<SettlementTag> tag = SettlementTag.parse(draft.getDescription());
        if (tag.isEmpty() || draft.getAmount() == null) {
            return draft;
        }
        UserProfile counterparty = userDirectory.findByEmail(tag.get().counterpartyEmail())
            .orElseThrow(() -> new UnresolvedCounterpartyException(tag.get().counterpartyEmail()));

        SplitDetails split = draft.getSplitDetails();
        if (split == null || split.participants().isEmpty()) {
            return draft.withSplitDetails(SplitDetails.settlement(counterparty.id(), draft.getAmount()));
        }
        boolean namesCounterparty = split.participants().size() == 1
            && split.participants().get(0) != null
            && counterparty.id().equals(split.participants().get(0).userId());
        if (!namesCounterparty) {
            throw TransactionValidationException.single("split_details.participants",
                "settlement participant must be the user with email " + tag.get().counterpartyEmail());
        }
        return draft;
    }

    private void validate(UUID creator, TransactionDraft draft) {
        try {
            validator.validate(creator, draft);
        } catch (TransactionValidationException e) {
            metrics.recordValidationRejected();
            log.warn("Rejected transaction draft: {}", e.asDetails());
            throw e;
        }
    }

    private static String outcomeOf(RuntimeException e) {
        return e.getClass().getSimpleName();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Outcome of a create: the transaction, and whether this call created it or an
     * earlier call with the same idempotency key did.
     */
    public record CreateResult(Transaction transaction, boolean created) {
    }
}
