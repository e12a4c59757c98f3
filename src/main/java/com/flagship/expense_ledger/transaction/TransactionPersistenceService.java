package com.flagship.expense_ledger.transaction;

import com.flagship.expense_ledger.balance.MonthlyBalanceService;
import com.flagship.expense_ledger.identity.UserDirectory;
import com.flagship.expense_ledger.ledger.DebtEdge;
import com.flagship.expense_ledger.ledger.DebtNettingService;
import com.flagship.expense_ledger.ledger.LedgerStore;
import com.flagship.expense_ledger.outbox.OutboxService;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent;
import com.flagship.expense_ledger.transaction.event.LedgerChangeEvent.ChangeType;
import com.flagship.expense_ledger.transaction.exception.TransactionAccessDeniedException;
import com.flagship.expense_ledger.transaction.exception.TransactionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * The atomic part of every transaction write.
 *
 * One database transaction covers, in order:
 * 1. the transaction row (with its new activity log entry)
 * 2. the debt edges recomputed from it
 * 3. the change events in the outbox
 * 4. the monthly balances of every user involved before or after the write
 *
 * A failure at any step rolls all of them back. Drafts reaching this class are already
 * validated; permission and tombstone checks happen here, under the row lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionPersistenceService {

    private final LedgerStore ledgerStore;
    private final DebtNettingService nettingService;
    private final MonthlyBalanceService monthlyBalanceService;
    private final OutboxService outboxService;
    private final UserDirectory userDirectory;
    private final Clock clock;

    @Transactional
    public Transaction create(UUID actor, TransactionDraft draft, String idempotencyKey) {
        Instant now = clock.instant();
        Transaction created = Transaction.create(UUID.randomUUID(), actor,
            userDirectory.displayNameOf(actor), draft, now);

        ledgerStore.upsertTransaction(created, idempotencyKey);
        applyDerivedState(created, Set.of(), ChangeType.INSERT, now);
        return created;
    }

    /**
     * @throws TransactionNotFoundException if no such transaction exists
     * @throws IllegalStateException if the transaction was deleted
     * @throws TransactionAccessDeniedException if the actor is not involved in the transaction
     */
    @Transactional
    public Transaction update(UUID actor, UUID transactionId, TransactionDraft draft) {
        Transaction current = lockEditable(actor, transactionId);
        Instant now = clock.instant();
        Transaction revised = current.revise(draft, actor, userDirectory.displayNameOf(actor), now);

        ledgerStore.upsertTransaction(revised, null);
        applyDerivedState(revised, current.involvedUserIds(), ChangeType.UPDATE, now);
        return revised;
    }

    /**
     * Soft-deletes the transaction. Deleting an already deleted transaction changes nothing
     * and returns it as stored.
     */
    @Transactional
    public Transaction delete(UUID actor, UUID transactionId) {
        Transaction current = ledgerStore.findTransactionForUpdate(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        if (!current.isEditableBy(actor)) {
            throw new TransactionAccessDeniedException(actor, transactionId);
        }
        if (current.isDeleted()) {
            log.info("Transaction {} already deleted at {}, nothing to do", transactionId, current.getDeletedAt());
            return current;
        }

        Instant now = clock.instant();
        Transaction deleted = current.markDeleted(actor, userDirectory.displayNameOf(actor), now);
        ledgerStore.upsertTransaction(deleted, null);
        applyDerivedState(deleted, current.involvedUserIds(), ChangeType.DELETE, now);
        return deleted;
    }

    private Transaction lockEditable(UUID actor, UUID transactionId) {
        Transaction current = ledgerStore.findTransactionForUpdate(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        if (!current.isEditableBy(actor)) {
            throw new TransactionAccessDeniedException(actor, transactionId);
        }
        if (current.isDeleted()) {
            throw new IllegalStateException("Transaction " + transactionId + " has been deleted");
        }
        return current;
    }

    private void applyDerivedState(Transaction transaction, Set<UUID> previouslyInvolved,
                                   ChangeType changeType, Instant now) {
        List<DebtEdge> edges = nettingService.recompute(transaction);

        Set<UUID> affected = new LinkedHashSet<>(previouslyInvolved);
        affected.addAll(transaction.involvedUserIds());

        outboxService.saveEvent(LedgerChangeEvent.transactionChanged(transaction.getId(), changeType, affected, now));
        outboxService.saveEvent(LedgerChangeEvent.debtsChanged(transaction.getId(), affected, now));

        monthlyBalanceService.recarryForward(affected);

        log.info("Transaction {} written: change={}, edges={}, affectedUsers={}",
                transaction.getId(), changeType, edges.size(), affected.size());
    }
}
