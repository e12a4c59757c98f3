package com.flagship.expense_ledger.transaction;

import com.flagship.expense_ledger.identity.UserDirectory;
import com.flagship.expense_ledger.identity.UserProfile;
import com.flagship.expense_ledger.ledger.DebtEdge;
import com.flagship.expense_ledger.ledger.LedgerStore;
import com.flagship.expense_ledger.transaction.exception.TransactionNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of transactions: listings for a user and the detail view of one transaction.
 */
@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    private final LedgerStore ledgerStore;
    private final UserDirectory userDirectory;

    @Transactional(readOnly = true)
    public List<Transaction> list(UUID userId, TransactionFilter filter) {
        return ledgerStore.queryTransactions(userId, filter);
    }

    /**
     * The transaction with the profiles of everyone involved and its current debt edges.
     * Deleted transactions are returned too, with no edges.
     */
    @Transactional(readOnly = true)
    public TransactionDetails get(UUID transactionId) {
        Transaction transaction = ledgerStore.findTransaction(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        Map<UUID, UserProfile> profiles = userDirectory.findByIds(transaction.involvedUserIds());
        List<DebtEdge> edges = ledgerStore.findEdgesForTransaction(transactionId);
        return new TransactionDetails(transaction, profiles, edges);
    }

    public record TransactionDetails(Transaction transaction, Map<UUID, UserProfile> profiles,
                                     List<DebtEdge> edges) {
    }
}
