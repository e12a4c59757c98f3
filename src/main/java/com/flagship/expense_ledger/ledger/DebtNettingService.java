package com.flagship.expense_ledger.ledger;

import com.flagship.expense_ledger.observability.LedgerMetrics;
import com.flagship.expense_ledger.transaction.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Replaces a transaction's stored debt edges with a fresh netting result.
 *
 * Runs inside the write transaction of the transaction row itself, so readers never see
 * a transaction together with edges computed from a different version of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DebtNettingService {

    private final NettingEngine nettingEngine;
    private final LedgerStore ledgerStore;
    private final LedgerMetrics ledgerMetrics;

    @Transactional(propagation = Propagation.MANDATORY)
    public List<DebtEdge> recompute(Transaction transaction) {
        List<DebtEdge> edges = nettingEngine.recompute(transaction);
        ledgerStore.replaceEdges(transaction.getId(), edges);
        ledgerMetrics.recordEdges(edges.size());

        log.debug("Replaced debt edges of transaction {}: {} edges (deleted={}, settlement={})",
                transaction.getId(), edges.size(), transaction.isDeleted(), transaction.isSettlement());
        return edges;
    }
}
