package com.flagship.expense_ledger.transaction.exception;

import java.util.UUID;

/**
 * The acting user is neither the creator, a payer nor a participant of the transaction.
 */
public class TransactionAccessDeniedException extends RuntimeException {

    public TransactionAccessDeniedException(UUID actor, UUID transactionId) {
        super(String.format("User %s may not modify transaction %s", actor, transactionId));
    }
}
