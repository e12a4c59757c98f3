package com.flagship.expense_ledger.transaction.exception;

/**
 * A settlement names a counterparty email that does not belong to any known user.
 */
public class UnresolvedCounterpartyException extends RuntimeException {

    private final String email;

    public UnresolvedCounterpartyException(String email) {
        super("No user found for settlement counterparty: " + email);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
