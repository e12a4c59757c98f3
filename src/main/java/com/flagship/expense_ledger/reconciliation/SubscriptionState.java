package com.flagship.expense_ledger.reconciliation;

import lombok.Value;

/**
 * Where a {@link ResilientSubscription} stands. {@code attempt} is the retry number while
 * RETRYING and the number of retries spent once FAILED; it is 0 otherwise.
 */
@Value
public class SubscriptionState {

    public enum Status {
        CONNECTING,
        SUBSCRIBED,
        RETRYING,
        FAILED,
        CLOSED
    }

    Status status;
    int attempt;

    public static SubscriptionState connecting() {
        return new SubscriptionState(Status.CONNECTING, 0);
    }

    public static SubscriptionState subscribed() {
        return new SubscriptionState(Status.SUBSCRIBED, 0);
    }

    public static SubscriptionState retrying(int attempt) {
        return new SubscriptionState(Status.RETRYING, attempt);
    }

    public static SubscriptionState failed(int attempts) {
        return new SubscriptionState(Status.FAILED, attempts);
    }

    public static SubscriptionState closed() {
        return new SubscriptionState(Status.CLOSED, 0);
    }

    public boolean isTerminal() {
        return status == Status.FAILED || status == Status.CLOSED;
    }

    @Override
    public String toString() {
        return status == Status.RETRYING ? "RETRYING(" + attempt + ")" : status.name();
    }
}
