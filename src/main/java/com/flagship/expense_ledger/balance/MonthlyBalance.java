package com.flagship.expense_ledger.balance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.expense_ledger.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Cash position of one user over one calendar month.
 *
 * closing = opening + revenue - spent, and each month opens with the previous month's closing.
 */
@Value
public class MonthlyBalance {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("month_year")
    YearMonth month;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    public static MonthlyBalance of(UUID userId, YearMonth month, BigDecimal opening, BigDecimal closing) {
        return new MonthlyBalance(userId, month, Amounts.round(opening), Amounts.round(closing));
    }

    /**
     * A month without activity: it opens and closes at the previous closing balance.
     */
    public static MonthlyBalance carriedOver(UUID userId, YearMonth month, BigDecimal previousClosing) {
        return of(userId, month, previousClosing, previousClosing);
    }
}
