package com.flagship.expense_ledger.balance;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * Monthly cash positions of the acting user (X-User-Id header).
 */
@RestController
@RequestMapping("/api/balances/monthly")
@RequiredArgsConstructor
public class MonthlyBalanceController {

    private final MonthlyBalanceService monthlyBalanceService;

    @GetMapping
    public List<MonthlyBalance> monthlyBalances(@RequestHeader("X-User-Id") UUID userId) {
        return monthlyBalanceService.monthlyBalances(userId);
    }

    /**
     * @param month in YYYY-MM form
     */
    @GetMapping("/{month}")
    public ResponseEntity<MonthlyBalance> monthlyBalance(@RequestHeader("X-User-Id") UUID userId,
                                                         @PathVariable("month") String month) {
        return monthlyBalanceService.monthlyBalance(userId, YearMonth.parse(month))
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
