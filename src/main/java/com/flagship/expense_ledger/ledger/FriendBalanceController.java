package com.flagship.expense_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Friend balances of the acting user (X-User-Id header).
 */
@RestController
@RequestMapping("/api/balances/friends")
@RequiredArgsConstructor
public class FriendBalanceController {

    private final FriendBalanceService friendBalanceService;

    @GetMapping
    public List<FriendBalance> balances(@RequestHeader("X-User-Id") UUID userId) {
        return friendBalanceService.balances(userId);
    }

    @GetMapping("/{friendId}")
    public Map<String, Object> balance(@RequestHeader("X-User-Id") UUID userId,
                                       @PathVariable("friendId") UUID friendId) {
        BigDecimal balance = friendBalanceService.balance(userId, friendId);
        return Map.of("friend_id", friendId, "balance", balance);
    }

    @GetMapping("/{friendId}/breakdown")
    public List<BalanceBreakdownEntry> breakdown(@RequestHeader("X-User-Id") UUID userId,
                                                 @PathVariable("friendId") UUID friendId) {
        return friendBalanceService.breakdown(userId, friendId);
    }
}
