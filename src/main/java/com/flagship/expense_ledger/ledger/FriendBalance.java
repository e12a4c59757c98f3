package com.flagship.expense_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Net position between a user and one counterparty.
 * Positive balance: the friend owes the user. Negative: the user owes the friend.
 */
@Value
public class FriendBalance {

    @JsonProperty("friend_id")
    UUID friendId;

    @JsonProperty("friend_name")
    String friendName;

    @JsonProperty("friend_email")
    String friendEmail;

    @JsonProperty("balance")
    BigDecimal balance;
}
