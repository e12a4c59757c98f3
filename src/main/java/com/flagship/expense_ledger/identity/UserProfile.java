package com.flagship.expense_ledger.identity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Public profile of a ledger user.
 */
public record UserProfile(
    @JsonProperty("id") UUID id,
    @JsonProperty("email") String email,
    @JsonProperty("display_name") String displayName
) {

    /**
     * Display name, falling back to the local part of the email address.
     */
    @JsonProperty("name")
    public String name() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return emailLocalPart(email);
    }

    public static String emailLocalPart(String email) {
        if (email == null) {
            return "Unknown";
        }
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }
}
