package com.flagship.expense_ledger.identity;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of user profiles and accepted friend connections.
 */
public interface UserDirectory {

    Optional<UserProfile> findById(UUID userId);

    /**
     * Profiles for the given ids; unknown ids are absent from the result.
     */
    Map<UUID, UserProfile> findByIds(Collection<UUID> userIds);

    /**
     * Case-insensitive lookup by email address.
     */
    Optional<UserProfile> findByEmail(String email);

    /**
     * Users with an accepted connection to {@code userId}, in either direction.
     */
    List<UserProfile> findFriends(UUID userId);

    default String displayNameOf(UUID userId) {
        return findById(userId).map(UserProfile::name).orElse("Unknown");
    }
}
