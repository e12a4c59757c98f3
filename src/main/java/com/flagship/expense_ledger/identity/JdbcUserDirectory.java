package com.flagship.expense_ledger.identity;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link UserDirectory} backed by the user_profiles and user_connections tables.
 */
@Repository
public class JdbcUserDirectory implements UserDirectory {

    private static final RowMapper<UserProfile> PROFILE_MAPPER = (rs, rowNum) -> new UserProfile(
        rs.getObject("id", UUID.class),
        rs.getString("email"),
        rs.getString("display_name")
    );

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcUserDirectory(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<UserProfile> findById(UUID userId) {
        return jdbcTemplate.query(
            "SELECT id, email, display_name FROM user_profiles WHERE id = :id",
            new MapSqlParameterSource("id", userId),
            PROFILE_MAPPER
        ).stream().findFirst();
    }

    @Override
    public Map<UUID, UserProfile> findByIds(Collection<UUID> userIds) {
        Map<UUID, UserProfile> profiles = new LinkedHashMap<>();
        if (userIds.isEmpty()) {
            return profiles;
        }
        jdbcTemplate.query(
            "SELECT id, email, display_name FROM user_profiles WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", userIds),
            PROFILE_MAPPER
        ).forEach(profile -> profiles.put(profile.id(), profile));
        return profiles;
    }

    @Override
    public Optional<UserProfile> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            "SELECT id, email, display_name FROM user_profiles WHERE lower(email) = lower(:email)",
            new MapSqlParameterSource("email", email.trim()),
            PROFILE_MAPPER
        ).stream().findFirst();
    }

    @Override
    public List<UserProfile> findFriends(UUID userId) {
        return jdbcTemplate.query(
            "SELECT p.id, p.email, p.display_name FROM user_connections c " +
            "JOIN user_profiles p ON p.id = CASE WHEN c.requester_id = :userId THEN c.addressee_id " +
            "ELSE c.requester_id END " +
            "WHERE (c.requester_id = :userId OR c.addressee_id = :userId) AND c.status = 'accepted' " +
            "ORDER BY p.email",
            new MapSqlParameterSource("userId", userId),
            PROFILE_MAPPER
        );
    }
}
