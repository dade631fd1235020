package com.tradegate.access.repository;

import com.tradegate.access.domain.DomainModels.Role;
import com.tradegate.access.domain.DomainModels.SubscriptionTier;
import com.tradegate.access.domain.DomainModels.User;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class UserJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public UserJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(User user) {
        jdbcTemplate.update(
                "INSERT INTO users(id, display_name, birthdate, subscription_tier, guardian_id) VALUES (?,?,?,?,?)",
                user.id(), user.displayName(), user.birthdate() == null ? null : Date.valueOf(user.birthdate()),
                user.tier().name(), user.guardianId());
        replaceRoles(user.id(), user.roles());
    }

    public Optional<User> findById(String userId) {
        List<UserRow> rows = jdbcTemplate.query(
                "SELECT id, display_name, birthdate, subscription_tier, guardian_id FROM users WHERE id = ?",
                (rs, n) -> new UserRow(rs.getString(1), rs.getString(2), rs.getDate(3),
                        SubscriptionTier.valueOf(rs.getString(4)), rs.getString(5)),
                userId);
        if (rows.isEmpty()) return Optional.empty();

        UserRow row = rows.get(0);
        return Optional.of(new User(row.id(), row.displayName(),
                row.birthdate() == null ? null : row.birthdate().toLocalDate(),
                loadRoles(userId), row.tier(), row.guardianId()));
    }

    /** Row-locks the user until the surrounding transaction ends; false if the user does not exist. */
    public boolean lock(String userId) {
        return !jdbcTemplate.queryForList("SELECT id FROM users WHERE id = ? FOR UPDATE", String.class, userId).isEmpty();
    }

    public int updateTier(String userId, SubscriptionTier tier) {
        return jdbcTemplate.update("UPDATE users SET subscription_tier = ? WHERE id = ?", tier.name(), userId);
    }

    public void replaceRoles(String userId, Set<Role> roles) {
        jdbcTemplate.update("DELETE FROM user_roles WHERE user_id = ?", userId);
        if (roles == null) return;
        roles.forEach(role -> jdbcTemplate.update("INSERT INTO user_roles(user_id, role) VALUES (?,?)", userId, role.name()));
    }

    private Set<Role> loadRoles(String userId) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        jdbcTemplate.queryForList("SELECT role FROM user_roles WHERE user_id = ?", String.class, userId)
                .forEach(r -> roles.add(Role.valueOf(r)));
        return roles;
    }

    private record UserRow(String id, String displayName, Date birthdate, SubscriptionTier tier, String guardianId) {}
}
