package com.tradegate.access.repository;

import com.tradegate.access.domain.DomainModels.UserPermission;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static com.tradegate.access.repository.ProgressJdbcRepository.toInstant;
import static com.tradegate.access.repository.ProgressJdbcRepository.ts;

@Repository
public class UserPermissionJdbcRepository {
    private static final RowMapper<UserPermission> MAPPER = (rs, n) -> new UserPermission(
            rs.getString(1), rs.getString(2), toInstant(rs.getTimestamp(3)),
            rs.getString(4), rs.getString(5), toInstant(rs.getTimestamp(6)));

    private final JdbcTemplate jdbcTemplate;

    public UserPermissionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<UserPermission> find(String userId, String permissionId) {
        return jdbcTemplate.query(
                "SELECT user_id, permission_id, granted_at, granted_by, override_reason, evaluated_at FROM user_permissions " +
                        "WHERE user_id = ? AND permission_id = ?",
                MAPPER, userId, permissionId).stream().findFirst();
    }

    /**
     * Plain insert; the (user_id, permission_id) primary key rejects a second row with
     * {@link org.springframework.dao.DuplicateKeyException}.
     */
    public void insert(UserPermission p) {
        jdbcTemplate.update(
                "INSERT INTO user_permissions(user_id, permission_id, granted_at, granted_by, override_reason, evaluated_at) VALUES (?,?,?,?,?,?)",
                p.userId(), p.permissionId(), ts(p.grantedAt()), p.grantedBy(), p.overrideReason(), ts(p.evaluatedAt()));
    }

    public List<UserPermission> listForUser(String userId) {
        return jdbcTemplate.query(
                "SELECT user_id, permission_id, granted_at, granted_by, override_reason, evaluated_at FROM user_permissions " +
                        "WHERE user_id = ? ORDER BY granted_at",
                MAPPER, userId);
    }

    public long count(String userId, String permissionId) {
        Long value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM user_permissions WHERE user_id = ? AND permission_id = ?",
                Long.class, userId, permissionId);
        return value == null ? 0 : value;
    }

    public Set<String> grantedTypeKeys(String userId) {
        return new TreeSet<>(jdbcTemplate.queryForList(
                "SELECT p.type_key FROM user_permissions up JOIN trading_permissions p ON p.id = up.permission_id WHERE up.user_id = ?",
                String.class, userId));
    }
}
