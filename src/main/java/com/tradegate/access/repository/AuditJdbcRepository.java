package com.tradegate.access.repository;

import com.tradegate.access.audit.AuditModels.AuditAction;
import com.tradegate.access.audit.AuditModels.AuditEntry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.tradegate.access.repository.ProgressJdbcRepository.toInstant;
import static com.tradegate.access.repository.ProgressJdbcRepository.ts;

@Repository
public class AuditJdbcRepository {
    private static final RowMapper<AuditEntry> MAPPER = (rs, n) -> new AuditEntry(toInstant(rs.getTimestamp(1)),
            AuditAction.valueOf(rs.getString(2)),
            rs.getString(3), rs.getString(4), rs.getString(5), rs.getString(6), rs.getString(7));

    private final JdbcTemplate jdbcTemplate;

    public AuditJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void append(AuditEntry e) {
        jdbcTemplate.update(
                "INSERT INTO access_audit(ts, action, user_id, permission_id, actor, outcome, detail) VALUES (?,?,?,?,?,?,?)",
                ts(e.ts()), e.action().name(), e.userId(), e.permissionId(), e.actor(), e.outcome(), e.detail());
    }

    public List<AuditEntry> query(String userId) {
        String sql = "SELECT ts, action, user_id, permission_id, actor, outcome, detail FROM access_audit";
        if (userId == null) {
            return jdbcTemplate.query(sql + " ORDER BY id", MAPPER);
        }
        return jdbcTemplate.query(sql + " WHERE user_id = ? ORDER BY id", MAPPER, userId);
    }
}
