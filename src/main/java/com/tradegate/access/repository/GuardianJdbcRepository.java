package com.tradegate.access.repository;

import com.tradegate.access.domain.DomainModels.ApprovalStatus;
import com.tradegate.access.domain.DomainModels.GuardianApproval;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static com.tradegate.access.repository.ProgressJdbcRepository.toInstant;
import static com.tradegate.access.repository.ProgressJdbcRepository.ts;

@Repository
public class GuardianJdbcRepository {
    private static final String COLUMNS = "id, minor_id, guardian_id, permission_id, status, requested_at, decided_at";

    private static final RowMapper<GuardianApproval> MAPPER = (rs, n) -> new GuardianApproval(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
            ApprovalStatus.valueOf(rs.getString(5)), toInstant(rs.getTimestamp(6)), toInstant(rs.getTimestamp(7)));

    private final JdbcTemplate jdbcTemplate;

    public GuardianJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(GuardianApproval a) {
        jdbcTemplate.update("INSERT INTO guardian_approvals(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?)",
                a.id(), a.minorId(), a.guardianId(), a.permissionId(), a.status().name(),
                ts(a.requestedAt()), ts(a.decidedAt()));
    }

    public Optional<GuardianApproval> find(String approvalId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM guardian_approvals WHERE id = ?", MAPPER, approvalId)
                .stream().findFirst();
    }

    /** Oldest first. */
    public List<GuardianApproval> findFor(String minorId, String permissionId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM guardian_approvals WHERE minor_id = ? AND permission_id = ? ORDER BY requested_at, id",
                MAPPER, minorId, permissionId);
    }

    public List<GuardianApproval> findForMinor(String minorId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM guardian_approvals WHERE minor_id = ? ORDER BY requested_at, id",
                MAPPER, minorId);
    }

    public List<GuardianApproval> pendingForGuardian(String guardianId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM guardian_approvals WHERE guardian_id = ? AND status = 'PENDING' ORDER BY requested_at",
                MAPPER, guardianId);
    }

    public Set<String> pendingTypeKeys(String minorId) {
        return new TreeSet<>(jdbcTemplate.queryForList(
                "SELECT p.type_key FROM guardian_approvals g JOIN trading_permissions p ON p.id = g.permission_id " +
                        "WHERE g.minor_id = ? AND g.status = 'PENDING'",
                String.class, minorId));
    }

    /** Returns the number of rows moved out of PENDING; zero means someone else decided first. */
    public int decide(String approvalId, ApprovalStatus status, Instant decidedAt) {
        return jdbcTemplate.update(
                "UPDATE guardian_approvals SET status = ?, decided_at = ? WHERE id = ? AND status = 'PENDING'",
                status.name(), ts(decidedAt), approvalId);
    }
}
