package com.tradegate.access.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.tradegate.access.repository.ProgressJdbcRepository.toInstant;
import static com.tradegate.access.repository.ProgressJdbcRepository.ts;

@Repository
public class ReevaluationJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ReevaluationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void enqueue(String userId, String permissionId, String cause, Instant now) {
        jdbcTemplate.update(
                "INSERT INTO reevaluation_signals(user_id, permission_id, cause, enqueued_at, attempts, next_attempt_at) VALUES (?,?,?,?,0,?)",
                userId, permissionId, cause, ts(now), ts(now));
    }

    public List<SignalRow> due(Instant now, int limit) {
        return jdbcTemplate.query(
                "SELECT id, user_id, permission_id, cause, enqueued_at, attempts FROM reevaluation_signals " +
                        "WHERE next_attempt_at <= ? ORDER BY next_attempt_at, id LIMIT ?",
                (rs, n) -> new SignalRow(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        toInstant(rs.getTimestamp(5)), rs.getInt(6)),
                ts(now), limit);
    }

    public List<SignalRow> pendingFor(String userId) {
        return jdbcTemplate.query(
                "SELECT id, user_id, permission_id, cause, enqueued_at, attempts FROM reevaluation_signals WHERE user_id = ? ORDER BY id",
                (rs, n) -> new SignalRow(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        toInstant(rs.getTimestamp(5)), rs.getInt(6)),
                userId);
    }

    public void delete(long id) {
        jdbcTemplate.update("DELETE FROM reevaluation_signals WHERE id = ?", id);
    }

    public void reschedule(long id, int attempts, Instant nextAttemptAt, String error) {
        jdbcTemplate.update("UPDATE reevaluation_signals SET attempts = ?, next_attempt_at = ?, last_error = ? WHERE id = ?",
                attempts, ts(nextAttemptAt), error, id);
    }

    public record SignalRow(long id, String userId, String permissionId, String cause, Instant enqueuedAt, int attempts) {}
}
