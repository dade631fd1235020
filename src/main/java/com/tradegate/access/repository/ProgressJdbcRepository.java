package com.tradegate.access.repository;

import com.tradegate.access.domain.DomainModels.UserProgress;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ProgressJdbcRepository {
    private static final String COLUMNS =
            "user_id, content_id, started_at, completed_at, score, passed, attempts, time_spent_seconds, last_accessed";

    private static final RowMapper<UserProgress> MAPPER = (rs, n) -> new UserProgress(
            rs.getString(1), rs.getString(2),
            toInstant(rs.getTimestamp(3)), toInstant(rs.getTimestamp(4)),
            (Double) rs.getObject(5), (Boolean) rs.getObject(6),
            rs.getInt(7), rs.getLong(8), toInstant(rs.getTimestamp(9)));

    private final JdbcTemplate jdbcTemplate;

    public ProgressJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /** Row-locks the (user, content) record for the rest of the surrounding transaction. */
    public Optional<UserProgress> findForUpdate(String userId, String contentId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM user_progress WHERE user_id = ? AND content_id = ? FOR UPDATE",
                MAPPER, userId, contentId).stream().findFirst();
    }

    public Optional<UserProgress> find(String userId, String contentId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM user_progress WHERE user_id = ? AND content_id = ?",
                MAPPER, userId, contentId).stream().findFirst();
    }

    public List<UserProgress> loadForUser(String userId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM user_progress WHERE user_id = ? ORDER BY content_id", MAPPER, userId);
    }

    public void insert(UserProgress p) {
        jdbcTemplate.update("INSERT INTO user_progress(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)",
                p.userId(), p.contentId(), ts(p.startedAt()), ts(p.completedAt()), p.score(), p.passed(),
                p.attempts(), p.timeSpentSeconds(), ts(p.lastAccessed()));
    }

    public void update(UserProgress p) {
        jdbcTemplate.update(
                "UPDATE user_progress SET completed_at = ?, score = ?, passed = ?, attempts = ?, time_spent_seconds = ?, last_accessed = ? " +
                        "WHERE user_id = ? AND content_id = ?",
                ts(p.completedAt()), p.score(), p.passed(), p.attempts(), p.timeSpentSeconds(), ts(p.lastAccessed()),
                p.userId(), p.contentId());
    }

    static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
