package com.tradegate.access.repository;

import com.tradegate.access.mode.TradingMode;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static com.tradegate.access.repository.ProgressJdbcRepository.ts;

@Repository
public class TradingModeJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public TradingModeJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<TradingMode> find(String userId) {
        return jdbcTemplate.queryForList("SELECT mode FROM trading_modes WHERE user_id = ?", String.class, userId)
                .stream().findFirst().map(TradingMode::valueOf);
    }

    public void save(String userId, TradingMode mode, Instant changedAt) {
        jdbcTemplate.update("MERGE INTO trading_modes(user_id, mode, changed_at) KEY(user_id) VALUES (?,?,?)",
                userId, mode.name(), ts(changedAt));
    }
}
