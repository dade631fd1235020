package com.tradegate.access.reevaluation;

import com.tradegate.access.config.AccessProperties;
import com.tradegate.access.grant.GrantModels.GrantResult;
import com.tradegate.access.grant.PermissionGrantService;
import com.tradegate.access.repository.ReevaluationJdbcRepository;
import com.tradegate.access.repository.ReevaluationJdbcRepository.SignalRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Durable outbox between progress/guardian writes and {@link PermissionGrantService}.
 * Signals are delivered at least once; grant idempotency absorbs repeats.
 */
@Service
public class ReevaluationQueue {
    private static final Logger log = LoggerFactory.getLogger(ReevaluationQueue.class);

    private final ReevaluationJdbcRepository repository;
    private final PermissionGrantService grants;
    private final AccessProperties.Reevaluation settings;
    private final Clock clock;

    public ReevaluationQueue(ReevaluationJdbcRepository repository,
                             PermissionGrantService grants,
                             AccessProperties properties,
                             Clock clock) {
        this.repository = repository;
        this.grants = grants;
        this.settings = properties.reevaluation();
        this.clock = clock;
    }

    public void enqueue(String userId, String permissionId, String cause) {
        repository.enqueue(userId, permissionId, cause, clock.instant());
        log.debug("Queued re-evaluation user={} permission={} cause={}", userId, permissionId, cause);
    }

    public List<SignalRow> pendingFor(String userId) {
        return repository.pendingFor(userId);
    }

    @Scheduled(fixedDelayString = "${access.reevaluation.fixed-delay-ms:2000}",
            initialDelayString = "${access.reevaluation.initial-delay-ms:2000}")
    public synchronized int drain() {
        List<SignalRow> due = repository.due(clock.instant(), settings.batchSize());
        int delivered = 0;
        for (SignalRow signal : due) {
            try {
                GrantResult result = grants.grant(signal.userId(), signal.permissionId());
                repository.delete(signal.id());
                delivered++;
                log.debug("Delivered signal {} ({}): {}", signal.id(), signal.cause(), result.getClass().getSimpleName());
            } catch (RuntimeException e) {
                int attempts = signal.attempts() + 1;
                Instant next = clock.instant().plus(backoff(attempts));
                repository.reschedule(signal.id(), attempts, next, e.getMessage());
                log.warn("Re-evaluation of user={} permission={} failed (attempt {}), retrying at {}",
                        signal.userId(), signal.permissionId(), attempts, next, e);
            }
        }
        return delivered;
    }

    Duration backoff(int attempts) {
        long initial = settings.initialBackoff().toMillis();
        long cap = settings.maxBackoff().toMillis();
        long millis = initial << Math.min(attempts - 1, 20);
        return Duration.ofMillis(Math.min(millis, cap));
    }
}
