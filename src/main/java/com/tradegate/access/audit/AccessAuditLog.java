package com.tradegate.access.audit;

import com.tradegate.access.audit.AuditModels.AuditAction;
import com.tradegate.access.audit.AuditModels.AuditEntry;
import com.tradegate.access.repository.AuditJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Audit trail for grants, overrides, refusals and gate denials. Each entry is logged
 * and persisted; a failing audit write is logged and never fails the audited operation.
 */
@Service
public class AccessAuditLog {
    private static final Logger log = LoggerFactory.getLogger(AccessAuditLog.class);

    private final AuditJdbcRepository repository;
    private final Clock clock;

    public AccessAuditLog(AuditJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void record(AuditAction action, String userId, String permissionId, String actor, String outcome, String detail) {
        AuditEntry entry = new AuditEntry(clock.instant(), action, userId, permissionId, actor, outcome, detail);
        log.info("audit action={} user={} permission={} actor={} outcome={} detail={}",
                action, userId, permissionId, actor, outcome, detail);
        try {
            repository.append(entry);
        } catch (DataAccessException e) {
            log.error("Failed to persist audit entry action={} user={} permission={}", action, userId, permissionId, e);
        }
    }

    public List<AuditEntry> entries(String userId) {
        return repository.query(userId);
    }
}
