package com.tradegate.access.grant;

import com.tradegate.access.audit.AccessAuditLog;
import com.tradegate.access.audit.AuditModels.AuditAction;
import com.tradegate.access.catalog.PermissionCatalog;
import com.tradegate.access.domain.DomainModels.Role;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import com.tradegate.access.domain.DomainModels.User;
import com.tradegate.access.domain.DomainModels.UserPermission;
import com.tradegate.access.eligibility.EligibilityModels.EligibilityResult;
import com.tradegate.access.eligibility.EligibilityModels.FailureReason;
import com.tradegate.access.eligibility.EligibilityService;
import com.tradegate.access.grant.GrantModels.AlreadyHad;
import com.tradegate.access.grant.GrantModels.GrantResult;
import com.tradegate.access.grant.GrantModels.Granted;
import com.tradegate.access.grant.GrantModels.NotEligible;
import com.tradegate.access.repository.UserPermissionJdbcRepository;
import com.tradegate.access.user.UserDirectory;
import com.tradegate.access.validation.AccessValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns an eligibility pass into a durable {@link UserPermission}. At most one row exists
 * per (user, permission): the insert runs in a savepoint guarded by the table's primary
 * key, so the loser of a concurrent grant observes {@link AlreadyHad} instead of a
 * duplicate or an error.
 */
@Service
public class PermissionGrantService {
    private static final Logger log = LoggerFactory.getLogger(PermissionGrantService.class);
    static final int MAX_OVERRIDE_REASON = 1024;

    private final UserPermissionJdbcRepository repository;
    private final EligibilityService eligibility;
    private final UserDirectory users;
    private final PermissionCatalog catalog;
    private final AccessAuditLog audit;
    private final TransactionTemplate savepoint;
    private final Clock clock;

    public PermissionGrantService(UserPermissionJdbcRepository repository,
                                  EligibilityService eligibility,
                                  UserDirectory users,
                                  PermissionCatalog catalog,
                                  AccessAuditLog audit,
                                  PlatformTransactionManager transactionManager,
                                  Clock clock) {
        this.repository = repository;
        this.eligibility = eligibility;
        this.users = users;
        this.catalog = catalog;
        this.audit = audit;
        this.savepoint = new TransactionTemplate(transactionManager);
        this.savepoint.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        this.clock = clock;
    }

    @Transactional
    public GrantResult grant(String userId, String permissionId) {
        var existing = repository.find(userId, permissionId);
        if (existing.isPresent()) {
            return new AlreadyHad(existing.get());
        }

        User user = users.user(userId);
        TradingPermission permission = catalog.permission(permissionId);
        EligibilityResult result = eligibility.evaluate(user, permission);
        if (!result.eligible()) {
            String reasons = describe(result.reasons());
            log.info("Grant refused user={} permission={} reasons={}", userId, permission.typeKey(), reasons);
            audit.record(AuditAction.GRANT_REFUSED, userId, permissionId, UserPermission.SYSTEM, "NOT_ELIGIBLE", reasons);
            return new NotEligible(userId, permissionId, result.reasons());
        }

        Instant now = clock.instant();
        return insert(new UserPermission(userId, permissionId, now, UserPermission.SYSTEM, null, now), AuditAction.GRANT);
    }

    /**
     * Grants without evaluating requirements. The only path that can grant an ineligible
     * user; requires an administrator and a non-blank reason.
     */
    @Transactional
    public GrantResult override(String userId, String permissionId, String adminId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new AccessValidationException("OVERRIDE_REASON_REQUIRED", "Override requires a non-empty reason", permissionId);
        }
        if (reason.trim().length() > MAX_OVERRIDE_REASON) {
            throw new AccessValidationException("OVERRIDE_REASON_TOO_LONG",
                    "Override reason exceeds " + MAX_OVERRIDE_REASON + " characters", permissionId);
        }
        User admin = users.user(adminId);
        if (!admin.hasRole(Role.ADMIN)) {
            throw new AccessValidationException("NOT_ADMIN", "Only administrators can override permissions: " + adminId, adminId);
        }
        users.user(userId);
        catalog.permission(permissionId);

        var existing = repository.find(userId, permissionId);
        if (existing.isPresent()) {
            return new AlreadyHad(existing.get());
        }
        return insert(new UserPermission(userId, permissionId, clock.instant(), adminId, reason.trim(), null), AuditAction.OVERRIDE);
    }

    public List<UserPermission> listGrantedPermissions(String userId) {
        users.user(userId);
        return repository.listForUser(userId);
    }

    public Set<String> grantedTypeKeys(String userId) {
        return repository.grantedTypeKeys(userId);
    }

    public boolean hasPermission(String userId, String typeKey) {
        return repository.grantedTypeKeys(userId).contains(typeKey);
    }

    private GrantResult insert(UserPermission row, AuditAction action) {
        try {
            savepoint.executeWithoutResult(status -> repository.insert(row));
        } catch (DuplicateKeyException race) {
            log.info("Concurrent grant for user={} permission={} already committed", row.userId(), row.permissionId());
            UserPermission winner = repository.find(row.userId(), row.permissionId())
                    .orElseThrow(() -> new IllegalStateException("Duplicate key without visible row", race));
            return new AlreadyHad(winner);
        }

        String detail = row.overridden() ? "reason=" + row.overrideReason() : "eligibility passed";
        log.info("Granted permission={} to user={} by={} ({})", row.permissionId(), row.userId(), row.grantedBy(), detail);
        audit.record(action, row.userId(), row.permissionId(), row.grantedBy(), "GRANTED", detail);
        return new Granted(row);
    }

    private static String describe(List<FailureReason> reasons) {
        return reasons.stream().map(r -> r.getClass().getSimpleName()).collect(Collectors.joining(","));
    }
}
