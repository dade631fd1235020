package com.tradegate.access.guardian;

import com.tradegate.access.audit.AccessAuditLog;
import com.tradegate.access.audit.AuditModels.AuditAction;
import com.tradegate.access.catalog.PermissionCatalog;
import com.tradegate.access.domain.DomainModels.ApprovalStatus;
import com.tradegate.access.domain.DomainModels.GuardianApproval;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import com.tradegate.access.domain.DomainModels.User;
import com.tradegate.access.domain.NotFoundException;
import com.tradegate.access.eligibility.EligibilityService;
import com.tradegate.access.reevaluation.ReevaluationQueue;
import com.tradegate.access.repository.GuardianJdbcRepository;
import com.tradegate.access.repository.UserJdbcRepository;
import com.tradegate.access.user.UserDirectory;
import com.tradegate.access.validation.AccessValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
public class GuardianApprovalWorkflow {
    private static final Logger log = LoggerFactory.getLogger(GuardianApprovalWorkflow.class);

    private final GuardianJdbcRepository repository;
    private final UserDirectory users;
    private final UserJdbcRepository userRows;
    private final PermissionCatalog catalog;
    private final EligibilityService eligibility;
    private final ReevaluationQueue reevaluation;
    private final AccessAuditLog audit;
    private final Clock clock;

    public GuardianApprovalWorkflow(GuardianJdbcRepository repository,
                                    UserDirectory users,
                                    UserJdbcRepository userRows,
                                    PermissionCatalog catalog,
                                    EligibilityService eligibility,
                                    ReevaluationQueue reevaluation,
                                    AccessAuditLog audit,
                                    Clock clock) {
        this.repository = repository;
        this.users = users;
        this.userRows = userRows;
        this.catalog = catalog;
        this.eligibility = eligibility;
        this.reevaluation = reevaluation;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Opens a request for the minor's linked guardian. Repeating a request while one is
     * pending or already approved returns that request; after a denial a new one is opened.
     */
    @Transactional
    public GuardianApproval requestApproval(String minorId, String guardianId, String permissionId) {
        User minor = users.user(minorId);
        users.user(guardianId);
        TradingPermission permission = catalog.permission(permissionId);

        if (!eligibility.isMinor(minor)) {
            throw new AccessValidationException("NOT_A_MINOR", "Guardian approval only applies to minors", minorId);
        }
        if (!Objects.equals(minor.guardianId(), guardianId)) {
            throw new AccessValidationException("GUARDIAN_MISMATCH", "User " + guardianId + " is not the guardian of " + minorId, guardianId);
        }
        if (!permission.requiresGuardianApproval()) {
            throw new AccessValidationException("APPROVAL_NOT_REQUIRED",
                    "Permission " + permission.typeKey() + " does not require guardian approval", permissionId);
        }

        // one open request per (minor, permission): concurrent requests for a minor queue up here
        userRows.lock(minorId);
        List<GuardianApproval> history = repository.findFor(minorId, permissionId);
        for (GuardianApproval existing : history) {
            if (existing.status() != ApprovalStatus.DENIED) {
                return existing;
            }
        }

        GuardianApproval request = new GuardianApproval(UUID.randomUUID().toString(), minorId, guardianId,
                permissionId, ApprovalStatus.PENDING, clock.instant(), null);
        repository.insert(request);
        log.info("Guardian approval requested id={} minor={} guardian={} permission={}",
                request.id(), minorId, guardianId, permission.typeKey());
        audit.record(AuditAction.GUARDIAN_REQUEST, minorId, permissionId, minorId, "PENDING", "guardian=" + guardianId);
        return request;
    }

    /** Approving queues a re-evaluation so the grant follows without further action from the minor. */
    @Transactional
    public GuardianApproval decide(String approvalId, String deciderId, boolean approved) {
        GuardianApproval request = repository.find(approvalId)
                .orElseThrow(() -> new NotFoundException("guardian approval", approvalId));
        if (!request.guardianId().equals(deciderId)) {
            throw new AccessValidationException("NOT_GUARDIAN", "Only the linked guardian can decide this request", deciderId);
        }

        ApprovalStatus status = approved ? ApprovalStatus.APPROVED : ApprovalStatus.DENIED;
        Instant now = clock.instant();
        if (repository.decide(approvalId, status, now) == 0) {
            throw new IllegalStateException("Approval request " + approvalId + " was already decided: " + request.status());
        }

        if (approved) {
            reevaluation.enqueue(request.minorId(), request.permissionId(), "guardian_approved:" + approvalId);
        }
        log.info("Guardian {} decided request {} for minor={} permission={}: {}",
                deciderId, approvalId, request.minorId(), request.permissionId(), status);
        audit.record(AuditAction.GUARDIAN_DECISION, request.minorId(), request.permissionId(), deciderId, status.name(), approvalId);
        return new GuardianApproval(request.id(), request.minorId(), request.guardianId(), request.permissionId(),
                status, request.requestedAt(), now);
    }

    public List<GuardianApproval> pendingForGuardian(String guardianId) {
        users.user(guardianId);
        return repository.pendingForGuardian(guardianId);
    }

    public List<GuardianApproval> requestsForMinor(String minorId) {
        users.user(minorId);
        return repository.findForMinor(minorId);
    }
}
