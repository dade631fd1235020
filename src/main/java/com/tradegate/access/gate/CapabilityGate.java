package com.tradegate.access.gate;

import com.tradegate.access.audit.AccessAuditLog;
import com.tradegate.access.audit.AuditModels.AuditAction;
import com.tradegate.access.config.AccessProperties;
import com.tradegate.access.gate.GateModels.AccessProfile;
import com.tradegate.access.gate.GateModels.AccessSession;
import com.tradegate.access.gate.GateModels.Allow;
import com.tradegate.access.gate.GateModels.CapabilityRequest;
import com.tradegate.access.gate.GateModels.DataFetchFailure;
import com.tradegate.access.gate.GateModels.Decision;
import com.tradegate.access.gate.GateModels.DenialReason;
import com.tradegate.access.gate.GateModels.Deny;
import com.tradegate.access.gate.GateModels.Pending;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a session may reach a destination. Checks run in a fixed order
 * (auth, subscription, role, permission) and the first failure wins. The gate only
 * reads; it never grants. Any failure to load the profile fails closed to
 * {@link DenialReason#AUTH_EXPIRED}.
 */
@Service
public class CapabilityGate {
    private static final Logger log = LoggerFactory.getLogger(CapabilityGate.class);

    private final ProfileSource profiles;
    private final RetryTemplate retryTemplate;
    private final AccessProperties.Gate settings;
    private final AccessAuditLog audit;
    private final Clock clock;

    public CapabilityGate(ProfileSource profiles,
                          @Qualifier("profileRetryTemplate") RetryTemplate retryTemplate,
                          AccessProperties properties,
                          AccessAuditLog audit,
                          Clock clock) {
        this.profiles = profiles;
        this.retryTemplate = retryTemplate;
        this.settings = properties.gate();
        this.audit = audit;
        this.clock = clock;
    }

    public Decision checkCapability(AccessSession session, CapabilityRequest request) {
        String destination = request.destination();
        if (session == null || !session.validAt(clock.instant())) {
            return deny(session == null ? null : session.userId(), request, authExpired(destination), "no valid session");
        }

        AccessProfile profile;
        try {
            profile = retryTemplate.execute(ctx -> awaitProfile(session.userId()));
        } catch (RuntimeException e) {
            return deny(session.userId(), request, authExpired(destination), "profile unavailable: " + e.getMessage());
        }

        if (!profile.tier().atLeast(request.requiredSubscription())) {
            return deny(profile.userId(), request,
                    new Deny(DenialReason.INSUFFICIENT_SUBSCRIPTION, settings.pricingPage(), true, null),
                    profile.tier() + " < " + request.requiredSubscription());
        }
        if (request.requiredRole() != null && !profile.roles().contains(request.requiredRole())) {
            return deny(profile.userId(), request,
                    new Deny(DenialReason.INSUFFICIENT_ROLE, settings.defaultPage(), true, null),
                    "missing role " + request.requiredRole());
        }

        String key = request.requiredPermission();
        if (key != null && !profile.grantedPermissionKeys().contains(key)) {
            if (profile.pendingApprovalKeys().contains(key)) {
                return deny(profile.userId(), request,
                        new Pending(DenialReason.GUARDIAN_APPROVAL_PENDING, settings.pendingPage()),
                        "guardian approval pending for " + key);
            }
            return deny(profile.userId(), request,
                    new Deny(DenialReason.PERMISSION_NOT_GRANTED, settings.permissionPage() + "/" + key, true, null),
                    "permission " + key + " not granted");
        }
        return new Allow(profile.userId());
    }

    private AccessProfile awaitProfile(String userId) {
        CompletableFuture<AccessProfile> future = profiles.fetch(userId);
        try {
            return future.get(settings.profileTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IllegalStateException("Profile fetch timed out after " + settings.profileTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching profile", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DataFetchFailure("Profile fetch failed", cause);
        }
    }

    private Deny authExpired(String destination) {
        return new Deny(DenialReason.AUTH_EXPIRED, settings.loginPage(), false, destination);
    }

    private Decision deny(String userId, CapabilityRequest request, Decision decision, String detail) {
        String reason = decision instanceof Deny d ? d.reason().name() : ((Pending) decision).reason().name();
        log.info("Gate {} user={} destination={} permission={}: {}",
                reason, userId, request.destination(), request.requiredPermission(), detail);
        audit.record(AuditAction.GATE_DENIAL, userId, null, "gate", reason,
                request.destination() + " (" + detail + ")");
        return decision;
    }
}
