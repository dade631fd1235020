package com.tradegate.access.gate;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.tradegate.access.domain.DomainModels.Role;
import com.tradegate.access.domain.DomainModels.SubscriptionTier;

import java.time.Instant;
import java.util.Set;

public class GateModels {

    /** {@code requiredPermission} is a permission type key such as {@code trade_stocks}. */
    public record CapabilityRequest(String destination,
                                    SubscriptionTier requiredSubscription,
                                    Role requiredRole,
                                    String requiredPermission) {}

    /** An authenticated session; a null {@code expiresAt} never expires. */
    public record AccessSession(String userId, Instant expiresAt) {
        public boolean validAt(Instant now) {
            return userId != null && !userId.isBlank() && (expiresAt == null || expiresAt.isAfter(now));
        }
    }

    public enum DenialReason {
        AUTH_EXPIRED,
        INSUFFICIENT_SUBSCRIPTION,
        INSUFFICIENT_ROLE,
        PERMISSION_NOT_GRANTED,
        GUARDIAN_APPROVAL_PENDING
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Allow.class, name = "Allow"),
            @JsonSubTypes.Type(value = Deny.class, name = "Deny"),
            @JsonSubTypes.Type(value = Pending.class, name = "Pending")
    })
    public sealed interface Decision permits Allow, Deny, Pending {}

    public record Allow(String userId) implements Decision {}

    /**
     * {@code accessDenied} separates hard denials (show an access-denied notice) from
     * the soft auth redirect, which carries {@code returnTo} instead.
     */
    public record Deny(DenialReason reason, String redirectTarget, boolean accessDenied, String returnTo) implements Decision {}

    public record Pending(DenialReason reason, String redirectTarget) implements Decision {}

    /** Everything the gate needs about a user, fetched fresh for each check. */
    public record AccessProfile(String userId,
                                SubscriptionTier tier,
                                Set<Role> roles,
                                Set<String> grantedPermissionKeys,
                                Set<String> pendingApprovalKeys) {}

    /** Transient failure loading an {@link AccessProfile}; retried before failing closed. */
    public static class DataFetchFailure extends RuntimeException {
        public DataFetchFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
