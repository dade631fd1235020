package com.tradegate.access.audit;

import java.time.Instant;

public class AuditModels {
    public enum AuditAction {
        GRANT,
        GRANT_REFUSED,
        OVERRIDE,
        GATE_DENIAL,
        GUARDIAN_REQUEST,
        GUARDIAN_DECISION,
        MODE_SWITCH
    }

    public record AuditEntry(Instant ts,
                             AuditAction action,
                             String userId,
                             String permissionId,
                             String actor,
                             String outcome,
                             String detail) {}
}
