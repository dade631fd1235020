package com.tradegate.access.api;

import com.tradegate.access.audit.AccessAuditLog;
import com.tradegate.access.audit.AuditModels.AuditEntry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
public class AuditController {
    private final AccessAuditLog auditLog;

    public AuditController(AccessAuditLog auditLog) {
        this.auditLog = auditLog;
    }

    @GetMapping
    public ResponseEntity<List<AuditEntry>> entries(@RequestParam(required = false) String userId) {
        return ResponseEntity.ok(auditLog.entries(userId));
    }
}
