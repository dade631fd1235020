package com.tradegate.access.api;

import com.tradegate.access.domain.DomainModels.UserPermission;
import com.tradegate.access.eligibility.EligibilityModels.EligibilityResult;
import com.tradegate.access.eligibility.EligibilityService;
import com.tradegate.access.grant.GrantModels.GrantResult;
import com.tradegate.access.grant.PermissionGrantService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/permissions")
public class PermissionController {
    private final PermissionGrantService grants;
    private final EligibilityService eligibility;

    public PermissionController(PermissionGrantService grants, EligibilityService eligibility) {
        this.grants = grants;
        this.eligibility = eligibility;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<List<UserPermission>> granted(@PathVariable String userId) {
        return ResponseEntity.ok(grants.listGrantedPermissions(userId));
    }

    @GetMapping("/{userId}/{permissionId}/eligibility")
    public ResponseEntity<EligibilityResult> eligibility(@PathVariable String userId, @PathVariable String permissionId) {
        return ResponseEntity.ok(eligibility.evaluate(userId, permissionId));
    }

    @PostMapping("/grant")
    public ResponseEntity<GrantResult> grant(@Valid @RequestBody GrantRequest request) {
        return ResponseEntity.ok(grants.grant(request.userId(), request.permissionId()));
    }

    /** Blank reasons are rejected by the service with a validation error, not by bean validation. */
    @PostMapping("/override")
    public ResponseEntity<GrantResult> override(@Valid @RequestBody OverrideRequest request) {
        return ResponseEntity.ok(grants.override(request.userId(), request.permissionId(), request.adminId(), request.reason()));
    }

    public record GrantRequest(@NotBlank String userId, @NotBlank String permissionId) {}

    public record OverrideRequest(@NotBlank String userId, @NotBlank String permissionId, @NotBlank String adminId, String reason) {}
}
