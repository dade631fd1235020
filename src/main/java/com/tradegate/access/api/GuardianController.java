package com.tradegate.access.api;

import com.tradegate.access.domain.DomainModels.GuardianApproval;
import com.tradegate.access.guardian.GuardianApprovalWorkflow;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/guardian")
public class GuardianController {
    private final GuardianApprovalWorkflow workflow;

    public GuardianController(GuardianApprovalWorkflow workflow) {
        this.workflow = workflow;
    }

    @PostMapping("/requests")
    public ResponseEntity<GuardianApproval> request(@Valid @RequestBody ApprovalRequest request) {
        return ResponseEntity.ok(workflow.requestApproval(request.minorId(), request.guardianId(), request.permissionId()));
    }

    @PostMapping("/requests/{approvalId}/decision")
    public ResponseEntity<GuardianApproval> decide(@PathVariable String approvalId, @Valid @RequestBody DecisionRequest request) {
        return ResponseEntity.ok(workflow.decide(approvalId, request.guardianId(), request.approved()));
    }

    @GetMapping("/{guardianId}/pending")
    public ResponseEntity<List<GuardianApproval>> pending(@PathVariable String guardianId) {
        return ResponseEntity.ok(workflow.pendingForGuardian(guardianId));
    }

    @GetMapping("/minors/{minorId}/requests")
    public ResponseEntity<List<GuardianApproval>> requestsForMinor(@PathVariable String minorId) {
        return ResponseEntity.ok(workflow.requestsForMinor(minorId));
    }

    public record ApprovalRequest(@NotBlank String minorId, @NotBlank String guardianId, @NotBlank String permissionId) {}

    public record DecisionRequest(@NotBlank String guardianId, boolean approved) {}
}
