package com.tradegate.access.api;

import com.tradegate.access.domain.DomainModels.Role;
import com.tradegate.access.domain.DomainModels.SubscriptionTier;
import com.tradegate.access.gate.CapabilityGate;
import com.tradegate.access.gate.GateModels.AccessSession;
import com.tradegate.access.gate.GateModels.CapabilityRequest;
import com.tradegate.access.gate.GateModels.Decision;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/** Always answers 200; the decision body carries denials and redirect targets. */
@RestController
@RequestMapping("/api/access")
public class AccessController {
    private final CapabilityGate gate;

    public AccessController(CapabilityGate gate) {
        this.gate = gate;
    }

    @PostMapping("/check")
    public ResponseEntity<Decision> check(@RequestBody CheckRequest request) {
        AccessSession session = request.userId() == null ? null : new AccessSession(request.userId(), request.sessionExpiresAt());
        return ResponseEntity.ok(gate.checkCapability(session, new CapabilityRequest(request.destination(),
                request.requiredSubscription(), request.requiredRole(), request.requiredPermission())));
    }

    public record CheckRequest(String userId,
                               Instant sessionExpiresAt,
                               String destination,
                               SubscriptionTier requiredSubscription,
                               Role requiredRole,
                               String requiredPermission) {}
}
