package com.tradegate.access.api;

import com.tradegate.access.mode.ModeModels.ModeSwitchResult;
import com.tradegate.access.mode.ModeModels.RouteDecision;
import com.tradegate.access.mode.TradingMode;
import com.tradegate.access.mode.TradingModeController;
import com.tradegate.access.mode.TradingModeRouteGuard;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/mode")
public class ModeController {
    private final TradingModeController modes;
    private final TradingModeRouteGuard routeGuard;

    public ModeController(TradingModeController modes, TradingModeRouteGuard routeGuard) {
        this.modes = modes;
        this.routeGuard = routeGuard;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<Map<String, Object>> current(@PathVariable String userId) {
        return ResponseEntity.ok(Map.of("userId", userId, "mode", modes.currentMode(userId)));
    }

    @PostMapping("/{userId}")
    public ResponseEntity<ModeSwitchResult> switchMode(@PathVariable String userId, @Valid @RequestBody SwitchRequest request) {
        return ResponseEntity.ok(modes.switchMode(userId, request.mode()));
    }

    @GetMapping("/{userId}/route")
    public ResponseEntity<RouteDecision> route(@PathVariable String userId, @RequestParam String path) {
        return ResponseEntity.ok(routeGuard.route(userId, path));
    }

    public record SwitchRequest(@NotNull TradingMode mode) {}
}
