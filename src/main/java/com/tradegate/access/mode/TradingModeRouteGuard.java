package com.tradegate.access.mode;

import com.tradegate.access.mode.ModeModels.Proceed;
import com.tradegate.access.mode.ModeModels.Redirect;
import com.tradegate.access.mode.ModeModels.RouteDecision;
import org.springframework.stereotype.Component;

/**
 * Keeps trading URLs consistent with the user's current mode. Only the leading
 * {@code /paper} or {@code /live} segment is swapped; the rest of the path is kept.
 * Permissions are neither consulted nor changed here.
 */
@Component
public class TradingModeRouteGuard {
    private final TradingModeController modes;

    public TradingModeRouteGuard(TradingModeController modes) {
        this.modes = modes;
    }

    public RouteDecision route(String userId, String path) {
        return resolve(modes.currentMode(userId), path);
    }

    static RouteDecision resolve(TradingMode current, String path) {
        if (path == null || !path.startsWith("/")) return new Proceed();

        int end = path.indexOf('/', 1);
        String segment = end < 0 ? path.substring(1) : path.substring(1, end);
        String rest = end < 0 ? "" : path.substring(end);

        return TradingMode.fromSegment(segment)
                .filter(implied -> implied != current)
                .<RouteDecision>map(implied -> new Redirect("/" + current.segment() + rest))
                .orElseGet(Proceed::new);
    }
}
