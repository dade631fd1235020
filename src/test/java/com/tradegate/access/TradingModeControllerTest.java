package com.tradegate.access;

import com.tradegate.access.catalog.PermissionCatalog;
import com.tradegate.access.config.AccessProperties;
import com.tradegate.access.domain.DomainModels.Role;
import com.tradegate.access.domain.DomainModels.SubscriptionTier;
import com.tradegate.access.domain.DomainModels.TradingPermission;
import com.tradegate.access.grant.PermissionGrantService;
import com.tradegate.access.mode.ModeModels.ModeSwitchRejected;
import com.tradegate.access.mode.ModeModels.ModeSwitched;
import com.tradegate.access.mode.ModeModels.Proceed;
import com.tradegate.access.mode.ModeModels.Redirect;
import com.tradegate.access.mode.TradingMode;
import com.tradegate.access.mode.TradingModeController;
import com.tradegate.access.mode.TradingModeRouteGuard;
import com.tradegate.access.user.UserDirectory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class TradingModeControllerTest {
    @Autowired
    private TradingModeController modes;
    @Autowired
    private TradingModeRouteGuard routeGuard;
    @Autowired
    private UserDirectory users;
    @Autowired
    private PermissionCatalog catalog;
    @Autowired
    private PermissionGrantService grantService;
    @Autowired
    private AccessProperties properties;

    @Test
    void liveRequiresTheLiveTradingPermission() {
        String user = users.register(Fixtures.adult(Fixtures.id("trader"), SubscriptionTier.PREMIUM)).id();
        assertEquals(TradingMode.PAPER, modes.currentMode(user));

        var rejected = assertInstanceOf(ModeSwitchRejected.class, modes.switchMode(user, TradingMode.LIVE));
        assertEquals(TradingMode.PAPER, rejected.mode());
        assertEquals(properties.liveTradingPermission(), rejected.missingPermission());
        assertEquals(TradingMode.PAPER, modes.currentMode(user));

        String admin = users.register(Fixtures.adult(Fixtures.id("admin"), SubscriptionTier.FREE, Role.ADMIN)).id();
        grantService.override(user, livePermission().id(), admin, "verified professional trader");

        assertEquals(new ModeSwitched(TradingMode.LIVE, true), modes.switchMode(user, TradingMode.LIVE));
        assertEquals(new ModeSwitched(TradingMode.LIVE, false), modes.switchMode(user, TradingMode.LIVE));
        assertEquals(new ModeSwitched(TradingMode.PAPER, true), modes.switchMode(user, TradingMode.PAPER));
    }

    @Test
    void routeFollowsCurrentModeWithoutTouchingPermissions() {
        String user = users.register(Fixtures.adult(Fixtures.id("trader"), SubscriptionTier.FREE)).id();

        assertEquals(new Redirect("/paper/trading/AAPL"), routeGuard.route(user, "/live/trading/AAPL"));
        assertInstanceOf(Proceed.class, routeGuard.route(user, "/paper/trading/AAPL"));
        assertTrue(grantService.listGrantedPermissions(user).isEmpty());
    }

    private TradingPermission livePermission() {
        String key = properties.liveTradingPermission();
        return catalog.listPermissions().stream()
                .filter(p -> p.typeKey().equals(key))
                .findFirst()
                .orElseGet(() -> catalog.createPermission(Fixtures.permission(key, 18, false, null, null, null)));
    }
}
