package com.tradegate.access.mode;

import com.tradegate.access.audit.AccessAuditLog;
import com.tradegate.access.audit.AuditModels.AuditAction;
import com.tradegate.access.config.AccessProperties;
import com.tradegate.access.grant.PermissionGrantService;
import com.tradegate.access.mode.ModeModels.ModeSwitchRejected;
import com.tradegate.access.mode.ModeModels.ModeSwitchResult;
import com.tradegate.access.mode.ModeModels.ModeSwitched;
import com.tradegate.access.repository.TradingModeJdbcRepository;
import com.tradegate.access.user.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Paper/live state per user. A rejected switch to live leaves the user where they were;
 * there is no silent downgrade.
 */
@Service
public class TradingModeController {
    private static final Logger log = LoggerFactory.getLogger(TradingModeController.class);

    private final TradingModeJdbcRepository repository;
    private final PermissionGrantService grants;
    private final UserDirectory users;
    private final AccessAuditLog audit;
    private final String livePermission;
    private final Clock clock;

    public TradingModeController(TradingModeJdbcRepository repository,
                                 PermissionGrantService grants,
                                 UserDirectory users,
                                 AccessAuditLog audit,
                                 AccessProperties properties,
                                 Clock clock) {
        this.repository = repository;
        this.grants = grants;
        this.users = users;
        this.audit = audit;
        this.livePermission = properties.liveTradingPermission();
        this.clock = clock;
    }

    public TradingMode currentMode(String userId) {
        return repository.find(userId).orElse(TradingMode.PAPER);
    }

    @Transactional
    public ModeSwitchResult switchMode(String userId, TradingMode target) {
        users.user(userId);
        TradingMode current = currentMode(userId);

        if (target == TradingMode.LIVE && !grants.hasPermission(userId, livePermission)) {
            log.info("Rejected switch to LIVE for user={}: missing {}", userId, livePermission);
            audit.record(AuditAction.MODE_SWITCH, userId, null, userId, "REJECTED", current + " -> " + target);
            return new ModeSwitchRejected(current, target, livePermission);
        }
        if (current == target) {
            return new ModeSwitched(current, false);
        }

        repository.save(userId, target, clock.instant());
        log.info("User {} switched trading mode {} -> {}", userId, current, target);
        audit.record(AuditAction.MODE_SWITCH, userId, null, userId, "SWITCHED", current + " -> " + target);
        return new ModeSwitched(target, true);
    }
}
