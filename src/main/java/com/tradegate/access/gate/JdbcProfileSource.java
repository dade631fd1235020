package com.tradegate.access.gate;

import com.tradegate.access.domain.DomainModels.User;
import com.tradegate.access.domain.NotFoundException;
import com.tradegate.access.gate.GateModels.AccessProfile;
import com.tradegate.access.gate.GateModels.DataFetchFailure;
import com.tradegate.access.repository.GuardianJdbcRepository;
import com.tradegate.access.repository.UserJdbcRepository;
import com.tradegate.access.repository.UserPermissionJdbcRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class JdbcProfileSource implements ProfileSource {
    private final UserJdbcRepository users;
    private final UserPermissionJdbcRepository permissions;
    private final GuardianJdbcRepository approvals;
    private final ThreadPoolTaskExecutor executor;

    public JdbcProfileSource(UserJdbcRepository users,
                             UserPermissionJdbcRepository permissions,
                             GuardianJdbcRepository approvals,
                             @Qualifier("profileFetchExecutor") ThreadPoolTaskExecutor executor) {
        this.users = users;
        this.permissions = permissions;
        this.approvals = approvals;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<AccessProfile> fetch(String userId) {
        return CompletableFuture.supplyAsync(() -> load(userId), executor);
    }

    private AccessProfile load(String userId) {
        try {
            User user = users.findById(userId).orElseThrow(() -> new NotFoundException("user", userId));
            return new AccessProfile(user.id(), user.tier(), user.roles(),
                    permissions.grantedTypeKeys(userId), approvals.pendingTypeKeys(userId));
        } catch (DataAccessException e) {
            throw new DataFetchFailure("Could not load access profile for " + userId, e);
        }
    }
}
