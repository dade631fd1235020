package com.tradegate.access.gate;

import com.tradegate.access.gate.GateModels.AccessProfile;

import java.util.concurrent.CompletableFuture;

public interface ProfileSource {

    /**
     * Completes exceptionally with {@link GateModels.DataFetchFailure} on a transient
     * failure, or with {@link com.tradegate.access.domain.NotFoundException} for an unknown user.
     */
    CompletableFuture<AccessProfile> fetch(String userId);
}
