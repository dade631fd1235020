package com.tradegate.access.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "access")
public record AccessProperties(@DefaultValue("18") int adultAge,
                               @DefaultValue("live_trading") String liveTradingPermission,
                               @DefaultValue Gate gate,
                               @DefaultValue Reevaluation reevaluation) {

    public record Gate(@DefaultValue("2s") Duration profileTimeout,
                       @DefaultValue("3") int maxAttempts,
                       @DefaultValue("100ms") Duration initialBackoff,
                       @DefaultValue("2.0") double backoffMultiplier,
                       @DefaultValue("1s") Duration maxBackoff,
                       @DefaultValue("/login") String loginPage,
                       @DefaultValue("/pricing") String pricingPage,
                       @DefaultValue("/dashboard") String defaultPage,
                       @DefaultValue("/learn/permissions") String permissionPage,
                       @DefaultValue("/family/pending") String pendingPage) {}

    public record Reevaluation(@DefaultValue("2000") long fixedDelayMs,
                               @DefaultValue("2000") long initialDelayMs,
                               @DefaultValue("50") int batchSize,
                               @DefaultValue("1s") Duration initialBackoff,
                               @DefaultValue("5m") Duration maxBackoff) {}
}
