package com.tradegate.access.config;

import com.tradegate.access.eligibility.EligibilityEvaluator;
import com.tradegate.access.gate.GateModels.DataFetchFailure;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AccessEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EligibilityEvaluator eligibilityEvaluator(AccessProperties properties) {
        return new EligibilityEvaluator(properties.adultAge());
    }

    @Bean
    public RetryTemplate profileRetryTemplate(AccessProperties properties) {
        AccessProperties.Gate gate = properties.gate();
        return RetryTemplate.builder()
                .maxAttempts(gate.maxAttempts())
                .exponentialBackoff(gate.initialBackoff().toMillis(), gate.backoffMultiplier(), gate.maxBackoff().toMillis())
                .retryOn(DataFetchFailure.class)
                .build();
    }

    @Bean
    public ThreadPoolTaskExecutor profileFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("profile-fetch-");
        return executor;
    }
}
