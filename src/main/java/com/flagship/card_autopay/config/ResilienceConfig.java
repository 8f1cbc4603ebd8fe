package com.flagship.card_autopay.config;

import com.flagship.card_autopay.common.concurrency.ExternalCallGuard;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Executors;

/**
 * Time limits and thread pools for calls that leave the process.
 *
 * Bank sync and gateway submission each get their own {@code TimeLimiter}; both run on
 * the same cached pool so a slow bank never starves a gateway call of threads.
 */
@Configuration
public class ResilienceConfig {

    @Value("${autopay.sync.timeout:PT15S}")
    private Duration syncTimeout;

    @Value("${autopay.gateway.timeout:PT10S}")
    private Duration gatewayTimeout;

    @Value("${autopay.sync.parallelism:4}")
    private int syncParallelism;

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        TimeLimiterConfig defaults = TimeLimiterConfig.custom()
                .timeoutDuration(gatewayTimeout)
                .cancelRunningFuture(true)
                .build();

        TimeLimiterRegistry registry = TimeLimiterRegistry.of(defaults);
        registry.timeLimiter(ExternalCallGuard.BANK_SYNC,
                TimeLimiterConfig.from(defaults).timeoutDuration(syncTimeout).build());
        registry.timeLimiter(ExternalCallGuard.GATEWAY_SUBMIT, defaults);
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    public ExternalCallGuard externalCallGuard(TimeLimiterRegistry timeLimiterRegistry) {
        return new ExternalCallGuard(timeLimiterRegistry,
                Executors.newCachedThreadPool(new CustomizableThreadFactory("external-call-")));
    }

    /**
     * Fan-out pool for {@code syncAll}; each task then blocks on an external call.
     */
    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(syncParallelism);
        executor.setMaxPoolSize(syncParallelism);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("card-sync-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
