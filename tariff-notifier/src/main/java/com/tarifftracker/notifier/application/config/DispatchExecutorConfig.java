package com.tarifftracker.notifier.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Fixed-size pool for per-user deliveries. The queue is unbounded so a sweep never rejects a
 * user; the pool size alone caps concurrent calls to the messaging provider.
 */
@Configuration
public class DispatchExecutorConfig {

    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(NotifierProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        var size = properties.dispatch().maxConcurrency();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
