package com.roadassist.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executors for work that must never block a request thread.
 *
 * <ul>
 *   <li>{@code pushExecutor}: real-time pushes and post-commit outbox dispatch</li>
 *   <li>{@code searchExecutor}: per-term external place searches</li>
 * </ul>
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "pushExecutor")
    public ThreadPoolTaskExecutor pushExecutor(@Value("${roadassist.executor.push-pool-size:4}") int poolSize) {
        return buildExecutor("push-", poolSize, 500);
    }

    @Bean(name = "searchExecutor")
    public ThreadPoolTaskExecutor searchExecutor(@Value("${roadassist.executor.search-pool-size:6}") int poolSize) {
        return buildExecutor("search-", poolSize, 100);
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
