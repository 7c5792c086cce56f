package com.lumina.agent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Thread pools for agent work, isolated from the web pool.
 *
 * - agentTaskExecutor: one thread per running task, each runs a loop to completion
 * - modelCallExecutor: carries the blocking model call so the loop thread can abandon it
 * - timeoutScheduler:  periodic slow-request checks
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentTaskExecutor")
    public Executor agentTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("agent-task-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "modelCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService modelCallExecutor() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("model-call-");
        factory.setDaemon(true);
        return Executors.newCachedThreadPool(factory);
    }

    @Bean(name = "timeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService timeoutScheduler() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("request-timeout-");
        factory.setDaemon(true);
        return Executors.newSingleThreadScheduledExecutor(factory);
    }
}
