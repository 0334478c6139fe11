package com.demo.groupchat.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for the async pipeline.
 *
 * - ioExecutor: every storage call runs here
 * - taskExecutor: out-of-band tasks (push fan-out, sender snapshot repair)
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "ioExecutor")
    public ThreadPoolTaskExecutor ioExecutor(@Value("${chat.executor.io-pool-size:16}") int poolSize) {
        return executor("chat-io-", poolSize, 10_000);
    }

    @Bean(name = "taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor(@Value("${chat.executor.task-pool-size:4}") int poolSize) {
        return executor("chat-task-", poolSize, 1_000);
    }

    private ThreadPoolTaskExecutor executor(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
