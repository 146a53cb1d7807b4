package com.analyticscache.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Isolated thread pool for cache warming.
 *
 * Warms never run on request threads or on the scheduler thread. A full queue
 * rejects new tasks.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean("warmingExecutor")
    public ThreadPoolTaskExecutor warmingExecutor(CacheProperties properties) {
        CacheProperties.Warming warming = properties.getWarming();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(warming.getExecutorCorePoolSize());
        executor.setMaxPoolSize(warming.getExecutorMaxPoolSize());
        executor.setQueueCapacity(warming.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("cache-warming-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Warming executor initialized: core={}, max={}, queue={}",
                warming.getExecutorCorePoolSize(), warming.getExecutorMaxPoolSize(), warming.getExecutorQueueCapacity());
        return executor;
    }
}
