package com.uchion.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for oracle calls (judges, fixer, re-verification). Calls block on network I/O,
 * so the pool is sized for concurrent batches rather than CPU count. A full pool rejects
 * new calls; the pipeline reports them as unavailable.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Value("${async.judges.core-pool-size:6}")
    private int corePoolSize;

    @Value("${async.judges.max-pool-size:12}")
    private int maxPoolSize;

    @Value("${async.judges.queue-capacity:50}")
    private int queueCapacity;

    @Value("${async.judges.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    @Bean(name = "judgeExecutor")
    public ThreadPoolTaskExecutor judgeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(keepAliveSeconds);
        executor.setThreadNamePrefix("judge-");
        // rejected calls must fail fast so no oracle call escapes the timeout
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Judge executor configured: core={}, max={}, queue={}", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
