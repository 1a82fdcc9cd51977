package com.netintel.wigle.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Background worker for export runs. One thread, with room for a single queued task so a
 * run submitted while the previous one is still unwinding on the worker is not rejected.
 * {@link com.netintel.wigle.run.RunExecutor} enforces one active run.
 */
@Configuration
@Slf4j
public class ExecutionConfig {

    private ThreadPoolTaskExecutor runExecutor;

    @Bean(name = "runTaskExecutor")
    public ThreadPoolTaskExecutor runTaskExecutor() {
        runExecutor = new ThreadPoolTaskExecutor();
        runExecutor.setCorePoolSize(1);
        runExecutor.setMaxPoolSize(1);
        runExecutor.setQueueCapacity(1);
        runExecutor.setThreadNamePrefix("wigle-run-");
        runExecutor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        runExecutor.setWaitForTasksToCompleteOnShutdown(true);
        runExecutor.setAwaitTerminationSeconds(30);
        runExecutor.initialize();
        log.info("Initialized run executor - workers: 1, queueCapacity: 1");
        return runExecutor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Lets an in-flight run finish its current page and export before the JVM exits.
     */
    @PreDestroy
    public void shutdown() {
        if (runExecutor == null) {
            return;
        }
        ThreadPoolExecutor executor = runExecutor.getThreadPoolExecutor();
        log.info("Shutting down run executor - active runs: {}", executor.getActiveCount());
        executor.shutdown();
        try {
            if (!executor.awaitTermination(45, TimeUnit.SECONDS)) {
                log.warn("Run did not finish within 45 seconds, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Shutdown interrupted, forcing immediate termination");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
