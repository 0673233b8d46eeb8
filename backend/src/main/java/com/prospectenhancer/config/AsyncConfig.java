package com.prospectenhancer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: the iterative worker, the queued-job monitor and the job queue drain loop.
 * Each is single-threaded so at most one of each runs per process.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ENHANCEMENT_WORKER_EXECUTOR = "enhancement-worker-executor";
    public static final String QUEUE_MONITOR_EXECUTOR = "queue-monitor-executor";
    public static final String JOB_QUEUE_EXECUTOR = "job-queue-executor";

    @Bean(name = ENHANCEMENT_WORKER_EXECUTOR)
    public Executor enhancementWorkerExecutor() {
        return singleThread("enhance-worker-");
    }

    @Bean(name = QUEUE_MONITOR_EXECUTOR)
    public Executor queueMonitorExecutor() {
        return singleThread("queue-monitor-");
    }

    @Bean(name = JOB_QUEUE_EXECUTOR)
    public Executor jobQueueExecutor() {
        return singleThread("job-queue-");
    }

    private static Executor singleThread(String prefix) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix(prefix);
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }
}
