package com.microservices.processor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for submitted processing jobs.
 * <p>
 * The pool is bounded on both threads and queued tasks. Once both are exhausted
 * new submissions are rejected with a {@link org.springframework.core.task.TaskRejectedException}
 * instead of being run on the request thread.
 */
@Configuration
public class AsyncConfig {

    public static final String JOB_EXECUTOR = "jobExecutor";

    @Value("${processor.jobs.core-pool-size:4}")
    private int corePoolSize;

    @Value("${processor.jobs.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${processor.jobs.queue-capacity:100}")
    private int queueCapacity;

    @Value("${processor.jobs.thread-name-prefix:job-worker-}")
    private String threadNamePrefix;

    @Bean(name = JOB_EXECUTOR)
    public TaskExecutor jobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
