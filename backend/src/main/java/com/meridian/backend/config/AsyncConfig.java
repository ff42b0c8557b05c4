package com.meridian.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AsyncConfig {

    /**
     * One pipeline run per symbol per tick. Sized by configuration, never by symbol count,
     * so the upstream rate limits hold however many symbols are tracked.
     */
    @Bean(name = "signalWorkerExecutor")
    public ThreadPoolTaskExecutor signalWorkerExecutor(SchedulerProperties schedulerProperties) {
        int poolSize = schedulerProperties.getWorkerPoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(schedulerProperties.getQueueCapacity());
        executor.setThreadNamePrefix("signal-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "marketDataExecutor")
    public ThreadPoolTaskExecutor marketDataExecutor(SchedulerProperties schedulerProperties) {
        int poolSize = schedulerProperties.getWorkerPoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(250);
        executor.setThreadNamePrefix("market-data-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "inferenceExecutor")
    public ThreadPoolTaskExecutor inferenceExecutor(SchedulerProperties schedulerProperties) {
        int poolSize = schedulerProperties.getWorkerPoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(250);
        executor.setThreadNamePrefix("inference-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "persistenceExecutor")
    public ThreadPoolTaskExecutor persistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("persistence-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * Drives {@code @Scheduled} ticks and the run watchdog that cancels overrunning runs.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("meridian-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
