package com.eyelevel.uploadqueue.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Configures the managed thread pool that drives poll timers and transfer callbacks. The pool is exposed
 * to Reactor as a {@link Scheduler}, which is also the single source of "now" for the upload queue.
 */
@Configuration
public class UploadSchedulerConfig {

    private static final int POOL_SIZE = 4;

    @Bean(name = "uploadTaskScheduler")
    public ThreadPoolTaskScheduler uploadTaskScheduler() {
        ThreadPoolTaskScheduler taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(POOL_SIZE);
        taskScheduler.setThreadNamePrefix("upload-queue-");
        taskScheduler.setRemoveOnCancelPolicy(true);
        return taskScheduler;
    }

    @Bean(name = "uploadQueueScheduler", destroyMethod = "dispose")
    public Scheduler uploadQueueScheduler(@Qualifier("uploadTaskScheduler") ThreadPoolTaskScheduler taskScheduler) {
        return Schedulers.fromExecutorService(taskScheduler.getScheduledExecutor(), "upload-queue");
    }
}
