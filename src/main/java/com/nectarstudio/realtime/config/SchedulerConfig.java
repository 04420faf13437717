package com.nectarstudio.realtime.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools: one scheduler shared by all polling jobs (also used for {@code @Scheduled}),
 * and one executor draining channel outboxes so slow connections never hold up polling.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean(name = {"pollingTaskScheduler", "taskScheduler"})
    public ThreadPoolTaskScheduler pollingTaskScheduler(RealtimeProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("poll-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("❌ Unhandled error in scheduled task", t));
        log.info("Polling scheduler with {} threads", properties.getSchedulerPoolSize());
        return scheduler;
    }

    @Bean(name = "deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor(RealtimeProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDeliveryPoolSize());
        executor.setMaxPoolSize(properties.getDeliveryPoolSize());
        executor.setThreadNamePrefix("deliver-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
