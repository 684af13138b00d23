package com.securityops.coordination.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Time sources and thread pools.
 *
 * - clock: every timestamp the engine assigns comes from here (tests swap in a controllable clock)
 * - taskScheduler: escalation timers plus all @Scheduled sweeps and refreshes
 * - auditExecutor: background persistence writes and their retry back-off
 *
 * The scheduler is declared explicitly because the STOMP broker registers its own
 * TaskScheduler, which would otherwise stop Spring Boot from creating the default one.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(
            @Value("${coordination.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("coordination-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService auditExecutor(CoordinationProperties properties) {
        return Executors.newScheduledThreadPool(
                properties.getAudit().getWorkerThreads(),
                new CustomizableThreadFactory("audit-writer-"));
    }
}
