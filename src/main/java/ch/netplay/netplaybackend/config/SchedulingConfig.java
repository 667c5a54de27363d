package ch.netplay.netplaybackend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for task scheduling.
 *
 * <p>Provides the {@link TaskScheduler} that runs {@code @Scheduled} methods
 * (the room reaper). Also used by the STOMP broker for heartbeats.
 */
@Configuration
public class SchedulingConfig {

    /**
     * Pool of 2 threads named "netplay-scheduler-": one for the reaper, one spare for
     * broker heartbeats so a long sweep never delays them.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("netplay-scheduler-");
        scheduler.initialize();
        return scheduler;
    }
}
