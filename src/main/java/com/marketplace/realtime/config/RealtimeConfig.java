package com.marketplace.realtime.config;

import com.marketplace.realtime.scheduling.DelayScheduler;
import com.marketplace.realtime.scheduling.TaskSchedulerDelayScheduler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({RealtimeProperties.class, ExpirationProperties.class, CronProperties.class})
public class RealtimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("realtime-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public DelayScheduler delayScheduler(ThreadPoolTaskScheduler taskScheduler, Clock clock) {
        return new TaskSchedulerDelayScheduler(taskScheduler, clock);
    }
}
