package com.scholary.placeholdarr.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the monitoring scheduler.
 *
 * <p>One small scheduler runs the recurring poll cycle and the one-shot cleanup actions. Request
 * threads never perform backend I/O.
 */
@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class SchedulerConfig {

  @Bean(name = "monitorScheduler")
  public ThreadPoolTaskScheduler monitorScheduler(MonitorProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.schedulerThreads());
    scheduler.setThreadNamePrefix("monitor-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.initialize();
    return scheduler;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
