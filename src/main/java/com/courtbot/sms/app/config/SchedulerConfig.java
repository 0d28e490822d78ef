package com.courtbot.sms.app.config;

import com.courtbot.sms.app.scheduler.QueueSweepScheduler;
import com.courtbot.sms.app.service.QueueSweepService;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Log4j2
@Configuration
@EnableScheduling
public class SchedulerConfig {

  /** Seconds a shutdown waits for a sweep that is already running. */
  @Value("${courtbot.sweep.shutdown-grace-seconds:60}")
  private int shutdownGraceSeconds;

  /**
   * The only scheduled job is the daily queue sweep, so one thread is enough; a run that overlaps
   * the next trigger simply delays it. Inbound messages never run here.
   */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("queue-sweep-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setErrorHandler(t -> log.error("scheduler.uncaught job=queue-sweep", t));
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(shutdownGraceSeconds);
    scheduler.initialize();
    log.info("scheduler.ready threads=1 shutdownGraceSeconds={}", shutdownGraceSeconds);
    return scheduler;
  }

  @Bean
  @ConditionalOnProperty(prefix = "courtbot.sweep", name = "enabled", havingValue = "true")
  public QueueSweepScheduler queueSweepScheduler(QueueSweepService sweepService) {
    return new QueueSweepScheduler(sweepService);
  }
}
