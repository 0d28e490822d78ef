package com.courtbot.sms.app.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.courtbot.sms.app.scheduler.QueueSweepScheduler;
import com.courtbot.sms.app.service.QueueSweepService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class SchedulerConfigTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withBean(QueueSweepService.class, () -> mock(QueueSweepService.class))
          .withUserConfiguration(SchedulerConfig.class);

  @Test
  void singleSweepThread() {
    runner.run(
        context -> {
          ThreadPoolTaskScheduler scheduler = context.getBean(ThreadPoolTaskScheduler.class);
          assertThat(scheduler.getPoolSize()).isEqualTo(1);
          assertThat(scheduler.getThreadNamePrefix()).isEqualTo("queue-sweep-");
          assertThat(context).doesNotHaveBean(QueueSweepScheduler.class);
        });
  }

  @Test
  void sweepTriggerOnlyWhenEnabled() {
    runner
        .withPropertyValues("courtbot.sweep.enabled=true")
        .run(context -> assertThat(context).hasSingleBean(QueueSweepScheduler.class));
  }
}
