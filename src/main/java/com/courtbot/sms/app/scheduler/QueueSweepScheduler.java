package com.courtbot.sms.app.scheduler;

import com.courtbot.sms.app.model.SweepReport;
import com.courtbot.sms.app.service.QueueSweepService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;

/** Runs the queued-lookup sweep on the configured cron (daily by default). */
@Log4j2
@RequiredArgsConstructor
public class QueueSweepScheduler {

  private final QueueSweepService sweepService;

  @Scheduled(cron = "${courtbot.sweep.cron:0 0 10 * * *}", zone = "${courtbot.sweep.zone:UTC}")
  public void sweepQueuedLookups() {
    log.info("scheduler.start job=queue-sweep");
    try {
      SweepReport report = sweepService.sweep();
      log.info(
          "scheduler.finish job=queue-sweep found={} expired={} failed={}",
          report.getFound(),
          report.getExpired(),
          report.getFailed());
    } catch (RuntimeException ex) {
      // Listing failed; the next scheduled run retries.
      log.error("scheduler.error job=queue-sweep msg={}", ex.getMessage(), ex);
    }
  }
}
