package com.courtbot.sms.app.service;

import com.courtbot.sms.app.config.CourtbotProperties;
import com.courtbot.sms.app.config.CourtbotProperties.ExpiryPolicy;
import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.model.QueueStatus;
import com.courtbot.sms.app.model.QueuedLookup;
import com.courtbot.sms.app.model.SweepReport;
import com.courtbot.sms.app.repository.SubscriptionStore;
import com.courtbot.sms.app.util.PhoneMasker;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Checks every accepted queued lookup against the citation store.
 *
 * <p>Found: text the sender a reminder offer, then move the row to REMINDER_OFFERED. Expired: text
 * an expiry notice (unless the policy is DROP), then move the row to EXPIRED. Otherwise leave it
 * for the next run. Every entry is handled on its own: a failed delivery leaves that row ACTIVE for
 * a retry and the sweep moves on. The sweep never touches conversation state or sender locks.
 */
@Log4j2
public class QueueSweepService {

  private enum Outcome {
    FOUND,
    EXPIRED,
    PENDING
  }

  private final SubscriptionStore subscriptions;
  private final CitationMatcher matcher;
  private final NotificationSender sender;
  private final ReplyTemplates templates;
  private final ExpiryPolicy expiryPolicy;
  private final Clock clock;

  public QueueSweepService(
      SubscriptionStore subscriptions,
      CitationMatcher matcher,
      NotificationSender sender,
      ReplyTemplates templates,
      CourtbotProperties props,
      Clock clock) {
    this.subscriptions = subscriptions;
    this.matcher = matcher;
    this.sender = sender;
    this.templates = templates;
    this.expiryPolicy = props.getExpiryPolicy();
    this.clock = clock;
  }

  public SweepReport sweep() {
    Instant now = clock.instant();
    List<QueuedLookup> rows = subscriptions.listUnresolvedQueuedLookups();
    log.info("sweep.start active={} now={} expiryPolicy={}", rows.size(), now, expiryPolicy);

    SweepReport report = SweepReport.builder().checked(rows.size()).build();
    for (QueuedLookup row : rows) {
      try {
        switch (process(row, now)) {
          case FOUND:
            report.setFound(report.getFound() + 1);
            break;
          case EXPIRED:
            report.setExpired(report.getExpired() + 1);
            break;
          default:
            report.setPending(report.getPending() + 1);
        }
      } catch (RuntimeException ex) {
        report.setFailed(report.getFailed() + 1);
        log.error(
            "sweep.error queueId={} citation={} msg={}",
            row.getId(),
            row.getCitationText(),
            ex.getMessage(),
            ex);
      }
    }

    log.info(
        "sweep.finish checked={} found={} expired={} pending={} failed={}",
        report.getChecked(),
        report.getFound(),
        report.getExpired(),
        report.getPending(),
        report.getFailed());
    return report;
  }

  private Outcome process(QueuedLookup row, Instant now) {
    Optional<CaseRecord> match = matcher.uniqueMatch(row.getCitationText());
    if (match.isPresent()) {
      CaseRecord snapshot = match.get().snapshot();
      sender.send(row.getPhone(), templates.queuedCaseFound(snapshot));
      if (!subscriptions.offerReminder(row.getId(), snapshot)) {
        log.warn("sweep.found row already moved queueId={}", row.getId());
      }
      log.info(
          "sweep.found queueId={} caseId={} phone={}",
          row.getId(),
          snapshot.getId(),
          PhoneMasker.mask(row.getPhone()));
      return Outcome.FOUND;
    }

    if (row.isExpiredAt(now)) {
      if (expiryPolicy == ExpiryPolicy.NOTIFY) {
        sender.send(row.getPhone(), templates.queueExpired(row.getCitationText()));
      }
      subscriptions.resolveQueuedLookup(row.getId(), QueueStatus.ACTIVE, QueueStatus.EXPIRED);
      log.info(
          "sweep.expired queueId={} expiresAt={} notified={}",
          row.getId(),
          row.getExpiresAt(),
          expiryPolicy == ExpiryPolicy.NOTIFY);
      return Outcome.EXPIRED;
    }

    return Outcome.PENDING;
  }
}
