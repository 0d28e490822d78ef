package com.courtbot.sms.app.service;

import static org.junit.jupiter.api.Assertions.*;

import com.courtbot.sms.app.config.CourtbotProperties;
import com.courtbot.sms.app.config.CourtbotProperties.ExpiryPolicy;
import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.model.QueueStatus;
import com.courtbot.sms.app.model.QueuedLookup;
import com.courtbot.sms.app.model.SweepReport;
import com.courtbot.sms.app.support.InMemoryCitationStore;
import com.courtbot.sms.app.support.InMemorySubscriptionStore;
import com.courtbot.sms.app.support.MutableClock;
import com.courtbot.sms.app.support.RecordingNotificationSender;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueueSweepServiceTest {

  private MutableClock clock;
  private InMemoryCitationStore citations;
  private InMemorySubscriptionStore subscriptions;
  private RecordingNotificationSender sender;
  private CourtbotProperties props;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    citations = new InMemoryCitationStore();
    subscriptions = new InMemorySubscriptionStore(clock);
    sender = new RecordingNotificationSender();
    props = new CourtbotProperties();
    props.setQueueTtlDays(10);
    props.setCourtPublicUrl("https://courts.test");
  }

  private QueueSweepService sweeper() {
    return new QueueSweepService(
        subscriptions,
        new CitationMatcher(citations, props),
        sender,
        new ReplyTemplates(props),
        props,
        clock);
  }

  private QueuedLookup queue(String citation, String phone) {
    return subscriptions.createQueuedLookup(
        QueuedLookup.builder()
            .citationText(citation)
            .phone(phone)
            .status(QueueStatus.ACTIVE)
            .createdAt(clock.instant())
            .expiresAt(clock.instant().plus(Duration.ofDays(props.getQueueTtlDays())))
            .build());
  }

  private static CaseRecord caseFor(String citation) {
    return CaseRecord.builder()
        .id("case-" + citation)
        .citation(citation)
        .defendant("JANE ROE")
        .date(LocalDate.of(2024, 3, 12))
        .time("09:00")
        .room("3B")
        .build();
  }

  @Test
  void foundCaseIsTextedAndRowAwaitsReminderAnswer() {
    QueuedLookup row = queue("ABC123", "+15550000001");
    citations.add(caseFor("ABC123"));

    SweepReport report = sweeper().sweep();

    assertEquals(1, report.getFound());
    assertEquals(1, sender.sent().size());
    assertEquals("+15550000001", sender.sent().get(0).phone);
    assertEquals(
        "Hello from Courtbot. We found a case for Jane Roe scheduled on Tue, Mar 12th at 9:00 AM,"
            + " at 3B. Would you like a courtesy reminder the day before? (reply YES or NO)",
        sender.sent().get(0).text);
    QueuedLookup after = subscriptions.queuedLookup(row.getId());
    assertEquals(QueueStatus.REMINDER_OFFERED, after.getStatus());
    assertEquals("case-ABC123", after.getMatchedCase().getId());
    assertTrue(subscriptions.listUnresolvedQueuedLookups().isEmpty());
  }

  @Test
  void unmatchedLookupExpiresExactlyOnceAfterTtl() {
    QueuedLookup row = queue("NOPE0001", "+15550000002");
    QueueSweepService sweeper = sweeper();

    for (int day = 1; day <= 10; day++) {
      clock.advance(Duration.ofDays(1));
      if (day == 10) {
        // Exactly at the expiry instant the row is still live.
        SweepReport atExpiry = sweeper.sweep();
        assertEquals(1, atExpiry.getPending());
      } else {
        assertEquals(0, sweeper.sweep().getExpired());
      }
      assertEquals(QueueStatus.ACTIVE, subscriptions.queuedLookup(row.getId()).getStatus());
    }
    assertTrue(sender.sent().isEmpty());

    clock.advance(Duration.ofMinutes(1));
    SweepReport report = sweeper.sweep();

    assertEquals(1, report.getExpired());
    assertEquals(QueueStatus.EXPIRED, subscriptions.queuedLookup(row.getId()).getStatus());
    assertEquals(1, sender.sent().size());
    assertTrue(sender.sent().get(0).text.contains("NOPE0001"));

    clock.advance(Duration.ofDays(1));
    SweepReport later = sweeper.sweep();
    assertEquals(0, later.getChecked());
    assertEquals(1, sender.sent().size());
  }

  @Test
  void dropPolicyExpiresWithoutTexting() {
    props.setExpiryPolicy(ExpiryPolicy.DROP);
    QueuedLookup row = queue("NOPE0002", "+15550000003");
    clock.advance(Duration.ofDays(11));

    SweepReport report = sweeper().sweep();

    assertEquals(1, report.getExpired());
    assertTrue(sender.sent().isEmpty());
    assertEquals(QueueStatus.EXPIRED, subscriptions.queuedLookup(row.getId()).getStatus());
  }

  @Test
  void ambiguousMatchKeepsWaiting() {
    QueuedLookup row = queue("DUP12345", "+15550000004");
    citations.add(caseFor("DUP12345"));
    citations.add(caseFor("DUP12345").toBuilder().id("other").build());

    SweepReport report = sweeper().sweep();

    assertEquals(1, report.getPending());
    assertEquals(QueueStatus.ACTIVE, subscriptions.queuedLookup(row.getId()).getStatus());
  }

  @Test
  void deliveryFailureLeavesRowForRetryAndDoesNotStopOthers() {
    QueuedLookup failing = queue("ABC123", "+15550000005");
    QueuedLookup fine = queue("XYZ789", "+15550000006");
    citations.add(caseFor("ABC123"));
    citations.add(caseFor("XYZ789"));
    sender.failFor("+15550000005");

    SweepReport first = sweeper().sweep();

    assertEquals(1, first.getFailed());
    assertEquals(1, first.getFound());
    assertEquals(QueueStatus.ACTIVE, subscriptions.queuedLookup(failing.getId()).getStatus());
    assertEquals(QueueStatus.REMINDER_OFFERED, subscriptions.queuedLookup(fine.getId()).getStatus());

    sender.recover("+15550000005");
    SweepReport retry = sweeper().sweep();

    assertEquals(1, retry.getChecked());
    assertEquals(1, retry.getFound());
    assertEquals(
        QueueStatus.REMINDER_OFFERED, subscriptions.queuedLookup(failing.getId()).getStatus());
  }

  @Test
  void offeredButUnacceptedRowsAreNotSwept() {
    subscriptions.createQueuedLookup(
        QueuedLookup.builder()
            .citationText("ABC123")
            .phone("+15550000007")
            .status(QueueStatus.OFFERED)
            .build());
    citations.add(caseFor("ABC123"));

    SweepReport report = sweeper().sweep();

    assertEquals(0, report.getChecked());
    assertTrue(sender.sent().isEmpty());
  }
}
