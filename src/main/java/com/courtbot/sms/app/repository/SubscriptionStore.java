package com.courtbot.sms.app.repository;

import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.model.QueueStatus;
import com.courtbot.sms.app.model.QueuedLookup;
import com.courtbot.sms.app.model.ReminderSubscription;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reminder and queued-lookup persistence.
 *
 * <p>All status changes on queued lookups are conditional on the expected current status and
 * report whether they won, so concurrent writers (an inbound answer and a sweep) never both move
 * the same row.
 */
public interface SubscriptionStore {

  /** Stores a reminder; an existing reminder for the same case and phone is kept as is. */
  ReminderSubscription createReminder(ReminderSubscription reminder);

  QueuedLookup createQueuedLookup(QueuedLookup lookup);

  /** Latest row for {@code phone} that still carries an unanswered question. */
  Optional<QueuedLookup> findQueuedLookupBySender(String phone);

  /** Accepted rows the sweep still has to check. */
  List<QueuedLookup> listUnresolvedQueuedLookups();

  /** OFFERED -> ACTIVE, starting the TTL window. */
  boolean activateQueuedLookup(String id, Instant activatedAt, Instant expiresAt);

  /** ACTIVE -> REMINDER_OFFERED, recording the case the sweep found. */
  boolean offerReminder(String id, CaseRecord matchedCase);

  /** {@code expected} -> {@code outcome}. */
  boolean resolveQueuedLookup(String id, QueueStatus expected, QueueStatus outcome);
}
