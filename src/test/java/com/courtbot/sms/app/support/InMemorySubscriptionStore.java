package com.courtbot.sms.app.support;

import com.courtbot.sms.app.exception.StoreUnavailableException;
import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.model.QueueStatus;
import com.courtbot.sms.app.model.QueuedLookup;
import com.courtbot.sms.app.model.ReminderSubscription;
import com.courtbot.sms.app.repository.SubscriptionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

public class InMemorySubscriptionStore implements SubscriptionStore {

  private final Map<String, QueuedLookup> queue = new LinkedHashMap<>();
  private final List<ReminderSubscription> reminders = new ArrayList<>();
  private final Clock clock;
  private volatile boolean failQueueWrites;

  public InMemorySubscriptionStore(Clock clock) {
    this.clock = clock;
  }

  public void setFailQueueWrites(boolean fail) {
    this.failQueueWrites = fail;
  }

  public synchronized List<ReminderSubscription> reminders() {
    return new ArrayList<>(reminders);
  }

  public synchronized List<QueuedLookup> queuedLookups() {
    return new ArrayList<>(queue.values());
  }

  public synchronized QueuedLookup queuedLookup(String id) {
    return queue.get(id);
  }

  @Override
  public synchronized ReminderSubscription createReminder(ReminderSubscription reminder) {
    ReminderSubscription row =
        ReminderSubscription.builder()
            .id(UUID.randomUUID().toString())
            .caseId(reminder.getCaseId())
            .phone(reminder.getPhone())
            .originalCase(reminder.getOriginalCase())
            .createdAt(clock.instant())
            .build();
    reminders.add(row);
    return row;
  }

  @Override
  public synchronized QueuedLookup createQueuedLookup(QueuedLookup lookup) {
    if (failQueueWrites) throw new StoreUnavailableException("queue table down");
    Instant now = clock.instant();
    QueuedLookup row =
        lookup.toBuilder()
            .id(UUID.randomUUID().toString())
            .createdAt(lookup.getCreatedAt() == null ? now : lookup.getCreatedAt())
            .updatedAt(now)
            .build();
    queue.put(row.getId(), row);
    return row;
  }

  @Override
  public synchronized Optional<QueuedLookup> findQueuedLookupBySender(String phone) {
    return queue.values().stream()
        .filter(q -> q.getPhone().equals(phone) && q.getStatus().awaitsAnswer())
        .max(Comparator.comparing(QueuedLookup::getUpdatedAt));
  }

  @Override
  public synchronized List<QueuedLookup> listUnresolvedQueuedLookups() {
    return queue.values().stream()
        .filter(q -> q.getStatus() == QueueStatus.ACTIVE)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized boolean activateQueuedLookup(
      String id, Instant activatedAt, Instant expiresAt) {
    if (failQueueWrites) throw new StoreUnavailableException("queue table down");
    QueuedLookup row = queue.get(id);
    if (row == null || row.getStatus() != QueueStatus.OFFERED) return false;
    queue.put(
        id,
        row.toBuilder()
            .status(QueueStatus.ACTIVE)
            .createdAt(activatedAt)
            .expiresAt(expiresAt)
            .updatedAt(clock.instant())
            .build());
    return true;
  }

  @Override
  public synchronized boolean offerReminder(String id, CaseRecord matchedCase) {
    QueuedLookup row = queue.get(id);
    if (row == null || row.getStatus() != QueueStatus.ACTIVE) return false;
    queue.put(
        id,
        row.toBuilder()
            .status(QueueStatus.REMINDER_OFFERED)
            .matchedCase(matchedCase)
            .updatedAt(clock.instant())
            .build());
    return true;
  }

  @Override
  public synchronized boolean resolveQueuedLookup(
      String id, QueueStatus expected, QueueStatus outcome) {
    QueuedLookup row = queue.get(id);
    if (row == null || row.getStatus() != expected) return false;
    queue.put(id, row.toBuilder().status(outcome).updatedAt(clock.instant()).build());
    return true;
  }
}
