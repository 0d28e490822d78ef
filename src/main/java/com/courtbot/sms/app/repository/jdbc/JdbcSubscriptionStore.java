package com.courtbot.sms.app.repository.jdbc;

import com.courtbot.sms.app.exception.StoreUnavailableException;
import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.model.QueueStatus;
import com.courtbot.sms.app.model.QueuedLookup;
import com.courtbot.sms.app.model.ReminderSubscription;
import com.courtbot.sms.app.repository.SubscriptionStore;
import com.courtbot.sms.app.util.CaseSnapshotCodec;
import com.courtbot.sms.app.util.PhoneMasker;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Subscription store over the {@code queued_lookups} and {@code reminders} tables. */
@Log4j2
@Repository
public class JdbcSubscriptionStore implements SubscriptionStore {

  private static final String QUEUE_COLUMNS =
      "id, citation_text, phone, status, created_at, expires_at, matched_case, updated_at";

  private final JdbcTemplate jdbcTemplate;
  private final CaseSnapshotCodec codec;
  private final Clock clock;

  public JdbcSubscriptionStore(JdbcTemplate jdbcTemplate, CaseSnapshotCodec codec, Clock clock) {
    this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  // -------- Reminders --------

  @Override
  public ReminderSubscription createReminder(ReminderSubscription reminder) {
    Objects.requireNonNull(reminder, "reminder");
    CaseRecord snapshot = reminder.getOriginalCase();
    ReminderSubscription row =
        ReminderSubscription.builder()
            .id(reminder.getId() == null ? UUID.randomUUID().toString() : reminder.getId())
            .caseId(reminder.getCaseId() != null ? reminder.getCaseId() : snapshot.getId())
            .phone(reminder.getPhone())
            .originalCase(snapshot)
            .createdAt(reminder.getCreatedAt() == null ? clock.instant() : reminder.getCreatedAt())
            .build();
    try {
      jdbcTemplate.update(
          "INSERT INTO reminders (id, case_id, phone, original_case, created_at, sent)"
              + " VALUES (?, ?, ?, ?, ?, FALSE)",
          row.getId(),
          row.getCaseId(),
          row.getPhone(),
          codec.toJson(snapshot),
          Timestamp.from(row.getCreatedAt()));
      log.info(
          "reminders.create id={} caseId={} phone={}",
          row.getId(),
          row.getCaseId(),
          PhoneMasker.mask(row.getPhone()));
      return row;
    } catch (DuplicateKeyException e) {
      log.info(
          "reminders.create already subscribed caseId={} phone={}",
          row.getCaseId(),
          PhoneMasker.mask(row.getPhone()));
      return findReminder(row.getCaseId(), row.getPhone()).orElse(row);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to create reminder for case " + row.getCaseId(), e);
    }
  }

  public List<ReminderSubscription> listReminders(String phone) {
    try {
      return jdbcTemplate.query(
          "SELECT id, case_id, phone, original_case, created_at FROM reminders WHERE phone = ?"
              + " ORDER BY created_at",
          this::mapReminder,
          phone);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to list reminders", e);
    }
  }

  private Optional<ReminderSubscription> findReminder(String caseId, String phone) {
    List<ReminderSubscription> rows =
        jdbcTemplate.query(
            "SELECT id, case_id, phone, original_case, created_at FROM reminders"
                + " WHERE case_id = ? AND phone = ?",
            this::mapReminder,
            caseId,
            phone);
    return rows.stream().findFirst();
  }

  // -------- Queued lookups --------

  @Override
  public QueuedLookup createQueuedLookup(QueuedLookup lookup) {
    Objects.requireNonNull(lookup, "lookup");
    Instant now = clock.instant();
    QueuedLookup row =
        lookup.toBuilder()
            .id(lookup.getId() == null ? UUID.randomUUID().toString() : lookup.getId())
            .status(lookup.getStatus() == null ? QueueStatus.OFFERED : lookup.getStatus())
            .createdAt(lookup.getCreatedAt() == null ? now : lookup.getCreatedAt())
            .updatedAt(now)
            .build();
    try {
      jdbcTemplate.update(
          "INSERT INTO queued_lookups (" + QUEUE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
          row.getId(),
          row.getCitationText(),
          row.getPhone(),
          row.getStatus().name(),
          Timestamp.from(row.getCreatedAt()),
          toTimestamp(row.getExpiresAt()),
          codec.toJson(row.getMatchedCase()),
          Timestamp.from(row.getUpdatedAt()));
      log.info(
          "queue.create id={} citation={} status={} phone={}",
          row.getId(),
          row.getCitationText(),
          row.getStatus(),
          PhoneMasker.mask(row.getPhone()));
      return row;
    } catch (DataAccessException e) {
      throw new StoreUnavailableException(
          "Failed to create queued lookup for " + row.getCitationText(), e);
    }
  }

  @Override
  public Optional<QueuedLookup> findQueuedLookupBySender(String phone) {
    try {
      List<QueuedLookup> rows =
          jdbcTemplate.query(
              "SELECT "
                  + QUEUE_COLUMNS
                  + " FROM queued_lookups WHERE phone = ? AND status IN (?, ?)"
                  + " ORDER BY updated_at DESC",
              this::mapQueued,
              phone,
              QueueStatus.OFFERED.name(),
              QueueStatus.REMINDER_OFFERED.name());
      return rows.stream().findFirst();
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to look up open queue row", e);
    }
  }

  @Override
  public List<QueuedLookup> listUnresolvedQueuedLookups() {
    try {
      return jdbcTemplate.query(
          "SELECT " + QUEUE_COLUMNS + " FROM queued_lookups WHERE status = ? ORDER BY created_at",
          this::mapQueued,
          QueueStatus.ACTIVE.name());
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to list active queued lookups", e);
    }
  }

  public Optional<QueuedLookup> findQueuedLookup(String id) {
    try {
      return jdbcTemplate
          .query(
              "SELECT " + QUEUE_COLUMNS + " FROM queued_lookups WHERE id = ?",
              this::mapQueued,
              id)
          .stream()
          .findFirst();
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to read queued lookup " + id, e);
    }
  }

  @Override
  public boolean activateQueuedLookup(String id, Instant activatedAt, Instant expiresAt) {
    int n =
        update(
            "UPDATE queued_lookups SET status = ?, created_at = ?, expires_at = ?, updated_at = ?"
                + " WHERE id = ? AND status = ?",
            QueueStatus.ACTIVE.name(),
            Timestamp.from(activatedAt),
            Timestamp.from(expiresAt),
            Timestamp.from(clock.instant()),
            id,
            QueueStatus.OFFERED.name());
    log.info("queue.activate id={} expiresAt={} won={}", id, expiresAt, n == 1);
    return n == 1;
  }

  @Override
  public boolean offerReminder(String id, CaseRecord matchedCase) {
    int n =
        update(
            "UPDATE queued_lookups SET status = ?, matched_case = ?, updated_at = ?"
                + " WHERE id = ? AND status = ?",
            QueueStatus.REMINDER_OFFERED.name(),
            codec.toJson(matchedCase),
            Timestamp.from(clock.instant()),
            id,
            QueueStatus.ACTIVE.name());
    log.info("queue.offerReminder id={} caseId={} won={}", id, matchedCase.getId(), n == 1);
    return n == 1;
  }

  @Override
  public boolean resolveQueuedLookup(String id, QueueStatus expected, QueueStatus outcome) {
    int n =
        update(
            "UPDATE queued_lookups SET status = ?, updated_at = ? WHERE id = ? AND status = ?",
            outcome.name(),
            Timestamp.from(clock.instant()),
            id,
            expected.name());
    log.info("queue.resolve id={} {}->{} won={}", id, expected, outcome, n == 1);
    return n == 1;
  }

  // -------- Internals --------

  private int update(String sql, Object... args) {
    try {
      return jdbcTemplate.update(sql, args);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Queued lookup update failed", e);
    }
  }

  private QueuedLookup mapQueued(ResultSet rs, int rowNum) throws SQLException {
    return QueuedLookup.builder()
        .id(rs.getString("id"))
        .citationText(rs.getString("citation_text"))
        .phone(rs.getString("phone"))
        .status(parseStatus(rs.getString("id"), rs.getString("status")))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .expiresAt(toInstant(rs.getTimestamp("expires_at")))
        .matchedCase(codec.fromJson(rs.getString("matched_case")))
        .updatedAt(toInstant(rs.getTimestamp("updated_at")))
        .build();
  }

  private ReminderSubscription mapReminder(ResultSet rs, int rowNum) throws SQLException {
    return ReminderSubscription.builder()
        .id(rs.getString("id"))
        .caseId(rs.getString("case_id"))
        .phone(rs.getString("phone"))
        .originalCase(codec.fromJson(rs.getString("original_case")))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .build();
  }

  private static QueueStatus parseStatus(String id, String status) {
    try {
      return QueueStatus.valueOf(status);
    } catch (IllegalArgumentException e) {
      throw new StoreUnavailableException(
          "Queued lookup " + id + " has unknown status " + status, e);
    }
  }

  private static Timestamp toTimestamp(Instant i) {
    return i == null ? null : Timestamp.from(i);
  }

  private static Instant toInstant(Timestamp t) {
    return t == null ? null : t.toInstant();
  }
}
