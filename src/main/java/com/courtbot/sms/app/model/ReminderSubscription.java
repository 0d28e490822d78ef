package com.courtbot.sms.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One-time day-before reminder for a matched case. Consumed by the reminder notifier. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReminderSubscription {

  private String id;

  private String caseId;

  private String phone;

  /** Case as it looked when the sender subscribed. */
  private CaseRecord originalCase;

  private Instant createdAt;
}
