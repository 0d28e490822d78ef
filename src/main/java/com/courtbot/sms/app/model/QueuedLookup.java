package com.courtbot.sms.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A standing request to notify {@code phone} once a case matching {@code citationText} appears,
 * until {@code expiresAt}.
 *
 * <p>The row is written when the keep-checking offer is made ({@link QueueStatus#OFFERED}) so that
 * the open question survives a restart; accepting the offer activates it and starts the TTL.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueuedLookup {

  private String id;

  private String citationText;

  private String phone;

  private QueueStatus status;

  private Instant createdAt;

  /** createdAt + TTL days; set on activation. */
  private Instant expiresAt;

  /** Snapshot of the case the sweep found, once found. */
  private CaseRecord matchedCase;

  private Instant updatedAt;

  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && now.isAfter(expiresAt);
  }
}
