package com.courtbot.sms.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-sender dialogue state, keyed by phone number.
 *
 * <p>Overwritten on every handled message and never deleted; a stale entry is simply superseded by
 * the next one. {@code matchedCase} is a snapshot taken when the question was asked.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationState {

  private String phone;

  @Builder.Default private PendingQuestion pendingQuestion = PendingQuestion.NONE;

  /** Case offered for a reminder; set only while awaiting a reminder answer. */
  private CaseRecord matchedCase;

  /** Citation offered for queueing; set only while awaiting a queue answer. */
  private String pendingCitationText;

  /** Queue row backing the pending question, when there is one. */
  private String queuedLookupId;

  /** Optimistic version used by persistent repositories. */
  private Long version;

  private Instant updatedAt;

  public static ConversationState idle(String phone) {
    return ConversationState.builder().phone(phone).pendingQuestion(PendingQuestion.NONE).build();
  }

  public boolean isIdle() {
    return pendingQuestion == null || pendingQuestion == PendingQuestion.NONE;
  }

  /** Same sender and version, with the pending question cleared. */
  public ConversationState toIdle() {
    return toBuilder()
        .pendingQuestion(PendingQuestion.NONE)
        .matchedCase(null)
        .pendingCitationText(null)
        .queuedLookupId(null)
        .build();
  }
}
