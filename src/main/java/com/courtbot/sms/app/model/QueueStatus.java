package com.courtbot.sms.app.model;

/** Life cycle of a queued lookup row. */
public enum QueueStatus {
  /** Keep-checking offer sent; waiting for YES or NO. */
  OFFERED,
  /** Accepted; checked by every sweep until found or expired. */
  ACTIVE,
  /** Sweep found the case and offered a reminder; waiting for YES or NO. */
  REMINDER_OFFERED,
  FOUND,
  EXPIRED,
  DECLINED;

  /** True while the row still carries a question for its sender. */
  public boolean awaitsAnswer() {
    return this == OFFERED || this == REMINDER_OFFERED;
  }
}
