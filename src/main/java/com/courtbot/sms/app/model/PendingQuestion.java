package com.courtbot.sms.app.model;

/** Question, if any, that the next inbound message from a sender is expected to answer. */
public enum PendingQuestion {
  NONE,
  AWAITING_REMINDER_CONFIRM,
  AWAITING_QUEUE_CONFIRM
}
