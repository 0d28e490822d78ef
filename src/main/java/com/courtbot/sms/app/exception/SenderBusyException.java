package com.courtbot.sms.app.exception;

/** Another message from the same sender held the dialogue lock for longer than allowed. */
public class SenderBusyException extends RuntimeException {

  public SenderBusyException(String message) {
    super(message);
  }
}
