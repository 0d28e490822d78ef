package com.courtbot.sms.app.exception;

/** A backing store call failed, timed out or lost an optimistic-version race. */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public StoreUnavailableException(String message) {
    super(message);
  }
}
