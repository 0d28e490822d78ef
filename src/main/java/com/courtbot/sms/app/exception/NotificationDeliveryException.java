package com.courtbot.sms.app.exception;

/** An outbound SMS could not be handed to the transport. */
public class NotificationDeliveryException extends RuntimeException {

  public NotificationDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
