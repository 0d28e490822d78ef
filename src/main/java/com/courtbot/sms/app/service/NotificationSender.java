package com.courtbot.sms.app.service;

/** Side channel for texts that are not a direct reply to an inbound message. */
public interface NotificationSender {

  /**
   * Delivers {@code text} to {@code phone}, split into transport-sized parts as needed.
   *
   * @throws com.courtbot.sms.app.exception.NotificationDeliveryException if the transport rejects
   *     or does not answer in time
   */
  void send(String phone, String text);
}
