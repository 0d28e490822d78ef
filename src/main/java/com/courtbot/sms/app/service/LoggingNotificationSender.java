package com.courtbot.sms.app.service;

import com.courtbot.sms.app.util.PhoneMasker;
import com.courtbot.sms.app.util.SmsSegmenter;
import lombok.extern.log4j.Log4j2;

/** Used when no SMS transport is configured: records what would have been sent. */
@Log4j2
public class LoggingNotificationSender implements NotificationSender {

  private final SmsSegmenter segmenter;

  public LoggingNotificationSender(SmsSegmenter segmenter) {
    this.segmenter = segmenter;
  }

  @Override
  public void send(String phone, String text) {
    for (String part : segmenter.split(text)) {
      log.info("notify.log phone={} text={}", PhoneMasker.mask(phone), part);
    }
  }
}
