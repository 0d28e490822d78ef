package com.courtbot.sms.app.service;

import com.courtbot.sms.app.config.CourtbotProperties;
import com.courtbot.sms.app.exception.NotificationDeliveryException;
import com.courtbot.sms.app.util.PhoneMasker;
import com.courtbot.sms.app.util.SmsSegmenter;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/** Sends texts through the Twilio Messages REST API, one request per segment. */
@Log4j2
public class TwilioSmsSender implements NotificationSender {

  private final WebClient webClient;
  private final CourtbotProperties.Twilio twilio;
  private final SmsSegmenter segmenter;
  private final Duration timeout;

  public TwilioSmsSender(
      WebClient.Builder builder, CourtbotProperties props, SmsSegmenter segmenter) {
    this.twilio = props.getTwilio();
    Objects.requireNonNull(twilio.getAccountSid(), "courtbot.twilio.account-sid must be set");
    Objects.requireNonNull(twilio.getAuthToken(), "courtbot.twilio.auth-token must be set");
    Objects.requireNonNull(twilio.getFromNumber(), "courtbot.twilio.from-number must be set");
    this.webClient = builder.baseUrl(twilio.getBaseUrl()).build();
    this.segmenter = segmenter;
    this.timeout = props.getStoreTimeout();
  }

  @Override
  public void send(String phone, String text) {
    for (String part : segmenter.split(text)) {
      try {
        webClient
            .post()
            .uri("/2010-04-01/Accounts/{sid}/Messages.json", twilio.getAccountSid())
            .headers(h -> h.setBasicAuth(twilio.getAccountSid(), twilio.getAuthToken()))
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(
                BodyInserters.fromFormData("To", phone)
                    .with("From", twilio.getFromNumber())
                    .with("Body", part))
            .retrieve()
            .toBodilessEntity()
            .doOnError(e -> log.error("Twilio API call failed", e))
            .block(timeout);
      } catch (RuntimeException e) {
        throw new NotificationDeliveryException(
            "SMS delivery to " + PhoneMasker.mask(phone) + " failed", e);
      }
      log.info("notify.sent phone={} chars={}", PhoneMasker.mask(phone), part.length());
    }
  }
}
