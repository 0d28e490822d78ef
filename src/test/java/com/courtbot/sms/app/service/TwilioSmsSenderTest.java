package com.courtbot.sms.app.service;

import static org.junit.jupiter.api.Assertions.*;

import com.courtbot.sms.app.config.CourtbotProperties;
import com.courtbot.sms.app.exception.NotificationDeliveryException;
import com.courtbot.sms.app.util.SmsSegmenter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class TwilioSmsSenderTest {

  private final List<ClientRequest> requests = new ArrayList<>();
  private CourtbotProperties props;
  private HttpStatus status;

  @BeforeEach
  void setUp() {
    props = new CourtbotProperties();
    props.getTwilio().setEnabled(true);
    props.getTwilio().setBaseUrl("https://twilio.test");
    props.getTwilio().setAccountSid("AC123");
    props.getTwilio().setAuthToken("secret");
    props.getTwilio().setFromNumber("+15550009999");
    status = HttpStatus.CREATED;
  }

  private TwilioSmsSender sender(int segmentLimit) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  requests.add(request);
                  return Mono.just(ClientResponse.create(status).build());
                });
    return new TwilioSmsSender(builder, props, new SmsSegmenter(segmentLimit));
  }

  @Test
  void postsToAccountMessagesWithBasicAuth() {
    sender(1600).send("+15551112222", "Your case was found.");

    assertEquals(1, requests.size());
    ClientRequest req = requests.get(0);
    assertEquals(HttpMethod.POST, req.method());
    assertEquals("https://twilio.test/2010-04-01/Accounts/AC123/Messages.json", req.url().toString());
    String expectedAuth =
        "Basic "
            + Base64.getEncoder().encodeToString("AC123:secret".getBytes(StandardCharsets.UTF_8));
    assertEquals(expectedAuth, req.headers().getFirst(HttpHeaders.AUTHORIZATION));
  }

  @Test
  void longTextIsSentAsOneRequestPerSegment() {
    sender(40).send("+15551112222", "word ".repeat(30).trim());

    assertTrue(requests.size() > 1);
  }

  @Test
  void providerErrorIsDeliveryFailure() {
    status = HttpStatus.BAD_REQUEST;

    assertThrows(
        NotificationDeliveryException.class, () -> sender(1600).send("+15551112222", "hello"));
  }

  @Test
  void missingCredentialsAreRejectedAtStartup() {
    props.getTwilio().setAuthToken(null);

    assertThrows(NullPointerException.class, () -> sender(1600));
  }
}
