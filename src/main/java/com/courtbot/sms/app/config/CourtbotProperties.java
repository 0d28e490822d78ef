package com.courtbot.sms.app.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed {@code courtbot.*} settings. {@code application.yml} maps the environment variables
 * {@code QUEUE_TTL_DAYS} and {@code COURT_PUBLIC_URL} onto these.
 */
@Data
@ConfigurationProperties(prefix = "courtbot")
public class CourtbotProperties {

  /** What the sweep does when a queued lookup runs out of time. */
  public enum ExpiryPolicy {
    NOTIFY,
    DROP
  }

  /** How long a queued lookup keeps being checked. */
  private int queueTtlDays = 10;

  /** Court website quoted in replies. */
  private String courtPublicUrl = "";

  private int citationMinLength = 6;

  private int citationMaxLength = 25;

  /** Bound on lock waits, DynamoDB calls and outbound SMS calls. */
  private Duration storeTimeout = Duration.ofSeconds(5);

  private int smsSegmentLimit = 1600;

  private ExpiryPolicy expiryPolicy = ExpiryPolicy.NOTIFY;

  private State state = new State();

  private Twilio twilio = new Twilio();

  @Data
  public static class State {
    /** memory | dynamodb. */
    private String store = "memory";

    private String table = "CourtbotConversationState";
  }

  @Data
  public static class Twilio {
    private boolean enabled;
    private String baseUrl = "https://api.twilio.com";
    private String accountSid;
    private String authToken;
    private String fromNumber;
  }
}
