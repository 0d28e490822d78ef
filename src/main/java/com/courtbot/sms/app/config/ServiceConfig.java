package com.courtbot.sms.app.config;

import com.courtbot.sms.app.repository.CitationStore;
import com.courtbot.sms.app.repository.ConversationStateRepository;
import com.courtbot.sms.app.repository.SubscriptionStore;
import com.courtbot.sms.app.service.*;
import com.courtbot.sms.app.util.CaseSnapshotCodec;
import com.courtbot.sms.app.util.SenderLockRegistry;
import com.courtbot.sms.app.util.SmsSegmenter;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Log4j2
@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final CourtbotProperties props;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public CaseSnapshotCodec caseSnapshotCodec(ObjectMapper objectMapper) {
    return new CaseSnapshotCodec(objectMapper);
  }

  @Bean
  public SmsSegmenter smsSegmenter() {
    return new SmsSegmenter(props.getSmsSegmentLimit());
  }

  @Bean
  public SenderLockRegistry senderLockRegistry() {
    return new SenderLockRegistry(props.getStoreTimeout());
  }

  @Bean
  public ReplyTemplates replyTemplates() {
    return new ReplyTemplates(props);
  }

  // -------------------
  // Notifications
  // -------------------

  @Bean
  @ConditionalOnProperty(prefix = "courtbot.twilio", name = "enabled", havingValue = "true")
  public NotificationSender twilioSmsSender(WebClient.Builder builder, SmsSegmenter segmenter) {
    return new TwilioSmsSender(builder, props, segmenter);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "courtbot.twilio",
      name = "enabled",
      havingValue = "false",
      matchIfMissing = true)
  public NotificationSender loggingNotificationSender(SmsSegmenter segmenter) {
    return new LoggingNotificationSender(segmenter);
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public CitationMatcher citationMatcher(CitationStore citationStore) {
    return new CitationMatcher(citationStore, props);
  }

  @Bean
  public DialogueService dialogueService(
      CitationMatcher matcher,
      ConversationStateRepository states,
      SubscriptionStore subscriptions,
      SenderLockRegistry locks,
      ReplyTemplates templates,
      Clock clock) {
    return new DialogueService(matcher, states, subscriptions, locks, templates, props, clock);
  }

  @Bean
  public QueueSweepService queueSweepService(
      SubscriptionStore subscriptions,
      CitationMatcher matcher,
      NotificationSender sender,
      ReplyTemplates templates,
      Clock clock) {
    return new QueueSweepService(subscriptions, matcher, sender, templates, props, clock);
  }

  @Bean
  public CaseSearchService caseSearchService(CitationStore citationStore) {
    return new CaseSearchService(citationStore);
  }
}
