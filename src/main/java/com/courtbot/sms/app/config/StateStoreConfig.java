package com.courtbot.sms.app.config;

import com.courtbot.sms.app.repository.ConversationStateRepository;
import com.courtbot.sms.app.repository.InMemoryConversationStateRepository;
import java.time.Clock;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Picks the conversation state store. {@code memory} is the default; {@code dynamodb} is built by
 * {@link AwsLocalConfig} or {@link AwsProdConfig} and so needs the {@code local} or {@code
 * production} profile.
 */
@Log4j2
@Configuration
public class StateStoreConfig {

  @Bean
  @ConditionalOnProperty(
      prefix = "courtbot.state",
      name = "store",
      havingValue = "memory",
      matchIfMissing = true)
  public ConversationStateRepository inMemoryConversationStateRepository(Clock clock) {
    log.info("Conversation state kept in memory; open offers are rebuilt from queued lookups");
    return new InMemoryConversationStateRepository(clock);
  }

  @Bean
  @Profile("!local & !production")
  @ConditionalOnProperty(prefix = "courtbot.state", name = "store", havingValue = "dynamodb")
  public ConversationStateRepository unconfiguredDynamoDbConversationStateRepository() {
    throw new IllegalStateException(
        "courtbot.state.store=dynamodb needs the 'local' or 'production' profile to configure the"
            + " DynamoDB client; activate one of them or set courtbot.state.store=memory");
  }
}
