/**
 * AWS configuration package for the court SMS service.
 *
 * <p>Contains Spring configuration classes that provide the DynamoDB client used for conversation
 * state.
 */
package com.courtbot.sms.app.config;

import com.courtbot.sms.app.repository.ConversationStateRepository;
import com.courtbot.sms.app.repository.dynamodb.DynamoDbConversationStateRepository;
import com.courtbot.sms.app.util.CaseSnapshotCodec;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * AWS configuration for the production profile.
 *
 * <p>Conversation state is kept in DynamoDB so a pending reminder or queue question survives a
 * restart or a move to another instance. Active only with the {@code production} profile and
 * {@code courtbot.state.store=dynamodb}.
 */
@Configuration
@Profile("production")
@ConditionalOnProperty(prefix = "courtbot.state", name = "store", havingValue = "dynamodb")
public class AwsProdConfig {

  /**
   * AWS region in which the clients will operate. Injected from the application configuration
   * property {@code aws.region}.
   */
  @Value("${aws.region}")
  private String region;

  /**
   * Creates an Amazon DynamoDB client using the default credentials provider.
   *
   * @return a configured {@link DynamoDbClient} for the specified AWS region.
   */
  @Bean(destroyMethod = "close")
  public DynamoDbClient dynamoDbClient(CourtbotProperties props) {
    return DynamoDbClient.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .overrideConfiguration(
            ClientOverrideConfiguration.builder().apiCallTimeout(props.getStoreTimeout()).build())
        .build();
  }

  @Bean
  public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient ddb) {
    return DynamoDbEnhancedClient.builder().dynamoDbClient(ddb).build();
  }

  @Bean
  public ConversationStateRepository dynamoDbConversationStateRepository(
      DynamoDbEnhancedClient enhanced,
      CourtbotProperties props,
      CaseSnapshotCodec codec,
      Clock clock) {
    return new DynamoDbConversationStateRepository(
        enhanced, props.getState().getTable(), codec, clock);
  }
}
