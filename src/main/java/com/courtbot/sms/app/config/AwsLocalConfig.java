/**
 * AWS configuration package for the court SMS service.
 *
 * <p>Contains Spring configuration classes for AWS client beans.
 */
package com.courtbot.sms.app.config;

import com.courtbot.sms.app.repository.ConversationStateRepository;
import com.courtbot.sms.app.repository.dynamodb.DynamoDbConversationStateRepository;
import com.courtbot.sms.app.util.CaseSnapshotCodec;
import java.net.URI;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * AWS configuration for the local environment.
 *
 * <p>Points the DynamoDB client at a DynamoDB Local endpoint with static credentials from the
 * application properties. Active only with the {@code local} profile and {@code
 * courtbot.state.store=dynamodb}.
 */
@Configuration
@Profile("local")
@ConditionalOnProperty(prefix = "courtbot.state", name = "store", havingValue = "dynamodb")
public class AwsLocalConfig {

  /** AWS region in which the clients will operate. */
  @Value("${aws.region:us-east-1}")
  private String region;

  /** AWS access key ID for local development. */
  @Value("${aws.accessKeyId:local}")
  private String accessKeyId;

  /** AWS secret access key for local development. */
  @Value("${aws.secretAccessKey:local}")
  private String secretAccessKey;

  @Value("${aws.dynamodb.endpoint:http://localhost:8000}")
  private String endpoint;

  /**
   * Creates an Amazon DynamoDB client against the local endpoint.
   *
   * @return a configured {@link DynamoDbClient}
   */
  @Bean(destroyMethod = "close")
  public DynamoDbClient dynamoDbClient(CourtbotProperties props) {
    return DynamoDbClient.builder()
        .region(Region.of(region))
        .endpointOverride(URI.create(endpoint))
        .credentialsProvider(
            StaticCredentialsProvider.create(
                AwsBasicCredentials.create(accessKeyId, secretAccessKey)))
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
