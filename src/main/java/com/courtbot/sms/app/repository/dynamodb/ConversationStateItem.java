package com.courtbot.sms.app.repository.dynamodb;

import java.time.Instant;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.extensions.annotations.DynamoDbVersionAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** DynamoDB row for one sender's dialogue state. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ConversationStateItem {

  /** Partition key: sender phone number. */
  private String phone;

  /** NONE | AWAITING_REMINDER_CONFIRM | AWAITING_QUEUE_CONFIRM. */
  private String pendingQuestion;

  /** JSON snapshot of the case offered for a reminder. */
  private String matchedCaseJson;

  private String pendingCitationText;

  private String queuedLookupId;

  /** Maintained by the enhanced client's versioned-record extension. */
  private Long version;

  private Instant updatedAt;

  // ---------- DynamoDB mapping ----------

  @DynamoDbPartitionKey
  @DynamoDbAttribute("phone")
  public String getPhone() {
    return phone;
  }

  @DynamoDbAttribute("pendingQuestion")
  public String getPendingQuestion() {
    return pendingQuestion;
  }

  @DynamoDbAttribute("matchedCaseJson")
  public String getMatchedCaseJson() {
    return matchedCaseJson;
  }

  @DynamoDbAttribute("pendingCitationText")
  public String getPendingCitationText() {
    return pendingCitationText;
  }

  @DynamoDbAttribute("queuedLookupId")
  public String getQueuedLookupId() {
    return queuedLookupId;
  }

  @DynamoDbVersionAttribute
  @DynamoDbAttribute("version")
  public Long getVersion() {
    return version;
  }

  @DynamoDbAttribute("updatedAt")
  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
