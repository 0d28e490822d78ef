package com.courtbot.sms.app.repository.dynamodb;

import com.courtbot.sms.app.exception.StoreUnavailableException;
import com.courtbot.sms.app.model.ConversationState;
import com.courtbot.sms.app.model.PendingQuestion;
import com.courtbot.sms.app.repository.ConversationStateRepository;
import com.courtbot.sms.app.util.CaseSnapshotCodec;
import com.courtbot.sms.app.util.PhoneMasker;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.*;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * Conversation state over an Enhanced DynamoDB table keyed by phone number.
 *
 * <p>Writes are version-checked, so two service instances handling the same sender cannot both
 * commit a next state computed from the same previous one; the loser gets a {@link
 * StoreUnavailableException} and the sender an apology.
 */
@Log4j2
public class DynamoDbConversationStateRepository implements ConversationStateRepository {

  private final DynamoDbTable<ConversationStateItem> table;
  private final CaseSnapshotCodec codec;
  private final Clock clock;

  public DynamoDbConversationStateRepository(
      DynamoDbEnhancedClient enhanced, String tableName, CaseSnapshotCodec codec, Clock clock) {
    this.table = enhanced.table(tableName, TableSchema.fromBean(ConversationStateItem.class));
    this.codec = Objects.requireNonNull(codec, "codec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<ConversationState> find(String phone) {
    if (phone == null) return Optional.empty();
    try {
      ConversationStateItem item = table.getItem(Key.builder().partitionValue(phone).build());
      return Optional.ofNullable(item).map(this::toState);
    } catch (SdkException e) {
      throw new StoreUnavailableException("Failed to load conversation state", e);
    }
  }

  @Override
  public ConversationState save(ConversationState state) {
    Objects.requireNonNull(state, "state");
    ConversationStateItem item = toItem(state);
    item.setUpdatedAt(clock.instant());
    ConversationStateItem saved;
    try {
      // updateItem returns the stored row, including the version the extension assigned
      saved = table.updateItem(item);
    } catch (ConditionalCheckFailedException e) {
      throw new StoreUnavailableException(
          "Conversation state for " + PhoneMasker.mask(state.getPhone()) + " changed concurrently",
          e);
    } catch (SdkException e) {
      throw new StoreUnavailableException("Failed to save conversation state", e);
    }
    log.debug(
        "convstate.save phone={} pending={} version={}",
        PhoneMasker.mask(saved.getPhone()),
        saved.getPendingQuestion(),
        saved.getVersion());
    return toState(saved);
  }

  // -------- Internals --------

  private ConversationStateItem toItem(ConversationState s) {
    return ConversationStateItem.builder()
        .phone(s.getPhone())
        .pendingQuestion(
            (s.getPendingQuestion() == null ? PendingQuestion.NONE : s.getPendingQuestion()).name())
        .matchedCaseJson(codec.toJson(s.getMatchedCase()))
        .pendingCitationText(s.getPendingCitationText())
        .queuedLookupId(s.getQueuedLookupId())
        .version(s.getVersion())
        .updatedAt(s.getUpdatedAt())
        .build();
  }

  private static PendingQuestion parsePendingQuestion(ConversationStateItem item) {
    if (item.getPendingQuestion() == null) return PendingQuestion.NONE;
    try {
      return PendingQuestion.valueOf(item.getPendingQuestion());
    } catch (IllegalArgumentException e) {
      throw new StoreUnavailableException(
          "Conversation state for "
              + PhoneMasker.mask(item.getPhone())
              + " has unknown question "
              + item.getPendingQuestion(),
          e);
    }
  }

  private ConversationState toState(ConversationStateItem item) {
    return ConversationState.builder()
        .phone(item.getPhone())
        .pendingQuestion(parsePendingQuestion(item))
        .matchedCase(codec.fromJson(item.getMatchedCaseJson()))
        .pendingCitationText(item.getPendingCitationText())
        .queuedLookupId(item.getQueuedLookupId())
        .version(item.getVersion())
        .updatedAt(item.getUpdatedAt())
        .build();
  }
}
